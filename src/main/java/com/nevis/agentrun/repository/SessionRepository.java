package com.nevis.agentrun.repository;

import com.nevis.agentrun.model.Session;
import com.nevis.agentrun.model.SessionUpdate;

import java.util.Map;
import java.util.Optional;

public interface SessionRepository {
    Optional<Session> findByOwnerId(String ownerId);
    Session upsert(String ownerId, SessionUpdate update);

    /**
     * Replaces credential data only if the stored credential version still equals {@code expectedVersion}.
     */
    boolean updateCredentials(String ownerId, Map<String, Object> credentialData, long expectedVersion);

    boolean markLoggedOut(String ownerId);
}

package com.nevis.agentrun.service;

import com.nevis.agentrun.model.Session;
import com.nevis.agentrun.model.SessionUpdate;

import java.util.Optional;
import java.util.Set;

public interface SessionService {
    Session get(String ownerId);
    Optional<Session> find(String ownerId);
    Session upsert(String ownerId, SessionUpdate update);

    /**
     * The subset of {@code requested} the owner has actually granted. Unknown owners get the empty set.
     */
    Set<String> scopeFilter(String ownerId, Set<String> requested);

    Set<String> authorizedScopes(String ownerId);

    /**
     * Refreshes credentials unless another caller already did so since {@code seenVersion} was read.
     */
    Session refreshCredentials(String ownerId, long seenVersion);

    void logout(String ownerId);
}

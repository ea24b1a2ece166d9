package com.nevis.agentrun.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Set;

public record Session(
    String ownerId,
    Map<String, Object> credentialData,
    long credentialVersion,
    Set<String> requestedScopes,
    Set<String> grantedScopes,
    boolean authenticated,
    Map<String, Object> profile,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {
    public Session {
        credentialData = credentialData == null ? Map.of() : credentialData;
        requestedScopes = requestedScopes == null ? Set.of() : Set.copyOf(requestedScopes);
        grantedScopes = grantedScopes == null ? Set.of() : Set.copyOf(grantedScopes);
        profile = profile == null ? Map.of() : profile;
    }
}

package com.nevis.agentrun.toolkit;

import java.util.Map;
import java.util.Set;

/**
 * Credentials and the scopes the toolkit may use for a single run.
 */
public record ToolkitCredentials(
    String ownerId,
    Map<String, Object> credentialData,
    Set<String> allowedScopes
) {
    public ToolkitCredentials {
        credentialData = credentialData == null ? Map.of() : credentialData;
        allowedScopes = allowedScopes == null ? Set.of() : Set.copyOf(allowedScopes);
    }
}

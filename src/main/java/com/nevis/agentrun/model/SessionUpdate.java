package com.nevis.agentrun.model;

import java.util.Map;
import java.util.Set;

/**
 * Partial session write. Null components leave the stored value untouched.
 */
public record SessionUpdate(
    Map<String, Object> credentialData,
    Set<String> requestedScopes,
    Set<String> grantedScopes,
    Boolean authenticated,
    Map<String, Object> profile
) {
    public static SessionUpdate credentials(Map<String, Object> credentialData) {
        return new SessionUpdate(credentialData, null, null, null, null);
    }

    public Session applyTo(Session current) {
        boolean credentialsChanged = credentialData != null;
        return new Session(
            current.ownerId(),
            credentialsChanged ? credentialData : current.credentialData(),
            credentialsChanged ? current.credentialVersion() + 1 : current.credentialVersion(),
            requestedScopes != null ? requestedScopes : current.requestedScopes(),
            grantedScopes != null ? grantedScopes : current.grantedScopes(),
            authenticated != null ? authenticated : current.authenticated(),
            profile != null ? profile : current.profile(),
            current.createdAt(),
            current.updatedAt()
        );
    }
}

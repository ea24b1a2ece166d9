package com.nevis.agentrun.oauth;

import java.util.Map;

/**
 * Exchanges a stored refresh token for new credential data.
 */
public interface CredentialRefresher {

    Map<String, Object> refresh(String ownerId, Map<String, Object> currentCredentials);
}

package com.nevis.agentrun.toolkit;

import java.util.Map;

/**
 * Performs the actual agent run on behalf of a user.
 *
 * <p>Implementations signal transient failures with
 * {@link com.nevis.agentrun.exception.RetriableExecutionException} (including
 * {@link com.nevis.agentrun.exception.CredentialExpiredException}) and permanent ones with
 * {@link com.nevis.agentrun.exception.FatalExecutionException}.</p>
 */
public interface Toolkit {

    ToolkitResult execute(String input, Map<String, String> envContext, ToolkitCredentials credentials);
}

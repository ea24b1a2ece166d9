package com.nevis.agentrun.exception;

public class CredentialExpiredException extends RetriableExecutionException {

    public CredentialExpiredException(String message) {
        super(message);
    }
}

package com.nevis.agentrun.exception;

import lombok.Getter;

@Getter
public class SessionNotAuthenticatedException extends RuntimeException {
    private final String ownerId;

    public SessionNotAuthenticatedException(String ownerId) {
        super("User not authenticated. Please complete the authorization flow first.");
        this.ownerId = ownerId;
    }
}

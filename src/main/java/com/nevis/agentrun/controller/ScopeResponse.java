package com.nevis.agentrun.controller;

import com.nevis.agentrun.model.Scope;

public record ScopeResponse(
    String name,
    String scope,
    String description
) {
    public static ScopeResponse from(Scope scope) {
        return new ScopeResponse(scope.getScopeName(), scope.getUri(), scope.getDescription());
    }
}

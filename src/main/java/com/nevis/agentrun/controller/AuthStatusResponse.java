package com.nevis.agentrun.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AuthStatusResponse(
    boolean authenticated,

    @JsonProperty("requested_scopes")
    List<String> requestedScopes,

    @JsonProperty("granted_scopes")
    List<String> grantedScopes,

    @JsonProperty("authorized_scopes")
    List<String> authorizedScopes
) {}

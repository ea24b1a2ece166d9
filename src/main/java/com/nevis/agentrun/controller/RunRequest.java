package com.nevis.agentrun.controller;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record RunRequest(
    @NotBlank
    String message,

    Map<String, String> env
) {}

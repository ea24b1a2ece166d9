package com.nevis.agentrun.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.oauth")
public record OAuthProperties(
	@NotBlank String tokenUri,
	String clientId,
	String clientSecret
) {}

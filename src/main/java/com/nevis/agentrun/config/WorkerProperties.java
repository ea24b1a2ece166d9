package com.nevis.agentrun.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Map;

/**
 * Worker pool and retry policy. {@code queues} maps each queue name to the number of pull loops serving it.
 */
@Validated
@ConfigurationProperties(prefix = "app.worker")
public record WorkerProperties(
	@DefaultValue("true") boolean enabled,
	@NotEmpty Map<String, @NotNull @Min(1) Integer> queues,
	@DefaultValue("3") @Min(1) @Max(20) int maxAttempts,
	@DefaultValue("2s") @NotNull Duration initialBackoff,
	@DefaultValue("2.0") @DecimalMin("1.01") double backoffMultiplier,
	@DefaultValue("30s") @NotNull Duration maxBackoff,
	@DefaultValue("30m") @NotNull Duration staleTimeout,
	@DefaultValue("3") @Min(1) int maxClaims,
	@DefaultValue("1s") @NotNull Duration pollWait,
	@DefaultValue("5s") @NotNull Duration redeliveryDelay,
	@DefaultValue("2m") @NotNull Duration reconcileAfter
) {
	public int totalConcurrency() {
		return queues.values().stream().mapToInt(Integer::intValue).sum();
	}
}

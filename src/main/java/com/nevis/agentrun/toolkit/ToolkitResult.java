package com.nevis.agentrun.toolkit;

import com.nevis.agentrun.model.UsageMetrics;

public record ToolkitResult(
    String result,
    UsageMetrics usage
) {}

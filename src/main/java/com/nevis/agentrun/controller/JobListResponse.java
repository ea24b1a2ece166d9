package com.nevis.agentrun.controller;

import java.util.List;

public record JobListResponse(
    List<JobResponse> jobs,
    int total,
    int limit,
    int offset
) {}

package com.nevis.agentrun.service;

import com.nevis.agentrun.model.Job;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public interface JobService {
    Job submit(String ownerId, String input, Map<String, String> envContext);
    Job get(UUID jobId, String ownerId);
    List<Job> list(String ownerId);
}

package com.nevis.agentrun.controller;

import com.nevis.agentrun.model.Job;
import com.nevis.agentrun.service.JobService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;
import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class JobController {

    private final JobService jobService;

    @PostMapping("/run")
    public ResponseEntity<RunResponse> run(@Valid @RequestBody RunRequest request, Principal principal) {
        Job job = jobService.submit(principal.getName(), request.message(), request.env());
        RunResponse response = new RunResponse(job.id(), job.status(), "Task has been queued for processing");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping("/result/{jobId}")
    public ResponseEntity<JobResponse> result(@PathVariable UUID jobId, Principal principal) {
        return ResponseEntity.ok(JobResponse.from(jobService.get(jobId, principal.getName())));
    }

    @GetMapping("/jobs")
    public ResponseEntity<JobListResponse> jobs(
        @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
        @RequestParam(defaultValue = "0") @Min(0) int offset,
        Principal principal
    ) {
        List<Job> jobs = jobService.list(principal.getName());
        List<JobResponse> page = jobs.stream()
            .skip(offset)
            .limit(limit)
            .map(JobResponse::from)
            .toList();
        return ResponseEntity.ok(new JobListResponse(page, jobs.size(), limit, offset));
    }
}

package com.nevis.agentrun.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum JobErrorKind {
    RETRIES_EXHAUSTED(true),
    NON_RETRIABLE(false),
    WORKER_LOST(true);

    private final boolean resubmittable;
}

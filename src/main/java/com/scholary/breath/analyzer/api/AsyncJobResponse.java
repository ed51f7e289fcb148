package com.scholary.breath.analyzer.api;

/** Response for an async analysis request: the job ID to poll. */
public record AsyncJobResponse(String jobId) {}

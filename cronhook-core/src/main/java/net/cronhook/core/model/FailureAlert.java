package net.cronhook.core.model;

import java.time.Instant;

public record FailureAlert(
        String type,
        String jobId,
        String targetUrl,
        Instant timestamp,
        Integer httpStatusCode,
        long durationMillis,
        String errorMessage
) {
    public static final String JOB_FAILURE = "JOB_FAILURE";

    public static FailureAlert of(JobRecord job, ExecutionOutcome outcome, Instant now) {
        return new FailureAlert(JOB_FAILURE, job.jobId(), job.targetUrl(), now,
                outcome.httpStatusCode(), outcome.durationMillis(), outcome.errorMessage());
    }
}

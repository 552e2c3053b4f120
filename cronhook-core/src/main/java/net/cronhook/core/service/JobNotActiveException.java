package net.cronhook.core.service;

public class JobNotActiveException extends IllegalStateException {
    public JobNotActiveException(String jobId) {
        super("Job not found in active scheduler: " + jobId);
    }
}

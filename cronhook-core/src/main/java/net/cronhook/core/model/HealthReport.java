package net.cronhook.core.model;

import java.time.Instant;

public record HealthReport(
        boolean running,
        int activeJobs,
        Instant timestamp
) {
    public String status() {
        return running ? "healthy" : "stopped";
    }
}

package net.cronhook.core.model;

public record ExecutionStats(
        long total,
        long success,
        long failure,
        double averageDurationMillis
) {
    public static ExecutionStats empty() {
        return new ExecutionStats(0, 0, 0, 0.0);
    }
}

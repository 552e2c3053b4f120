package net.cronhook.core.model;

/**
 * 스케줄러 누적 지표 스냅샷.
 * averageDriftMillis 는 모든 발화의 max(0, drift) 평균이다 (조기 발화는 0으로 계산).
 */
public record SchedulerMetrics(
        long totalExecutions,
        long successCount,
        long failureCount,
        double averageDriftMillis,
        int activeJobs
) {
    /** 성공률(%). 실행이 없으면 0 */
    public double successRate() {
        return totalExecutions == 0 ? 0.0 : successCount * 100.0 / totalExecutions;
    }
}

package net.cronhook.core.service;

import net.cronhook.core.model.ExecutionOutcome;
import net.cronhook.core.model.SchedulerMetrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 발화/완료 콜백이 여러 스레드에서 동시에 들어온다.
 * 발화 수와 drift 합은 같은 락 안에서, 성공/실패 수는 원자 카운터로 갱신한다.
 */
final class SchedulerMetricsRecorder {
    private final Object lock = new Object();
    private long totalExecutions;
    private long driftSumMillis;

    private final AtomicLong success = new AtomicLong();
    private final AtomicLong failure = new AtomicLong();

    /** 음수 drift 는 0 으로 보고 평균에 넣는다 */
    void recordFire(long driftMillis) {
        synchronized (lock) {
            totalExecutions++;
            driftSumMillis += Math.max(0, driftMillis);
        }
    }

    void recordOutcome(ExecutionOutcome outcome) {
        if (outcome.success()) success.incrementAndGet(); else failure.incrementAndGet();
    }

    void recordFailure() {
        failure.incrementAndGet();
    }

    SchedulerMetrics snapshot(int activeJobs) {
        long total;
        double avg;
        synchronized (lock) {
            total = totalExecutions;
            avg = total == 0 ? 0.0 : (double) driftSumMillis / total;
        }
        return new SchedulerMetrics(total, success.get(), failure.get(), avg, activeJobs);
    }
}

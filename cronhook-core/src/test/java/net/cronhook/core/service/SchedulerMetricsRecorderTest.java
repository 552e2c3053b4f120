package net.cronhook.core.service;

import net.cronhook.core.model.ExecutionOutcome;
import net.cronhook.core.model.SchedulerMetrics;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerMetricsRecorderTest {

    @Test
    void empty_snapshot_isAllZero() {
        SchedulerMetrics m = new SchedulerMetricsRecorder().snapshot(0);
        assertEquals(0, m.totalExecutions());
        assertEquals(0.0, m.averageDriftMillis());
        assertEquals(0.0, m.successRate());
    }

    @Test
    void earlyFirings_countAsZeroDrift() {
        SchedulerMetricsRecorder r = new SchedulerMetricsRecorder();
        r.recordFire(100);
        r.recordFire(-40);
        r.recordFire(200);

        SchedulerMetrics m = r.snapshot(3);
        assertEquals(3, m.totalExecutions());
        assertEquals(100.0, m.averageDriftMillis());
        assertEquals(3, m.activeJobs());
    }

    @Test
    void outcomes_splitIntoSuccessAndFailure() {
        SchedulerMetricsRecorder r = new SchedulerMetricsRecorder();
        for (int i = 0; i < 4; i++) r.recordFire(0);
        r.recordOutcome(outcome(ExecutionOutcome.Status.SUCCESS));
        r.recordOutcome(outcome(ExecutionOutcome.Status.SUCCESS));
        r.recordOutcome(outcome(ExecutionOutcome.Status.SUCCESS));
        r.recordFailure();

        SchedulerMetrics m = r.snapshot(1);
        assertEquals(3, m.successCount());
        assertEquals(1, m.failureCount());
        assertEquals(75.0, m.successRate());
    }

    @Test
    void concurrentUpdates_areNotLost() throws Exception {
        SchedulerMetricsRecorder r = new SchedulerMetricsRecorder();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 8; i++) {
                pool.execute(() -> {
                    for (int j = 0; j < 1000; j++) {
                        r.recordFire(10);
                        r.recordOutcome(outcome(ExecutionOutcome.Status.SUCCESS));
                    }
                });
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }

        SchedulerMetrics m = r.snapshot(0);
        assertEquals(8000, m.totalExecutions());
        assertEquals(8000, m.successCount());
        assertEquals(10.0, m.averageDriftMillis());
    }

    private static ExecutionOutcome outcome(ExecutionOutcome.Status status) {
        return new ExecutionOutcome("e", "j", Instant.EPOCH, status, 200, 1, null, 1);
    }
}

package net.cronhook.core.timer;

import net.cronhook.core.spi.TimerService;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** ScheduledThreadPoolExecutor 기반 기본 타이머 */
public final class ScheduledExecutorTimerService implements TimerService, AutoCloseable {
    private final ScheduledThreadPoolExecutor executor;

    public ScheduledExecutorTimerService(int threads) {
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1: " + threads);
        this.executor = new ScheduledThreadPoolExecutor(threads, daemonThreads("cronhook-timer-"));
        this.executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public TimerHandle schedule(Duration delay, Runnable task) {
        long millis = Math.max(0, delay.toMillis());
        ScheduledFuture<?> f = executor.schedule(task, millis, TimeUnit.MILLISECONDS);
        return () -> f.cancel(false);
    }

    /** 아직 실행 대기 중인 타이머 수 */
    int pending() {
        return executor.getQueue().size();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

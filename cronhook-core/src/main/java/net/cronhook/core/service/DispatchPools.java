package net.cronhook.core.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 디스패치/알림용 executor 팩토리.
 * <p>
 * 디스패치 풀은 큐 없이 필요한 만큼 스레드를 늘린다. 잡 하나가 스레드를 붙잡아도 다른 잡의 occurrence 가
 * 뒤에 줄 서지 않는다. 잡당 동시 실행 상한은 {@link JobScheduler} 가 건다.
 */
public final class DispatchPools {
    private static final Logger log = LoggerFactory.getLogger(DispatchPools.class);

    static final long IDLE_KEEP_ALIVE_SECONDS = 60;

    private DispatchPools() {}

    /** coreThreads 는 놀고 있어도 유지, 그 이상은 60초 유휴 후 회수 */
    public static ThreadPoolExecutor elastic(int coreThreads, ThreadFactory threads) {
        if (coreThreads < 0) throw new IllegalArgumentException("coreThreads must be >= 0: " + coreThreads);
        return new ThreadPoolExecutor(coreThreads, Integer.MAX_VALUE,
                IDLE_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
                new SynchronousQueue<>(), threads);
    }

    /** 단일 스레드 + 유한 큐. 가득 차면 가장 오래된 알림을 버린다. */
    public static ThreadPoolExecutor boundedAlerts(int queueCapacity, ThreadFactory threads) {
        if (queueCapacity < 1) throw new IllegalArgumentException("queueCapacity must be >= 1: " + queueCapacity);
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity), threads, dropOldest());
    }

    private static RejectedExecutionHandler dropOldest() {
        return (task, executor) -> {
            if (executor.isShutdown()) {
                log.debug("Alert executor shut down, alert discarded");
                return;
            }
            if (executor.getQueue().poll() != null) {
                log.warn("Alert queue full, dropped the oldest alert");
            }
            executor.execute(task);
        };
    }
}

package net.cronhook.core.spi;

import java.time.Duration;

public interface TimerService {
    /** delay 후 task 1회 실행 */
    TimerHandle schedule(Duration delay, Runnable task);

    @FunctionalInterface
    interface TimerHandle {
        /** 아직 실행 전이면 취소. 이미 실행 중인 task 는 중단하지 않는다. */
        boolean cancel();
    }
}

package net.cronhook.integration.spring.sched;

import net.cronhook.core.service.JobScheduler;
import org.springframework.context.SmartLifecycle;

/** 컨텍스트 기동/종료에 스케줄러 start/stop 을 맞춘다 */
public class SchedulerLifecycle implements SmartLifecycle {
    private final JobScheduler scheduler;

    public SchedulerLifecycle(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        scheduler.start();
    }

    @Override
    public void stop() {
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }
}

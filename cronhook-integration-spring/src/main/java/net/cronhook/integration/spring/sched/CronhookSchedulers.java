package net.cronhook.integration.spring.sched;

import net.cronhook.core.maintenance.RetentionService;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

public class CronhookSchedulers {
    private final RetentionService retention;

    private Duration executionTtl = Duration.ofDays(30);

    public CronhookSchedulers(RetentionService retention) {
        this.retention = retention;
    }

    @Scheduled(initialDelayString = "${cronhook.retention.delay-ms:60000}",
               fixedDelayString = "${cronhook.retention.delay-ms:60000}")
    public void retention() throws Exception {
        retention.runOnce(executionTtl);
    }

    public void setExecutionTtl(Duration executionTtl) {
        this.executionTtl = executionTtl;
    }
}

package net.cronhook.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("cronhook")
public class CronhookProperties {
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private Dispatch dispatch = new Dispatch();
    private Retention retention = new Retention();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public void setDispatch(Dispatch dispatch) {
        this.dispatch = dispatch;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int timerThreads = 2;
        private int dispatchThreads = 8;         // 상시 유지 스레드. 부족하면 풀이 늘어난다
        private int maxInFlightPerJob = 4;
        private Duration maxTimerDelay = Duration.ofMillis(Integer.MAX_VALUE);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTimerThreads() {
            return timerThreads;
        }

        public void setTimerThreads(int timerThreads) {
            this.timerThreads = timerThreads;
        }

        public int getDispatchThreads() {
            return dispatchThreads;
        }

        public void setDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
        }

        public int getMaxInFlightPerJob() {
            return maxInFlightPerJob;
        }

        public void setMaxInFlightPerJob(int maxInFlightPerJob) {
            this.maxInFlightPerJob = maxInFlightPerJob;
        }

        public Duration getMaxTimerDelay() {
            return maxTimerDelay;
        }

        public void setMaxTimerDelay(Duration maxTimerDelay) {
            this.maxTimerDelay = maxTimerDelay;
        }
    }

    public static class Dispatch {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private Duration baseBackoff = Duration.ofSeconds(1);
        private int alertQueueCapacity = 256;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseBackoff() {
            return baseBackoff;
        }

        public void setBaseBackoff(Duration baseBackoff) {
            this.baseBackoff = baseBackoff;
        }

        public int getAlertQueueCapacity() {
            return alertQueueCapacity;
        }

        public void setAlertQueueCapacity(int alertQueueCapacity) {
            this.alertQueueCapacity = alertQueueCapacity;
        }
    }

    public static class Retention {
        private boolean enabled = true;
        private Duration executionTtl = Duration.ofDays(30);
        private long delayMs = 60000;   // @Scheduled 는 cronhook.retention.delay-ms 를 직접 읽는다

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getExecutionTtl() {
            return executionTtl;
        }

        public void setExecutionTtl(Duration executionTtl) {
            this.executionTtl = executionTtl;
        }

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    public static class JobDef {
        private String name;
        private String schedule;
        private String targetUrl;
        private String deliveryMode = "AT_LEAST_ONCE";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public String getTargetUrl() {
            return targetUrl;
        }

        public void setTargetUrl(String targetUrl) {
            this.targetUrl = targetUrl;
        }

        public String getDeliveryMode() {
            return deliveryMode;
        }

        public void setDeliveryMode(String deliveryMode) {
            this.deliveryMode = deliveryMode;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", schedule='" + schedule + '\'' +
                    ", targetUrl='" + targetUrl + '\'' +
                    ", deliveryMode='" + deliveryMode + '\'' +
                    '}';
        }
    }
}

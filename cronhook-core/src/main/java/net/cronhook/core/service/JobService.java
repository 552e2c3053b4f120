package net.cronhook.core.service;

import net.cronhook.core.model.DeliveryMode;
import net.cronhook.core.model.ExecutionOutcome;
import net.cronhook.core.model.ExecutionStats;
import net.cronhook.core.model.HealthReport;
import net.cronhook.core.model.JobRecord;
import net.cronhook.core.model.JobUpdate;
import net.cronhook.core.model.SchedulerMetrics;
import net.cronhook.core.schedule.ScheduleParser;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.ExecutionRepository;
import net.cronhook.core.spi.JobRepository;
import net.cronhook.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/** API 계층이 호출하는 잡 관리 창구: 저장소와 스케줄러를 함께 움직인다. */
public final class JobService {
    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    public static final int DEFAULT_JOB_HISTORY = 5;
    public static final int DEFAULT_RECENT_EXECUTIONS = 100;

    private final JobRepository jobs;
    private final ExecutionRepository executions;
    private final JobScheduler scheduler;
    private final TxRunner tx;
    private final Clock clock;

    public JobService(JobRepository jobs,
                      ExecutionRepository executions,
                      JobScheduler scheduler,
                      TxRunner tx,
                      Clock clock) {
        this.jobs = jobs;
        this.executions = executions;
        this.scheduler = scheduler;
        this.tx = tx;
        this.clock = clock;
    }

    public JobRecord createJob(String schedule, String targetUrl, DeliveryMode mode) throws Exception {
        return createJob(schedule, targetUrl, mode, null);
    }

    /** 검증 → ACTIVE 로 저장 → 스케줄러가 돌고 있으면 무장 (멈춰 있으면 start 때 읽힌다) */
    public JobRecord createJob(String schedule, String targetUrl, DeliveryMode mode, String name) throws Exception {
        ScheduleParser.parse(schedule);
        validateTarget(targetUrl);
        if (mode == null) throw new IllegalArgumentException("deliveryMode is required");

        JobRecord job = JobRecord.ofNew(UUID.randomUUID().toString(), name, schedule.trim(), targetUrl, mode, clock.now());
        JobRecord saved = tx.required(() -> jobs.create(job));
        if (scheduler.isRunning()) scheduler.addJob(saved);
        log.info("Created job {} ({}) - {} {}", saved.jobId(), mode.code(), saved.rawSchedule(), saved.targetUrl());
        return saved;
    }

    public Optional<JobRecord> getJob(String jobId) throws Exception {
        return tx.required(() -> jobs.findById(jobId));
    }

    public List<JobRecord> listJobs() throws Exception {
        return tx.required(jobs::findAll);
    }

    public JobRecord updateJob(String jobId, JobUpdate update) throws Exception {
        requireJob(jobId);
        if (update.targetUrl() != null) validateTarget(update.targetUrl());
        return scheduler.updateJob(jobId, update);
    }

    /** soft delete 후 타이머 제거. 이미 진행 중인 호출은 끝까지 간다. */
    public void deleteJob(String jobId) throws Exception {
        requireJob(jobId);
        tx.run(() -> jobs.softDelete(jobId));
        scheduler.removeJob(jobId);
        log.info("Deleted job {}", jobId);
    }

    public List<ExecutionOutcome> recentExecutions(String jobId, int limit) throws Exception {
        requireJob(jobId);
        int n = limit > 0 ? limit : DEFAULT_JOB_HISTORY;
        return tx.required(() -> executions.findRecentByJob(jobId, n));
    }

    public List<ExecutionOutcome> recentExecutions(int limit) throws Exception {
        int n = limit > 0 ? limit : DEFAULT_RECENT_EXECUTIONS;
        return tx.required(() -> executions.findRecent(n));
    }

    public ExecutionStats executionStats(String jobId) throws Exception {
        requireJob(jobId);
        return tx.required(() -> executions.statsFor(jobId));
    }

    public SchedulerMetrics metrics() {
        return scheduler.getMetrics();
    }

    public HealthReport health() {
        return new HealthReport(scheduler.isRunning(), scheduler.activeJobCount(), clock.now());
    }

    private JobRecord requireJob(String jobId) throws Exception {
        return tx.required(() -> jobs.findById(jobId)).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /** 절대 http(s) URL 만 허용 */
    public static void validateTarget(String targetUrl) {
        if (targetUrl == null || targetUrl.isBlank()) throw new IllegalArgumentException("targetUrl is required");
        URI uri;
        try {
            uri = URI.create(targetUrl);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid targetUrl: " + targetUrl, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!uri.isAbsolute() || uri.getHost() == null || !(scheme.equals("http") || scheme.equals("https"))) {
            throw new IllegalArgumentException("targetUrl must be an absolute http(s) URL: " + targetUrl);
        }
    }
}

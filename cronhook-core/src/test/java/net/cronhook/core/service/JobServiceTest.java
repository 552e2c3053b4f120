package net.cronhook.core.service;

import net.cronhook.core.model.DeliveryMode;
import net.cronhook.core.model.ExecutionOutcome;
import net.cronhook.core.model.ExecutionStats;
import net.cronhook.core.model.HealthReport;
import net.cronhook.core.model.JobRecord;
import net.cronhook.core.model.JobStatus;
import net.cronhook.core.model.JobUpdate;
import net.cronhook.core.schedule.MalformedExpressionException;
import net.cronhook.core.schedule.NextExecutionCalculator;
import net.cronhook.core.spi.TxRunner;
import net.cronhook.core.testing.InMemoryExecutionRepository;
import net.cronhook.core.testing.InMemoryJobRepository;
import net.cronhook.core.testing.ManualClock;
import net.cronhook.core.testing.ManualTimerService;
import net.cronhook.core.testing.ScriptedTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    ManualClock clock;
    ManualTimerService timers;
    InMemoryJobRepository jobs;
    InMemoryExecutionRepository executions;
    JobScheduler scheduler;
    JobService service;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2026-10-18T00:00:00Z"));
        timers = new ManualTimerService(clock);
        jobs = new InMemoryJobRepository(clock);
        executions = new InMemoryExecutionRepository();
        ExecutionDispatcher dispatcher = new ExecutionDispatcher(
                ScriptedTransport.alwaysOk(), executions, TxRunner.direct(), RetryPolicy.linear(Duration.ofSeconds(1)),
                a -> { }, Runnable::run, d -> { }, clock, Duration.ofSeconds(30), 3);
        scheduler = new JobScheduler(jobs, TxRunner.direct(), new NextExecutionCalculator(ZoneOffset.UTC),
                dispatcher, timers, Runnable::run, clock, JobScheduler.DEFAULT_MAX_TIMER_DELAY);
        service = new JobService(jobs, executions, scheduler, TxRunner.direct(), clock);
        scheduler.start();
    }

    @Test
    void createJob_persistsActiveJob_andArmsIt() throws Exception {
        JobRecord job = service.createJob(" * * * * * * ", "http://localhost:9/hook", DeliveryMode.AT_LEAST_ONCE, "ping");

        assertNotNull(job.jobId());
        assertEquals(JobStatus.ACTIVE, job.status());
        assertEquals("* * * * * *", job.rawSchedule());
        assertEquals("ping", job.name());
        assertEquals(job, service.getJob(job.jobId()).orElseThrow());
        assertTrue(scheduler.nextFireTime(job.jobId()).isPresent());

        timers.advance(Duration.ofSeconds(3));
        assertEquals(3, service.recentExecutions(job.jobId(), 0).size());
    }

    @Test
    void createJob_withBadSchedule_persistsNothing() {
        assertThrows(MalformedExpressionException.class,
                () -> service.createJob("* * * *", "http://localhost:9/hook", DeliveryMode.NO_RETRY));
        assertTrue(jobs.findAll().isEmpty());
        assertEquals(0, scheduler.activeJobCount());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "not a url", "/relative/path", "ftp://host/file", "mailto:ops@example.com"})
    void createJob_withBadTarget_isRejected(String url) {
        assertThrows(IllegalArgumentException.class,
                () -> service.createJob("* * * * * *", url, DeliveryMode.NO_RETRY));
        assertTrue(jobs.findAll().isEmpty());
    }

    @Test
    void createJob_requiresDeliveryMode() {
        assertThrows(IllegalArgumentException.class,
                () -> service.createJob("* * * * * *", "https://example.com/hook", null));
    }

    @Test
    void deleteJob_softDeletes_andDisarms() throws Exception {
        JobRecord job = service.createJob("* * * * * *", "http://localhost:9/hook", DeliveryMode.NO_RETRY);

        service.deleteJob(job.jobId());
        timers.advance(Duration.ofSeconds(5));

        assertEquals(JobStatus.DELETED, service.getJob(job.jobId()).orElseThrow().status());
        assertEquals(0, scheduler.activeJobCount());
        assertTrue(executions.all().isEmpty());
    }

    @Test
    void updateJob_unknownId_throwsNotFound() {
        JobNotFoundException e = assertThrows(JobNotFoundException.class,
                () -> service.updateJob("missing", JobUpdate.schedule("0 * * * * *")));
        assertEquals("missing", e.jobId());
    }

    @Test
    void updateJob_deletedJob_isNotActive() throws Exception {
        JobRecord job = service.createJob("* * * * * *", "http://localhost:9/hook", DeliveryMode.NO_RETRY);
        service.deleteJob(job.jobId());

        assertThrows(JobNotActiveException.class,
                () -> service.updateJob(job.jobId(), JobUpdate.schedule("0 * * * * *")));
    }

    @Test
    void updateJob_withBadTarget_isRejected() throws Exception {
        JobRecord job = service.createJob("* * * * * *", "http://localhost:9/hook", DeliveryMode.NO_RETRY);
        assertThrows(IllegalArgumentException.class,
                () -> service.updateJob(job.jobId(), new JobUpdate(null, "nope", null)));
        assertEquals("http://localhost:9/hook", service.getJob(job.jobId()).orElseThrow().targetUrl());
    }

    @Test
    void updateJob_changesModeAndSchedule() throws Exception {
        JobRecord job = service.createJob("* * * * * *", "http://localhost:9/hook", DeliveryMode.NO_RETRY);
        clock.advance(Duration.ofMillis(100));

        JobRecord updated = service.updateJob(job.jobId(), new JobUpdate("30 * * * * *", null, DeliveryMode.AT_LEAST_ONCE));

        assertEquals("30 * * * * *", updated.rawSchedule());
        assertEquals(DeliveryMode.AT_LEAST_ONCE, updated.deliveryMode());
        assertEquals(job.createdAt(), updated.createdAt());
        assertTrue(updated.updatedAt().isAfter(job.updatedAt()));
    }

    @Test
    void executionQueries_forUnknownJob_throwNotFound() {
        assertThrows(JobNotFoundException.class, () -> service.recentExecutions("missing", 5));
        assertThrows(JobNotFoundException.class, () -> service.executionStats("missing"));
        assertThrows(JobNotFoundException.class, () -> service.deleteJob("missing"));
    }

    @Test
    void recentExecutions_newestFirst_andStats() throws Exception {
        JobRecord job = service.createJob("* * * * * *", "http://localhost:9/hook", DeliveryMode.NO_RETRY);
        timers.advance(Duration.ofSeconds(7));

        List<ExecutionOutcome> recent = service.recentExecutions(job.jobId(), 0);
        assertEquals(JobService.DEFAULT_JOB_HISTORY, recent.size());
        assertTrue(recent.get(0).occurrenceTimestamp().isAfter(recent.get(1).occurrenceTimestamp()));
        assertEquals(2, service.recentExecutions(job.jobId(), 2).size());
        assertEquals(7, service.recentExecutions(0).size());

        ExecutionStats stats = service.executionStats(job.jobId());
        assertEquals(7, stats.total());
        assertEquals(7, stats.success());
        assertEquals(0, stats.failure());
    }

    @Test
    void health_andMetrics_reflectScheduler() throws Exception {
        service.createJob("* * * * * *", "http://localhost:9/hook", DeliveryMode.NO_RETRY);
        timers.advance(Duration.ofSeconds(2));

        HealthReport h = service.health();
        assertTrue(h.running());
        assertEquals("healthy", h.status());
        assertEquals(1, h.activeJobs());
        assertEquals(clock.now(), h.timestamp());
        assertEquals(2, service.metrics().totalExecutions());

        scheduler.stop();
        assertEquals("stopped", service.health().status());
    }

    @Test
    void listJobs_includesDeleted() throws Exception {
        JobRecord a = service.createJob("* * * * * *", "http://localhost:9/a", DeliveryMode.NO_RETRY);
        clock.advance(Duration.ofSeconds(1));
        JobRecord b = service.createJob("* * * * * *", "http://localhost:9/b", DeliveryMode.NO_RETRY);
        service.deleteJob(a.jobId());

        List<JobRecord> all = service.listJobs();
        assertEquals(2, all.size());
        assertEquals(b.jobId(), all.get(0).jobId());
    }
}

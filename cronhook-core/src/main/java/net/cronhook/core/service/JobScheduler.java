package net.cronhook.core.service;

import net.cronhook.core.model.ExecutionOutcome;
import net.cronhook.core.model.JobRecord;
import net.cronhook.core.model.JobUpdate;
import net.cronhook.core.model.SchedulerMetrics;
import net.cronhook.core.schedule.NextExecutionCalculator;
import net.cronhook.core.schedule.NoExecutionFoundException;
import net.cronhook.core.schedule.ScheduleParser;
import net.cronhook.core.schedule.ScheduleSpec;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.JobRepository;
import net.cronhook.core.spi.TimerService;
import net.cronhook.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 잡마다 타이머 하나를 무장하고, 발화하면 디스패치를 넘긴 뒤 곧바로 다음 occurrence 를 무장한다.
 * <p>
 * 상태: unscheduled → armed → firing → armed, 또는 armed → cancelled(삭제).
 * 같은 jobId 에 대한 취소-재무장은 {@link ConcurrentMap#compute} 안에서만 일어나므로
 * 갱신과 발화가 같은 엔트리를 두고 경합하지 않는다. 다른 잡의 타이머는 서로 막지 않는다.
 * <p>
 * 잡마다 동시에 진행 중인 디스패치는 maxInFlightPerJob 개까지다. 넘치는 occurrence 는 전송하지 않고
 * 실패로 기록한다. 느린 잡이 디스패치 스레드를 무한정 쌓아 다른 잡을 굶기지 못하게 한다.
 */
public final class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    /** setTimeout 계열 플랫폼의 최대 지연 (2^31-1 ms) */
    public static final Duration DEFAULT_MAX_TIMER_DELAY = Duration.ofMillis(Integer.MAX_VALUE);
    public static final int DEFAULT_MAX_IN_FLIGHT_PER_JOB = 4;

    private final JobRepository jobs;
    private final TxRunner tx;
    private final NextExecutionCalculator calculator;
    private final ExecutionDispatcher dispatcher;
    private final TimerService timers;
    private final Executor dispatchExecutor;
    private final Clock clock;
    private final Duration maxTimerDelay;
    private final int maxInFlightPerJob;

    private final ConcurrentMap<String, ScheduledEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong generations = new AtomicLong();
    private final SchedulerMetricsRecorder metrics = new SchedulerMetricsRecorder();

    public JobScheduler(JobRepository jobs,
                        TxRunner tx,
                        NextExecutionCalculator calculator,
                        ExecutionDispatcher dispatcher,
                        TimerService timers,
                        Executor dispatchExecutor,
                        Clock clock,
                        Duration maxTimerDelay) {
        this(jobs, tx, calculator, dispatcher, timers, dispatchExecutor, clock, maxTimerDelay,
                DEFAULT_MAX_IN_FLIGHT_PER_JOB);
    }

    public JobScheduler(JobRepository jobs,
                        TxRunner tx,
                        NextExecutionCalculator calculator,
                        ExecutionDispatcher dispatcher,
                        TimerService timers,
                        Executor dispatchExecutor,
                        Clock clock,
                        Duration maxTimerDelay,
                        int maxInFlightPerJob) {
        if (maxTimerDelay.isZero() || maxTimerDelay.isNegative()) {
            throw new IllegalArgumentException("maxTimerDelay must be positive: " + maxTimerDelay);
        }
        if (maxInFlightPerJob < 1) {
            throw new IllegalArgumentException("maxInFlightPerJob must be >= 1: " + maxInFlightPerJob);
        }
        this.jobs = jobs;
        this.tx = tx;
        this.calculator = calculator;
        this.dispatcher = dispatcher;
        this.timers = timers;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
        this.maxTimerDelay = maxTimerDelay;
        this.maxInFlightPerJob = maxInFlightPerJob;
    }

    /** 활성 잡을 모두 읽어 무장한다. 이미 실행 중이면 아무것도 하지 않는다. */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.info("Scheduler already running");
            return;
        }
        log.info("Starting scheduler...");

        List<JobRecord> active;
        try {
            active = tx.required(jobs::findAllActive);
        } catch (Exception e) {
            running.set(false);
            log.error("Failed to load active jobs, scheduler not started", e);
            throw new IllegalStateException("Failed to load active jobs", e);
        }

        int armed = 0;
        for (JobRecord job : active) {
            try {
                addJob(job);
                armed++;
            } catch (RuntimeException e) {
                // 잡 하나의 실패가 나머지 로딩을 막지 않는다
                log.error("Error scheduling job {}: {}", job.jobId(), e.getMessage());
            }
        }
        log.info("Scheduler started - loaded {} active jobs ({} armed, zone {})", active.size(), armed, calculator.zone());
    }

    /** 모든 타이머 취소 + 엔트리 정리 */
    public void stop() {
        running.set(false);
        for (String jobId : List.copyOf(entries.keySet())) {
            ScheduledEntry removed = entries.remove(jobId);
            if (removed != null) removed.timer().cancel();
        }
        log.info("Scheduler stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 스케줄을 파싱하고 지금 기준 다음 시각으로 무장한다. 같은 jobId 의 기존 타이머는 먼저 취소한다.
     *
     * @throws net.cronhook.core.schedule.MalformedExpressionException 스케줄 형식 오류
     * @throws NoExecutionFoundException 1년 안에 실행 시각이 없음
     */
    public void addJob(JobRecord job) {
        ScheduleSpec spec = ScheduleParser.parse(job.rawSchedule());
        Instant now = clock.now();
        Instant next = calculator.nextExecution(now, spec);

        entries.compute(job.jobId(), (id, existing) -> {
            if (existing != null) existing.timer().cancel();
            return arm(job, spec, next, now);
        });
        log.info("Scheduled job {} - next execution: {}", job.jobId(), next);
    }

    /**
     * 저장소에 반영한 뒤 타이머를 교체한다. 메모리에 없는 잡이면 {@link JobNotActiveException}.
     * 새 스케줄은 저장 전에 검증하므로 형식 오류면 아무것도 바뀌지 않는다.
     */
    public JobRecord updateJob(String jobId, JobUpdate update) throws Exception {
        ScheduledEntry current = entries.get(jobId);
        if (current == null) throw new JobNotActiveException(jobId);

        ScheduleSpec spec = update.rawSchedule() != null ? ScheduleParser.parse(update.rawSchedule()) : current.spec();
        Instant now = clock.now();
        Instant next = calculator.nextExecution(now, spec);

        JobRecord updated = tx.required(() -> jobs.update(jobId, update));

        ScheduledEntry replaced = entries.compute(jobId, (id, existing) -> {
            if (existing == null) return null; // 그 사이 삭제됨
            existing.timer().cancel();
            return arm(updated, spec, next, now);
        });
        if (replaced == null) {
            log.warn("Job {} was removed while updating; not re-armed", jobId);
        } else {
            log.info("Updated job {} - next execution: {}", jobId, next);
        }
        return updated;
    }

    /** 모르는 id 면 no-op */
    public void removeJob(String jobId) {
        ScheduledEntry removed = entries.remove(jobId);
        inFlight.remove(jobId);
        if (removed != null) {
            removed.timer().cancel();
            log.info("Removed job {}", jobId);
        }
    }

    public SchedulerMetrics getMetrics() {
        return metrics.snapshot(entries.size());
    }

    public int activeJobCount() {
        return entries.size();
    }

    public Optional<Instant> nextFireTime(String jobId) {
        return Optional.ofNullable(entries.get(jobId)).map(ScheduledEntry::nextFireAt);
    }

    /** 아직 끝나지 않은 디스패치 수 */
    public int inFlightCount(String jobId) {
        AtomicInteger n = inFlight.get(jobId);
        return n == null ? 0 : n.get();
    }

    // --- 내부 ---

    private ScheduledEntry arm(JobRecord job, ScheduleSpec spec, Instant nextFireAt, Instant now) {
        Duration delay = Duration.between(now, nextFireAt);
        if (delay.isNegative()) delay = Duration.ZERO;
        if (delay.compareTo(maxTimerDelay) > 0) {
            // 한 번에 못 거는 지연은 잘라서 걸고, 깨어났을 때 남은 만큼 다시 건다
            delay = maxTimerDelay;
        }
        long generation = generations.incrementAndGet();
        String jobId = job.jobId();
        TimerService.TimerHandle handle = timers.schedule(delay, () -> onTimer(jobId, generation));
        return new ScheduledEntry(job, spec, nextFireAt, generation, handle);
    }

    private void onTimer(String jobId, long generation) {
        try {
            AtomicReference<ScheduledEntry> fired = new AtomicReference<>();
            AtomicReference<Instant> firedAt = new AtomicReference<>();

            entries.computeIfPresent(jobId, (id, current) -> {
                if (current.generation() != generation) return current; // 이미 교체된 타이머

                Instant now = clock.now();
                if (now.isBefore(current.nextFireAt())) {
                    // chained arming 중간 구간
                    return arm(current.job(), current.spec(), current.nextFireAt(), now);
                }

                fired.set(current);
                firedAt.set(now);
                try {
                    Instant next = calculator.nextExecution(now, current.spec());
                    return arm(current.job(), current.spec(), next, now);
                } catch (NoExecutionFoundException e) {
                    log.error("Error rescheduling job {}: {}", jobId, e.getMessage());
                    return null;
                }
            });

            ScheduledEntry entry = fired.get();
            if (entry == null) return;

            long drift = Duration.between(entry.nextFireAt(), firedAt.get()).toMillis();
            metrics.recordFire(drift);
            log.info("Executing job {} (drift: {}ms)", jobId, drift);
            submit(entry.job());
        } catch (RuntimeException e) {
            log.error("Timer callback failed for job {}", jobId, e);
        }
    }

    private void submit(JobRecord job) {
        AtomicInteger running = inFlight.computeIfAbsent(job.jobId(), id -> new AtomicInteger());
        if (running.incrementAndGet() > maxInFlightPerJob) {
            running.decrementAndGet();
            String reason = "skipped: " + maxInFlightPerJob + " dispatches still in flight";
            log.warn("Job {} {}", job.jobId(), reason);
            execute(job, () -> dispatcher.reject(job, reason), null);
            return;
        }
        execute(job, () -> dispatcher.dispatch(job), running);
    }

    private void execute(JobRecord job, Supplier<ExecutionOutcome> work, AtomicInteger slot) {
        try {
            CompletableFuture.supplyAsync(work, dispatchExecutor)
                    .whenComplete((outcome, error) -> {
                        if (slot != null) slot.decrementAndGet();
                        onDispatched(outcome, error);
                    });
        } catch (RejectedExecutionException e) {
            if (slot != null) slot.decrementAndGet();
            metrics.recordFailure();
            log.error("Dispatch of job {} rejected", job.jobId(), e);
        }
    }

    private void onDispatched(ExecutionOutcome outcome, Throwable error) {
        if (error != null) {
            metrics.recordFailure();
            log.error("Error executing job", error);
            return;
        }
        metrics.recordOutcome(outcome);
    }
}

package net.cronhook.core.service;

import net.cronhook.core.model.DeliveryMode;
import net.cronhook.core.model.ExecutionOutcome;
import net.cronhook.core.model.FailureAlert;
import net.cronhook.core.model.JobRecord;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.ExecutionRepository;
import net.cronhook.core.spi.FailureAlerter;
import net.cronhook.core.spi.HttpTransport;
import net.cronhook.core.spi.Sleeper;
import net.cronhook.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * occurrence 하나를 HTTP POST 로 전달하고 결과를 기록한다.
 * <ul>
 *   <li>NO_RETRY: 첫 시도 결과가 최종</li>
 *   <li>AT_LEAST_ONCE: 2xx 면 종료, 아니면 maxAttempts 까지 재시도 (attempt × base 대기)</li>
 * </ul>
 * 어떤 경우에도 예외를 던지지 않고, 시도 묶음당 ExecutionOutcome 하나만 저장한다.
 */
public final class ExecutionDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_BACKOFF = Duration.ofSeconds(1);

    private final HttpTransport transport;
    private final ExecutionRepository executions;
    private final TxRunner tx;
    private final RetryPolicy retry;
    private final FailureAlerter alerter;
    private final Executor alertExecutor;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Duration timeout;
    private final int maxAttempts;

    public ExecutionDispatcher(HttpTransport transport,
                               ExecutionRepository executions,
                               TxRunner tx,
                               RetryPolicy retry,
                               FailureAlerter alerter,
                               Executor alertExecutor,
                               Sleeper sleeper,
                               Clock clock,
                               Duration timeout,
                               int maxAttempts) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        this.transport = transport;
        this.executions = executions;
        this.tx = tx;
        this.retry = retry;
        this.alerter = alerter;
        this.alertExecutor = alertExecutor;
        this.sleeper = sleeper;
        this.clock = clock;
        this.timeout = timeout;
        this.maxAttempts = maxAttempts;
    }

    public ExecutionOutcome dispatch(JobRecord job) {
        Instant occurredAt = clock.now();
        int budget = job.deliveryMode() == DeliveryMode.AT_LEAST_ONCE ? maxAttempts : 1;

        log.info("Executing job {} - POST {}", job.jobId(), job.targetUrl());

        Attempt last = null;
        int attempts = 0;
        while (attempts < budget) {
            attempts++;
            last = attempt(job);
            if (last.success()) break;

            if (attempts < budget) {
                Duration backoff = retry.nextBackoff(attempts);
                log.info("Retry attempt {}/{} for job {} in {}ms ({})",
                        attempts + 1, budget, job.jobId(), backoff.toMillis(), last.error());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Retry backoff interrupted for job {}, keeping result of attempt {}", job.jobId(), attempts);
                    break;
                }
            }
        }

        long duration = Math.max(0, Duration.between(occurredAt, clock.now()).toMillis());
        ExecutionOutcome outcome = new ExecutionOutcome(
                UUID.randomUUID().toString(),
                job.jobId(),
                occurredAt,
                last.success() ? ExecutionOutcome.Status.SUCCESS : ExecutionOutcome.Status.FAILURE,
                last.httpStatus(),
                duration,
                last.success() ? null : last.error(),
                attempts);

        return finish(job, outcome);
    }

    /**
     * 전송하지 않고 실패로 기록한다. 같은 잡의 이전 occurrence 들이 아직 끝나지 않아 동시 실행 상한을 넘었을 때 쓴다.
     * attempts 는 0.
     */
    public ExecutionOutcome reject(JobRecord job, String reason) {
        ExecutionOutcome outcome = new ExecutionOutcome(
                UUID.randomUUID().toString(),
                job.jobId(),
                clock.now(),
                ExecutionOutcome.Status.FAILURE,
                null,
                0,
                reason,
                0);
        return finish(job, outcome);
    }

    private ExecutionOutcome finish(JobRecord job, ExecutionOutcome outcome) {
        record(outcome);
        if (outcome.success()) {
            log.info("Job {} completed - status: {}, http: {}, duration: {}ms, attempts: {}",
                    job.jobId(), outcome.status().code(), outcome.httpStatusCode(), outcome.durationMillis(),
                    outcome.attempts());
        } else {
            log.warn("Job {} failed - http: {}, error: {}, duration: {}ms, attempts: {}",
                    job.jobId(), outcome.httpStatusCode(), outcome.errorMessage(), outcome.durationMillis(),
                    outcome.attempts());
            alertAsync(job, outcome);
        }
        return outcome;
    }

    private Attempt attempt(JobRecord job) {
        try {
            int status = transport.post(URI.create(job.targetUrl()), timeout);
            boolean ok = status >= 200 && status < 300;
            return new Attempt(ok, status, ok ? null : "HTTP " + status);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Attempt(false, null, "interrupted");
        } catch (Exception e) {
            return new Attempt(false, null, describe(e));
        }
    }

    private void record(ExecutionOutcome outcome) {
        try {
            tx.run(() -> executions.create(outcome));
        } catch (Exception e) {
            log.error("Failed to record execution {} for job {}", outcome.executionId(), outcome.jobId(), e);
        }
    }

    private void alertAsync(JobRecord job, ExecutionOutcome outcome) {
        FailureAlert alert = FailureAlert.of(job, outcome, clock.now());
        try {
            alertExecutor.execute(() -> {
                try {
                    alerter.alert(alert);
                } catch (RuntimeException e) {
                    log.warn("Failure alert for job {} could not be delivered", job.jobId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Failure alert for job {} dropped: executor rejected it", job.jobId());
        }
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + msg;
    }

    private record Attempt(boolean success, Integer httpStatus, String error) {}
}

package net.cronhook.core.maintenance;

import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.ExecutionRepository;
import net.cronhook.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/** 오래된 실행 기록 정리 */
public final class RetentionService {
    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    private final ExecutionRepository executions;
    private final TxRunner tx;
    private final Clock clock;

    public RetentionService(ExecutionRepository executions, TxRunner tx, Clock clock) {
        this.executions = executions;
        this.tx = tx;
        this.clock = clock;
    }

    /** ttl 이 비었거나 0/음수면 아무것도 지우지 않는다 */
    public RetentionReport runOnce(Duration ttl) throws Exception {
        Instant now = clock.now();
        RetentionReport r = new RetentionReport();
        r.timestamp = now;

        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            Instant threshold = now.minus(ttl);
            r.threshold = threshold;
            r.deletedExecutions = tx.required(() -> executions.deleteOlderThan(threshold));
            if (r.deletedExecutions > 0) {
                log.info("Purged {} execution records older than {}", r.deletedExecutions, threshold);
            }
        }
        return r;
    }

    public static final class RetentionReport {
        public Instant timestamp;
        public Instant threshold;
        public int deletedExecutions;

        @Override public String toString() {
            return "RetentionReport{" +
                    "timestamp=" + timestamp +
                    ", threshold=" + threshold +
                    ", deletedExecutions=" + deletedExecutions +
                    '}';
        }
    }
}

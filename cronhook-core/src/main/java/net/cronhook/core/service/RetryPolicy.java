package net.cronhook.core.service;

import java.time.Duration;

public interface RetryPolicy {
    /** attempt 번째 시도(1부터)가 실패한 뒤 다음 시도까지의 대기 */
    Duration nextBackoff(long attempt);

    /** 선형 백오프: attempt × base */
    static RetryPolicy linear(Duration base) {
        return new LinearRetryPolicy(base);
    }
}

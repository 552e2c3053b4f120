package net.cronhook.core.model;

import java.time.Instant;
import java.util.Locale;

/** 한 번의 occurrence 결과. 재시도는 attempts 로만 드러나고 레코드는 하나다. */
public record ExecutionOutcome(
        String executionId,
        String jobId,
        Instant occurrenceTimestamp,
        Status status,
        Integer httpStatusCode,  // 전송 오류면 null
        long durationMillis,
        String errorMessage,
        int attempts
) {
    public enum Status {
        SUCCESS, FAILURE, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }

        public String code() { return name().toLowerCase(Locale.ROOT); }
    }

    public boolean success() {
        return status == Status.SUCCESS;
    }
}

package net.cronhook.core.model;

import java.time.Instant;

public record JobRecord(
        String jobId,
        String name,            // 선택. catalog 등록 시 식별자로 사용
        String rawSchedule,     // 예: "31 10-15 1 * * MON-FRI"
        String targetUrl,
        DeliveryMode deliveryMode,
        JobStatus status,
        Instant createdAt,
        Instant updatedAt
) {
    public static JobRecord ofNew(String jobId, String name, String rawSchedule, String targetUrl,
                                  DeliveryMode deliveryMode, Instant now) {
        return new JobRecord(jobId, name, rawSchedule, targetUrl, deliveryMode, JobStatus.ACTIVE, now, now);
    }

    public boolean active() {
        return status == JobStatus.ACTIVE;
    }

    /** 부분 업데이트 적용. 값이 없는 필드는 유지하고 상태는 ACTIVE로 되돌린다. */
    public JobRecord apply(JobUpdate update, Instant now) {
        return new JobRecord(
                jobId,
                name,
                update.rawSchedule() != null ? update.rawSchedule() : rawSchedule,
                update.targetUrl() != null ? update.targetUrl() : targetUrl,
                update.deliveryMode() != null ? update.deliveryMode() : deliveryMode,
                JobStatus.ACTIVE,
                createdAt,
                now
        );
    }
}

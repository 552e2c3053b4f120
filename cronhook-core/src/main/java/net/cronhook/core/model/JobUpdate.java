package net.cronhook.core.model;

/** null 필드는 "변경 없음" */
public record JobUpdate(
        String rawSchedule,
        String targetUrl,
        DeliveryMode deliveryMode
) {
    public static JobUpdate schedule(String rawSchedule) {
        return new JobUpdate(rawSchedule, null, null);
    }

    public boolean isEmpty() {
        return rawSchedule == null && targetUrl == null && deliveryMode == null;
    }
}

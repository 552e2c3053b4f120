package net.cronhook.core.schedule;

import java.time.ZonedDateTime;

/** 스케줄 식의 여섯 필드와 각 도메인 (양끝 포함) */
public enum ScheduleField {
    SECOND("second", 0, 59),
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23),
    DAY_OF_MONTH("dayOfMonth", 1, 31),
    MONTH("month", 1, 12),
    DAY_OF_WEEK("dayOfWeek", 0, 6);   // SUN=0 ... SAT=6

    private final String label;
    private final int min;
    private final int max;

    ScheduleField(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    public String label() { return label; }
    public int min() { return min; }
    public int max() { return max; }

    public boolean inDomain(int value) {
        return value >= min && value <= max;
    }

    /** 시각에서 이 필드 값을 꺼낸다 */
    public int valueOf(ZonedDateTime t) {
        return switch (this) {
            case SECOND -> t.getSecond();
            case MINUTE -> t.getMinute();
            case HOUR -> t.getHour();
            case DAY_OF_MONTH -> t.getDayOfMonth();
            case MONTH -> t.getMonthValue();
            case DAY_OF_WEEK -> t.getDayOfWeek().getValue() % 7; // MONDAY=1 ... SUNDAY=7 -> 0
        };
    }
}

package net.cronhook.core.schedule;

import java.time.ZonedDateTime;
import java.util.Objects;

/** 파싱된 6필드 스케줄. 불변이며 같은 식을 다시 파싱하면 equals 가 성립한다. */
public record ScheduleSpec(
        FieldMatcher second,
        FieldMatcher minute,
        FieldMatcher hour,
        FieldMatcher dayOfMonth,
        FieldMatcher month,
        FieldMatcher dayOfWeek
) {
    public ScheduleSpec {
        Objects.requireNonNull(second); Objects.requireNonNull(minute); Objects.requireNonNull(hour);
        Objects.requireNonNull(dayOfMonth); Objects.requireNonNull(month); Objects.requireNonNull(dayOfWeek);
    }

    public FieldMatcher field(ScheduleField f) {
        return switch (f) {
            case SECOND -> second;
            case MINUTE -> minute;
            case HOUR -> hour;
            case DAY_OF_MONTH -> dayOfMonth;
            case MONTH -> month;
            case DAY_OF_WEEK -> dayOfWeek;
        };
    }

    /** 여섯 필드 모두 일치해야 true (AND) */
    public boolean matches(ZonedDateTime t) {
        for (ScheduleField f : ScheduleField.values()) {
            if (!field(f).matches(f.valueOf(t))) return false;
        }
        return true;
    }
}

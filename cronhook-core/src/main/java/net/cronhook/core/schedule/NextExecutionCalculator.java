package net.cronhook.core.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * 다음 실행 시각 계산기.
 * <p>
 * from 을 초 단위로 자르고 1초 뒤부터 탐색한다. 각 후보는 여섯 필드를 AND 로 검사한다.
 * 월/일/시/분이 맞지 않으면 그 단위 안의 나머지 초는 어차피 맞을 수 없으므로 단위 경계까지 건너뛴다.
 * 1년 안에 못 찾으면 {@link NoExecutionFoundException}.
 */
public final class NextExecutionCalculator {
    public static final Duration SEARCH_HORIZON = Duration.ofSeconds(365L * 24 * 60 * 60);

    private final ZoneId zone;

    public NextExecutionCalculator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone);
    }

    public ZoneId zone() {
        return zone;
    }

    public Instant nextExecution(Instant from, ScheduleSpec spec) {
        Objects.requireNonNull(from); Objects.requireNonNull(spec);

        Instant start = from.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        Instant limit = start.plus(SEARCH_HORIZON);
        ZonedDateTime t = start.atZone(zone);

        while (t.toInstant().isBefore(limit)) {
            if (!spec.month().matches(t.getMonthValue())) {
                t = t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).plusMonths(1);
                continue;
            }
            if (!spec.dayOfMonth().matches(t.getDayOfMonth())
                    || !spec.dayOfWeek().matches(ScheduleField.DAY_OF_WEEK.valueOf(t))) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (!spec.hour().matches(t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!spec.minute().matches(t.getMinute())) {
                t = t.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
                continue;
            }
            if (!spec.second().matches(t.getSecond())) {
                t = t.plusSeconds(1);
                continue;
            }
            return t.toInstant();
        }
        throw new NoExecutionFoundException(spec, from);
    }

    public boolean matches(Instant instant, ScheduleSpec spec) {
        return spec.matches(instant.atZone(zone));
    }
}

package net.cronhook.core.schedule;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NextExecutionCalculatorTest {

    private final NextExecutionCalculator calc = new NextExecutionCalculator(ZoneOffset.UTC);

    @Test
    void subSecondStart_isTruncatedBeforeSearching() {
        ScheduleSpec s = ScheduleParser.parse("0 * * * * *");
        Instant next = calc.nextExecution(Instant.parse("2026-10-18T12:00:00.500Z"), s);
        assertEquals(Instant.parse("2026-10-18T12:01:00Z"), next);
    }

    @Test
    void result_isStrictlyAfterFrom_evenWhenFromMatches() {
        ScheduleSpec s = ScheduleParser.parse("* * * * * *");
        Instant from = Instant.parse("2026-10-18T12:00:00Z");
        assertEquals(Instant.parse("2026-10-18T12:00:01Z"), calc.nextExecution(from, s));
    }

    @Test
    void weekdayExpression_skipsWeekend() {
        ScheduleSpec s = ScheduleParser.parse("31 10-15 1 * * MON-FRI");
        // 토요일 자정 → 월요일 01:10:31
        Instant next = calc.nextExecution(Instant.parse("2026-10-17T00:00:00Z"), s);
        assertEquals(Instant.parse("2026-10-19T01:10:31Z"), next);
        assertTrue(calc.matches(next, s));
    }

    @Test
    void monthRollover_andYearRollover() {
        assertEquals(Instant.parse("2026-11-01T00:00:00Z"),
                calc.nextExecution(Instant.parse("2026-10-18T00:00:00Z"), ScheduleParser.parse("0 0 0 1 * *")));
        assertEquals(Instant.parse("2027-01-01T00:00:00Z"),
                calc.nextExecution(Instant.parse("2026-10-18T00:00:00Z"), ScheduleParser.parse("0 0 0 1 1 *")));
    }

    @Test
    void fieldsAreEvaluatedInConfiguredZone() {
        NextExecutionCalculator seoul = new NextExecutionCalculator(ZoneId.of("Asia/Seoul"));
        // 2026-10-18T00:00Z = 09:00 KST, 같은 시각은 제외되므로 다음 날 09:00 KST
        Instant next = seoul.nextExecution(Instant.parse("2026-10-18T00:00:00Z"), ScheduleParser.parse("0 0 9 * * *"));
        assertEquals(Instant.parse("2026-10-19T00:00:00Z"), next);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0 0 0 31 2 *", "0 0 0 30 2 *", "0 0 0 31 4 *", "0 0 0 31 4,6,9,11 *"})
    void impossibleDates_throwNoExecutionFound(String expr) {
        ScheduleSpec s = ScheduleParser.parse(expr);
        assertThrows(NoExecutionFoundException.class, () -> calc.nextExecution(Instant.parse("2026-10-18T00:00:00Z"), s));
    }

    @Test
    void leapDayBeyondOneYear_throwsNoExecutionFound() {
        // 다음 2월 29일은 2028년으로 1년 탐색 범위 밖
        ScheduleSpec s = ScheduleParser.parse("0 0 0 29 2 *");
        assertThrows(NoExecutionFoundException.class, () -> calc.nextExecution(Instant.parse("2026-10-18T00:00:00Z"), s));
        assertEquals(Instant.parse("2028-02-29T00:00:00Z"),
                calc.nextExecution(Instant.parse("2027-06-01T00:00:00Z"), s));
    }

    @Test
    void dayOfMonthAndDayOfWeek_areBothRequired() {
        // 13일이면서 금요일: 2026-11-13
        ScheduleSpec s = ScheduleParser.parse("0 0 0 13 * FRI");
        assertEquals(Instant.parse("2026-11-13T00:00:00Z"), calc.nextExecution(Instant.parse("2026-10-18T00:00:00Z"), s));
    }

    @Test
    void agreesWithCronUtils_forCommonExpressions() {
        CronParser oracle = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));
        List<String> expressions = List.of(
                "0 0 12 * * *",
                "30 15 10 1,15 * *",
                "0 0-5 14 * * *",
                "15,45 * * * * *",
                "0 0 0 1 1 *",
                "10 20 3 * 2-4 *",
                "59 59 23 31 12 *");
        List<Instant> starts = List.of(
                Instant.parse("2026-01-01T00:00:00Z"),
                Instant.parse("2026-02-28T23:59:59Z"),
                Instant.parse("2026-10-18T14:03:17Z"),
                Instant.parse("2026-12-31T23:59:59Z"));

        for (String expr : expressions) {
            ScheduleSpec spec = ScheduleParser.parse(expr);
            ExecutionTime expected = ExecutionTime.forCron(oracle.parse(expr));
            for (Instant start : starts) {
                Instant ours = calc.nextExecution(start, spec);
                ZonedDateTime theirs = expected.nextExecution(start.atZone(ZoneOffset.UTC)).orElseThrow();
                assertEquals(theirs.toInstant(), ours, expr + " from " + start);
                assertTrue(ours.isAfter(start));
                assertTrue(calc.matches(ours, spec));
            }
        }
    }
}

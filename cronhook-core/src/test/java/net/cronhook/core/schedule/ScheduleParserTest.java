package net.cronhook.core.schedule;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleParserTest {

    @Test
    void sameExpression_parsesToEqualSpecs() {
        ScheduleSpec a = ScheduleParser.parse("31 10-15 1 * * MON-FRI");
        ScheduleSpec b = ScheduleParser.parse("  31   10-15 1 * *  mon-fri ");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void wildcard_isAny() {
        ScheduleSpec s = ScheduleParser.parse("* * * * * *");
        for (ScheduleField f : ScheduleField.values()) {
            assertSame(FieldMatcher.any(), s.field(f), f.label());
        }
    }

    @Test
    void rangeListAndSingleValues() {
        ScheduleSpec s = ScheduleParser.parse("0,15,30,45 10-12 3 1 6 *");
        assertEquals(new FieldMatcher.Matches(new TreeSet<>(Set.of(0, 15, 30, 45))), s.second());
        assertEquals(new FieldMatcher.Matches(new TreeSet<>(Set.of(10, 11, 12))), s.minute());
        assertEquals(new FieldMatcher.Matches(new TreeSet<>(Set.of(3))), s.hour());
        assertTrue(s.dayOfMonth().matches(1));
        assertFalse(s.dayOfMonth().matches(2));
        assertTrue(s.month().matches(6));
    }

    @Test
    void dayOfWeekRange_wrapsAroundWeek() {
        ScheduleSpec s = ScheduleParser.parse("0 0 0 * * FRI-MON");
        assertEquals(new FieldMatcher.Matches(new TreeSet<>(Set.of(5, 6, 0, 1))), s.dayOfWeek());
    }

    @Test
    void dayOfWeek_namesAndNumbersMix() {
        ScheduleSpec s = ScheduleParser.parse("0 0 0 * * sun,3,Sat");
        assertEquals(new FieldMatcher.Matches(new TreeSet<>(Set.of(0, 3, 6))), s.dayOfWeek());
    }

    @Test
    void weekdayExpression_matchesOnlyListedInstants() {
        ScheduleSpec s = ScheduleParser.parse("31 10-15 1 * * MON-FRI");
        // 2026-10-14 는 수요일
        ZonedDateTime wed = ZonedDateTime.of(2026, 10, 14, 1, 12, 31, 0, ZoneOffset.UTC);
        assertTrue(s.matches(wed));
        assertFalse(s.matches(wed.withSecond(30)), "second mismatch");
        assertFalse(s.matches(wed.withHour(2)), "hour mismatch");
        assertFalse(s.matches(wed.withMinute(16)), "minute mismatch");
        assertFalse(s.matches(wed.plusDays(3)), "saturday");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "* * * * *",
            "* * * * * * *",
            "60 * * * * *",
            "* 60 * * * *",
            "* * 24 * * *",
            "* * * 0 * *",
            "* * * 32 * *",
            "* * * * 0 *",
            "* * * * 13 *",
            "* * * * * 7",
            "* * * * * FUN",
            "a * * * * *",
            "15-10 * * * * *",
            "1-2-3 * * * * *",
            "1, * * * * *",
            ",1 * * * * *",
            "-1 * * * * *",
            "*/5 * * * * *",
            "1.5 * * * * *"
    })
    void malformedExpressions_areRejected(String expr) {
        MalformedExpressionException e = assertThrows(MalformedExpressionException.class, () -> ScheduleParser.parse(expr));
        assertEquals(expr, e.expression());
    }

    @Test
    void null_isRejected() {
        assertThrows(MalformedExpressionException.class, () -> ScheduleParser.parse(null));
    }

    @Test
    void errorMessage_namesOffendingField() {
        MalformedExpressionException e = assertThrows(MalformedExpressionException.class,
                () -> ScheduleParser.parse("0 0 25 * * *"));
        assertTrue(e.getMessage().contains("hour"), e.getMessage());
    }

    @Test
    void malformed_isAnIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parse("nope"));
    }
}

package net.cronhook.core.schedule;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * "second minute hour dayOfMonth month dayOfWeek" 형식 파서.
 * <p>
 * 필드별 규칙 순서: {@code *} → 범위({@code a-b}) → 목록({@code a,b,c}) → 단일 값.
 * 요일은 SUN..SAT 이름(대소문자 무시)과 숫자 0..6 을 섞어 쓸 수 있고,
 * 요일 범위만 7을 기준으로 감아 돈다 (FRI-MON = 5,6,0,1).
 */
public final class ScheduleParser {
    public static final int FIELD_COUNT = 6;

    private static final Map<String, Integer> DAY_NAMES = Map.of(
            "SUN", 0, "MON", 1, "TUE", 2, "WED", 3, "THU", 4, "FRI", 5, "SAT", 6);

    private static final ScheduleField[] ORDER = {
            ScheduleField.SECOND, ScheduleField.MINUTE, ScheduleField.HOUR,
            ScheduleField.DAY_OF_MONTH, ScheduleField.MONTH, ScheduleField.DAY_OF_WEEK
    };

    private ScheduleParser() {}

    public static ScheduleSpec parse(String expression) {
        if (expression == null) throw new MalformedExpressionException(null, "expression is required");
        String trimmed = expression.trim();
        String[] parts = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
        if (parts.length != FIELD_COUNT) {
            throw new MalformedExpressionException(expression,
                    "expected 6 fields \"second minute hour dayOfMonth month dayOfWeek\" but got " + parts.length);
        }

        FieldMatcher[] m = new FieldMatcher[FIELD_COUNT];
        for (int i = 0; i < FIELD_COUNT; i++) {
            m[i] = parseField(expression, parts[i], ORDER[i]);
        }
        return new ScheduleSpec(m[0], m[1], m[2], m[3], m[4], m[5]);
    }

    static FieldMatcher parseField(String expression, String token, ScheduleField field) {
        if ("*".equals(token)) return FieldMatcher.any();
        if (token.contains("-")) return FieldMatcher.of(parseRange(expression, token, field));
        if (token.contains(",")) return FieldMatcher.of(parseList(expression, token, field));
        return FieldMatcher.of(Set.of(resolve(expression, token, field)));
    }

    private static List<Integer> parseRange(String expression, String token, ScheduleField field) {
        String[] bounds = token.split("-", -1);
        if (bounds.length != 2) {
            throw new MalformedExpressionException(expression, "invalid range '" + token + "' in " + field.label());
        }
        int start = resolve(expression, bounds[0], field);
        int end = resolve(expression, bounds[1], field);

        if (field == ScheduleField.DAY_OF_WEEK) {
            // start 에서 end 까지 mod 7 로 전진
            List<Integer> days = new ArrayList<>();
            int current = start;
            while (true) {
                days.add(current);
                if (current == end) break;
                current = (current + 1) % 7;
            }
            return days;
        }
        if (start > end) {
            throw new MalformedExpressionException(expression,
                    "inverted range '" + token + "' in " + field.label() + " (start > end)");
        }
        return IntStream.rangeClosed(start, end).boxed().collect(Collectors.toList());
    }

    private static List<Integer> parseList(String expression, String token, ScheduleField field) {
        List<Integer> values = new ArrayList<>();
        for (String item : token.split(",", -1)) {
            values.add(resolve(expression, item, field));
        }
        return values;
    }

    /** 토큰 하나를 정수로: 요일 이름 우선, 그 다음 숫자. 도메인 검사 포함. */
    static int resolve(String expression, String token, ScheduleField field) {
        if (token.isEmpty()) {
            throw new MalformedExpressionException(expression, "empty value in " + field.label());
        }
        if (field == ScheduleField.DAY_OF_WEEK) {
            Integer day = DAY_NAMES.get(token.toUpperCase(Locale.ROOT));
            if (day != null) return day;
        }
        if (!token.chars().allMatch(Character::isDigit) || token.length() > 9) {
            String what = field == ScheduleField.DAY_OF_WEEK ? "unrecognized day '" : "not a number '";
            throw new MalformedExpressionException(expression, what + token + "' in " + field.label());
        }
        int value = Integer.parseInt(token);
        if (!field.inDomain(value)) {
            throw new MalformedExpressionException(expression,
                    field.label() + " value " + value + " out of range " + field.min() + "-" + field.max());
        }
        return value;
    }
}

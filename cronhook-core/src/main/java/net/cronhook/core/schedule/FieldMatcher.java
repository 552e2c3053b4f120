package net.cronhook.core.schedule;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/** 필드 하나의 match-set: 전부(Any) 또는 정수 집합(Matches) */
public interface FieldMatcher {

    boolean matches(int value);

    static FieldMatcher any() {
        return Any.INSTANCE;
    }

    static FieldMatcher of(Collection<Integer> values) {
        return new Matches(new TreeSet<>(values));
    }

    enum Any implements FieldMatcher {
        INSTANCE;

        @Override public boolean matches(int value) { return true; }
        @Override public String toString() { return "*"; }
    }

    record Matches(SortedSet<Integer> values) implements FieldMatcher {
        public Matches {
            if (values == null || values.isEmpty()) throw new IllegalArgumentException("match-set must not be empty");
            values = Collections.unmodifiableSortedSet(new TreeSet<>(values));
        }

        @Override public boolean matches(int value) { return values.contains(value); }
    }
}

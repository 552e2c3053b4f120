package net.cronhook.core.model;

import java.util.Locale;

public enum JobStatus {
    ACTIVE, DELETED, UNKNOWN;

    public static JobStatus from(String s) {
        if (s == null) return UNKNOWN;
        try { return JobStatus.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }

    /** 저장 포맷: 소문자 ('active' / 'deleted') */
    public String code() { return name().toLowerCase(Locale.ROOT); }
}

package net.cronhook.core.model;

import java.util.Locale;

public enum DeliveryMode {
    AT_LEAST_ONCE, NO_RETRY;

    public static DeliveryMode from(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("deliveryMode is required");
        try {
            return DeliveryMode.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid deliveryMode: " + s + " (expected AT_LEAST_ONCE or NO_RETRY)");
        }
    }

    public String code() { return name(); }
}

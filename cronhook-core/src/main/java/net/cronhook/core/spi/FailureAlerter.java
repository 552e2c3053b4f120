package net.cronhook.core.spi;

import net.cronhook.core.model.FailureAlert;

@FunctionalInterface
public interface FailureAlerter {
    void alert(FailureAlert alert);
}

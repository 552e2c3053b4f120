package net.cronhook.core.schedule;

import java.time.Instant;

public class NoExecutionFoundException extends IllegalStateException {
    public NoExecutionFoundException(ScheduleSpec spec, Instant from) {
        super("No next execution within one year for " + spec + " from " + from);
    }
}

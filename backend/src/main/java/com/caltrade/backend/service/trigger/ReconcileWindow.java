package com.caltrade.backend.service.trigger;

import com.caltrade.backend.model.TriggerSource;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Time range scanned by one reconciliation run. {@code lookAhead}, when set, additionally caps event start
 * times at {@code reference + lookAhead}.
 */
public record ReconcileWindow(TriggerSource source, Instant reference, Instant start, Instant end, Duration lookAhead) {

    public ReconcileWindow {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
    }

    public static ReconcileWindow wide(TriggerSource source, Instant now, Duration past, Duration future) {
        return new ReconcileWindow(source, now, now.minus(past), now.plus(future), null);
    }

    public static ReconcileWindow narrow(TriggerSource source, Instant now, Duration lookAhead) {
        return new ReconcileWindow(source, now, now, now.plus(lookAhead), lookAhead);
    }
}

package io.clype.reactorkinesis.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Default partition key generators.
 */
public final class PartitionKeys {

    private PartitionKeys() {
    }

    /**
     * Returns a supplier of the current epoch time in seconds, with millisecond fraction
     * (e.g. {@code 1697551234.123}). Records enqueued without a key spread across shards
     * as time advances.
     *
     * @param clock source of the current time
     */
    public static Supplier<String> epochSeconds(Clock clock) {
        Objects.requireNonNull(clock, "clock cannot be null");
        return () -> BigDecimal.valueOf(clock.millis(), 3).toPlainString();
    }
}

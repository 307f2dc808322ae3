package com.questrail.vcd.model;

import java.util.Objects;

/**
 * One recorded value change of a signal.
 *
 * @param time  timestamp in document time units, never negative
 * @param value value normalized to the signal's width over {@code 0 1 x z}
 */
public record ChangeEvent(long time, String value)
{
    public ChangeEvent {
        Objects.requireNonNull(value, "value");
        if (time < 0) {
            throw new IllegalArgumentException("Change time must be non-negative (was " + time + ")");
        }
    }
}

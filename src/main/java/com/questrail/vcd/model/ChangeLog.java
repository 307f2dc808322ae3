package com.questrail.vcd.model;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ChangeLog
 * -----------------------------------------------------------------------------
 * The sparse, time-ordered change history of a single signal.
 *
 * <p>Only changes are stored, never one entry per tick. Timestamps are
 * non-decreasing in append order. Several entries may share a timestamp and
 * consecutive identical values are kept as recorded.</p>
 *
 * <h2>Point-in-time lookup</h2>
 * <p>{@link #valueAt(long)} returns the value of the latest entry whose time is
 * {@code <= t}. When several entries share that time, the last one appended
 * wins. Lookup is a binary search over the timestamp array, O(log k) for k
 * changes.</p>
 *
 * <p>Instances are immutable. They are assembled through {@link Builder},
 * which only allows appends in non-decreasing time order.</p>
 */
public final class ChangeLog
{
    private static final ChangeLog EMPTY = new ChangeLog(new long[0], new String[0]);

    private final long[] times;
    private final String[] values;

    private ChangeLog(long[] times, String[] values) {
        this.times = times;
        this.values = values;
    }

    public static ChangeLog empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return times.length;
    }

    public boolean isEmpty() {
        return times.length == 0;
    }

    public ChangeEvent get(int index) {
        return new ChangeEvent(times[index], values[index]);
    }

    public Optional<ChangeEvent> first() {
        return isEmpty() ? Optional.empty() : Optional.of(get(0));
    }

    public Optional<ChangeEvent> last() {
        return isEmpty() ? Optional.empty() : Optional.of(get(times.length - 1));
    }

    /**
     * Returns the value in effect at {@code t}, or empty if {@code t} precedes
     * the first recorded change.
     */
    public Optional<String> valueAt(long t) {
        int index = indexAtOrBefore(t);
        return index < 0 ? Optional.empty() : Optional.of(values[index]);
    }

    /**
     * Index of the last entry with time {@code <= t}, or -1 if there is none.
     */
    int indexAtOrBefore(long t) {
        int lo = 0;
        int hi = times.length;
        // upper bound: first index with times[i] > t
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (times[mid] <= t) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo - 1;
    }

    /**
     * Returns the recorded timestamps, in append order, duplicates included.
     */
    public long[] times() {
        return times.clone();
    }

    /**
     * Returns a read-only view of the entries in append order.
     */
    public List<ChangeEvent> events() {
        return new AbstractList<>() {
            @Override
            public ChangeEvent get(int index) {
                return ChangeLog.this.get(index);
            }

            @Override
            public int size() {
                return times.length;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeLog that)) return false;
        return Arrays.equals(times, that.times) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(times) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "ChangeLog[size=" + times.length + "]";
    }

    /**
     * Append-only builder used while replaying a dump.
     */
    public static final class Builder {
        private long[] times = new long[8];
        private String[] values = new String[8];
        private int size;

        private Builder() {}

        /**
         * Appends a change.
         *
         * @throws IllegalArgumentException if {@code time} is negative or
         *         precedes the last appended time
         */
        public Builder append(long time, String value) {
            Objects.requireNonNull(value, "value");
            if (time < 0) {
                throw new IllegalArgumentException("Change time must be non-negative (was " + time + ")");
            }
            if (size > 0 && time < times[size - 1]) {
                throw new IllegalArgumentException(
                        "Change time " + time + " precedes previous change at " + times[size - 1]);
            }
            if (size == times.length) {
                times = Arrays.copyOf(times, size * 2);
                values = Arrays.copyOf(values, size * 2);
            }
            times[size] = time;
            values[size] = value;
            size++;
            return this;
        }

        public int size() {
            return size;
        }

        public ChangeLog build() {
            if (size == 0) {
                return EMPTY;
            }
            return new ChangeLog(Arrays.copyOf(times, size), Arrays.copyOf(values, size));
        }
    }
}

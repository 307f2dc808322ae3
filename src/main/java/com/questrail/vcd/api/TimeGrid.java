package com.questrail.vcd.api;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * TimeGrid
 * -----------------------------------------------------------------------------
 * The ordered set of timestamps at which a tabular projection samples every
 * requested signal.
 *
 * <ul>
 *   <li>{@link AllChangeTimes} - the union of every distinct change timestamp
 *       across the requested signals</li>
 *   <li>{@link Explicit} - a caller-supplied list of timestamps</li>
 * </ul>
 *
 * <p>An explicit grid is normalized on construction: sorted ascending with
 * duplicates removed. Projection can then promise strictly ascending rows
 * regardless of how the caller assembled the list.</p>
 */
public sealed interface TimeGrid permits TimeGrid.AllChangeTimes, TimeGrid.Explicit
{
    /**
     * Returns the grid made of all change timestamps of the projected signals.
     */
    static TimeGrid allChangeTimes() {
        return AllChangeTimes.INSTANCE;
    }

    static TimeGrid explicit(long... times) {
        Objects.requireNonNull(times, "times");
        return new Explicit(Arrays.stream(times).boxed().toList());
    }

    static TimeGrid explicit(Collection<Long> times) {
        Objects.requireNonNull(times, "times");
        return new Explicit(List.copyOf(times));
    }

    /**
     * Samples at every distinct timestamp at which any projected signal changed.
     */
    final class AllChangeTimes implements TimeGrid {
        private static final AllChangeTimes INSTANCE = new AllChangeTimes();

        private AllChangeTimes() {}

        @Override
        public String toString() {
            return "TimeGrid.AllChangeTimes";
        }
    }

    /**
     * Samples at a fixed set of timestamps.
     *
     * @param times timestamps in any order; held sorted ascending without duplicates
     */
    record Explicit(List<Long> times) implements TimeGrid {
        public Explicit {
            Objects.requireNonNull(times, "times");
            TreeSet<Long> sorted = new TreeSet<>();
            for (Long t : times) {
                sorted.add(Objects.requireNonNull(t, "time"));
            }
            times = List.copyOf(sorted);
        }
    }
}

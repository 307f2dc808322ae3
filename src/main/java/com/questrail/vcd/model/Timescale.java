package com.questrail.vcd.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Document-wide time scale: every timestamp in a dump is an integer count of
 * {@code magnitude * unit}.
 *
 * <p>Magnitude is restricted to 1, 10 or 100 as the dump format allows.</p>
 */
public record Timescale(int magnitude, Unit unit)
{
    private static final Pattern TIMESCALE = Pattern.compile("\\s*(1|10|100)\\s*(s|ms|us|ns|ps|fs)\\s*");

    public static final Timescale DEFAULT = new Timescale(1, Unit.NS);

    public enum Unit {
        S("s", 0),
        MS("ms", -3),
        US("us", -6),
        NS("ns", -9),
        PS("ps", -12),
        FS("fs", -15);

        private final String symbol;
        private final int exponent;

        Unit(String symbol, int exponent) {
            this.symbol = symbol;
            this.exponent = exponent;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * Power of ten relative to one second.
         */
        public int exponent() {
            return exponent;
        }

        static Unit fromSymbol(String symbol) {
            for (Unit unit : values()) {
                if (unit.symbol.equals(symbol)) {
                    return unit;
                }
            }
            throw new IllegalArgumentException("Unknown time unit: " + symbol);
        }
    }

    public Timescale {
        Objects.requireNonNull(unit, "unit");
        if (magnitude != 1 && magnitude != 10 && magnitude != 100) {
            throw new IllegalArgumentException("Timescale magnitude must be 1, 10 or 100 (was " + magnitude + ")");
        }
    }

    /**
     * Parses the body of a {@code $timescale} header, e.g. {@code "1ns"} or
     * {@code " 10 ps "}.
     *
     * @return the timescale, or empty if the text is not a valid timescale
     */
    public static Optional<Timescale> parse(String text) {
        Objects.requireNonNull(text, "text");
        Matcher m = TIMESCALE.matcher(text.toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Timescale(Integer.parseInt(m.group(1)), Unit.fromSymbol(m.group(2))));
    }

    /**
     * Converts a tick count to seconds.
     */
    public double toSeconds(long ticks) {
        return ticks * (double) magnitude * Math.pow(10, unit.exponent());
    }

    @Override
    public String toString() {
        return magnitude + unit.symbol();
    }
}

package com.questrail.vcd.parse;

import java.util.Objects;

/**
 * Indicates that no document could be built from the input at all.
 *
 * <p>Anomalies inside an otherwise usable dump are never reported through
 * this exception; they become diagnostics of the {@link ParseResult}.</p>
 */
public final class VcdParseException extends RuntimeException
{
    public enum Reason {
        /**
         * The input is absent, unreadable, or contains no tokens.
         */
        EMPTY_OR_MISSING_INPUT,

        /**
         * The input ended without {@code $enddefinitions}.
         */
        MISSING_END_DEFINITIONS,

        /**
         * The input exceeded the configured line limit.
         */
        INPUT_TOO_LARGE
    }

    private final Reason reason;

    public VcdParseException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public VcdParseException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}

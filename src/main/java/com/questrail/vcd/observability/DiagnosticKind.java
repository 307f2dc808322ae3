package com.questrail.vcd.observability;

/**
 * Classification of recoverable anomalies found while parsing a dump.
 *
 * <p>Every kind is non-fatal: the offending line or event is skipped or
 * applied in a defined fallback way, and parsing continues.</p>
 */
public enum DiagnosticKind
{
    /**
     * The line could not be classified or carried an illegal value. The line is skipped.
     */
    MALFORMED_LINE,

    /**
     * An identifier token (or a hierarchical name) was declared twice. The first declaration wins.
     */
    DUPLICATE_IDENTIFIER,

    /**
     * A scope or variable declaration appeared after {@code $enddefinitions}. It is ignored.
     */
    DECLARATION_AFTER_FREEZE,

    /**
     * A time marker went backwards. Later events apply at the last known time.
     */
    TIME_ORDERING_VIOLATION,

    /**
     * A value change named an undeclared identifier. The change is discarded.
     */
    UNKNOWN_SIGNAL_REFERENCE
}

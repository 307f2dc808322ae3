package com.questrail.vcd.observability;

import java.util.Objects;

/**
 * A recoverable anomaly found while parsing a dump.
 *
 * @param kind    classification
 * @param line    1-based source line number
 * @param raw     raw text of the source line
 * @param message human-readable description
 */
public record Diagnostic(
    DiagnosticKind kind,
    int line,
    String raw,
    String message
) {
    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return kind + " at line " + line + ": " + message + " [" + raw.strip() + "]";
    }
}

package com.questrail.vcd.observability;

import java.time.Duration;

/**
 * Record published once a dump has been parsed into a document.
 */
public record ParseCompletedEvent(
    String source,
    int lines,
    int signals,
    long changes,
    long maxTime,
    int diagnostics,
    Duration elapsed
) {
}

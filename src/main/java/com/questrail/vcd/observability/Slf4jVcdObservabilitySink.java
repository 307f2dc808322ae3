package com.questrail.vcd.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of VcdObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jVcdObservabilitySink implements VcdObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jVcdObservabilitySink.class);

    @Override
    public void onDiagnostic(Diagnostic diagnostic) {
        log.warn("VCD {} at line {}: {}", diagnostic.kind(), diagnostic.line(), diagnostic.message());
        if (log.isDebugEnabled()) {
            log.debug("VCD line {} text: {}", diagnostic.line(), diagnostic.raw());
        }
    }

    @Override
    public void onParseCompleted(ParseCompletedEvent event) {
        log.info("Parsed VCD {}: {} signals, {} changes, max time {}, {} diagnostics in {} ms",
            event.source(),
            event.signals(),
            event.changes(),
            event.maxTime(),
            event.diagnostics(),
            event.elapsed().toMillis());
    }
}

package com.questrail.vcd.observability;

/**
 * Main interface for receiving parser observability events.
 * Implementations can provide logging, metrics, or collection for tests.
 */
public interface VcdObservabilitySink {
    /**
     * Called for every recoverable anomaly, in file order.
     * @param diagnostic the anomaly
     */
    void onDiagnostic(Diagnostic diagnostic);

    /**
     * Called once when a document has been built.
     * @param event summary of the finished parse
     */
    void onParseCompleted(ParseCompletedEvent event);
}

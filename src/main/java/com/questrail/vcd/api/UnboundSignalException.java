package com.questrail.vcd.api;

/**
 * Indicates that a query named a signal the document does not declare.
 *
 * <p>This failure is scoped to the single query that raised it. The document
 * itself remains valid and other queries against it are unaffected.</p>
 */
public final class UnboundSignalException extends RuntimeException
{
    private final SignalId signalId;

    public UnboundSignalException(SignalId signalId) {
        super("Signal is not declared in this document: " + signalId);
        this.signalId = signalId;
    }

    public SignalId signalId() {
        return signalId;
    }
}

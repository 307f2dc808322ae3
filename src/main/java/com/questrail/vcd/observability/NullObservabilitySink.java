package com.questrail.vcd.observability;

/**
 * No-op implementation of VcdObservabilitySink.
 */
public final class NullObservabilitySink implements VcdObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onDiagnostic(Diagnostic diagnostic) {}

    @Override
    public void onParseCompleted(ParseCompletedEvent event) {}
}

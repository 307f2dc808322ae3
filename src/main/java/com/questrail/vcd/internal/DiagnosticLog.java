package com.questrail.vcd.internal;

import com.questrail.vcd.codec.VcdToken;
import com.questrail.vcd.observability.Diagnostic;
import com.questrail.vcd.observability.DiagnosticKind;
import com.questrail.vcd.observability.VcdObservabilitySink;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates the diagnostics of one parse in file order and forwards each
 * one to the configured {@link VcdObservabilitySink} as it is raised.
 *
 * <p>Owned by a single parse; not thread-safe.</p>
 */
public final class DiagnosticLog
{
    private final VcdObservabilitySink sink;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public DiagnosticLog(VcdObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public void report(DiagnosticKind kind, VcdToken token, String message) {
        Objects.requireNonNull(token, "token");
        Diagnostic diagnostic = new Diagnostic(kind, token.line(), token.raw(), message);
        diagnostics.add(diagnostic);
        sink.onDiagnostic(diagnostic);
    }

    public int size() {
        return diagnostics.size();
    }

    public List<Diagnostic> snapshot() {
        return List.copyOf(diagnostics);
    }
}

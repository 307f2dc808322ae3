package com.questrail.vcd.parse;

import com.questrail.vcd.api.VcdDocument;
import com.questrail.vcd.observability.Diagnostic;
import com.questrail.vcd.observability.DiagnosticKind;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a successful parse: a best-effort document together with every
 * anomaly found on the way, in file order.
 *
 * @param document    the reconstructed document
 * @param diagnostics recoverable anomalies, possibly empty
 */
public record ParseResult(VcdDocument document, List<Diagnostic> diagnostics)
{
    public ParseResult {
        Objects.requireNonNull(document, "document");
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
    }

    public boolean isClean() {
        return diagnostics.isEmpty();
    }

    public List<Diagnostic> diagnostics(DiagnosticKind kind) {
        Objects.requireNonNull(kind, "kind");
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }
}

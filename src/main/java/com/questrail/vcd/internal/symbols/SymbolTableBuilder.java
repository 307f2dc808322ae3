package com.questrail.vcd.internal.symbols;

import com.questrail.vcd.api.SignalId;
import com.questrail.vcd.codec.VcdToken;
import com.questrail.vcd.internal.DiagnosticLog;
import com.questrail.vcd.model.Signal;
import com.questrail.vcd.observability.DiagnosticKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * SymbolTableBuilder
 * -----------------------------------------------------------------------------
 * Builds the identifier-to-signal table from the declaration section of a dump.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Track scope nesting ({@code $scope} / {@code $upscope})</li>
 *   <li>Compute each signal's hierarchical name once, at declaration time</li>
 *   <li>Register signals by identifier token, first declaration wins</li>
 *   <li>Freeze on {@code $enddefinitions}</li>
 * </ul>
 *
 * <h2>Recoverable conditions</h2>
 * <ul>
 *   <li>An identifier declared twice: {@link DiagnosticKind#DUPLICATE_IDENTIFIER},
 *       the later declaration is ignored</li>
 *   <li>A hierarchical name declared twice under different identifiers: also
 *       {@link DiagnosticKind#DUPLICATE_IDENTIFIER}, the later one is ignored</li>
 *   <li>Any declaration after freezing:
 *       {@link DiagnosticKind#DECLARATION_AFTER_FREEZE}, ignored</li>
 *   <li>Non-positive width, an illegal identifier, or {@code $upscope} with no
 *       open scope: {@link DiagnosticKind#MALFORMED_LINE}, ignored</li>
 * </ul>
 *
 * <p>Owned by a single parse; not thread-safe.</p>
 */
public final class SymbolTableBuilder
{
    private final DiagnosticLog diagnostics;
    private final List<String> scopes = new ArrayList<>();
    private final Map<String, Signal> byToken = new LinkedHashMap<>();
    private final Set<String> names = new HashSet<>();
    private SymbolTable frozen;

    public SymbolTableBuilder(DiagnosticLog diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public boolean isFrozen() {
        return frozen != null;
    }

    /**
     * Returns the frozen table.
     *
     * @throws IllegalStateException if {@code $enddefinitions} has not been seen
     */
    public SymbolTable table() {
        if (frozen == null) {
            throw new IllegalStateException("Symbol table is not frozen yet");
        }
        return frozen;
    }

    public void onScopeEnter(VcdToken.ScopeEnter token) {
        if (rejectAfterFreeze(token)) {
            return;
        }
        scopes.add(token.name());
    }

    public void onScopeExit(VcdToken.ScopeExit token) {
        if (rejectAfterFreeze(token)) {
            return;
        }
        if (scopes.isEmpty()) {
            diagnostics.report(DiagnosticKind.MALFORMED_LINE, token, "$upscope without an open scope");
            return;
        }
        scopes.remove(scopes.size() - 1);
    }

    public void onVarDecl(VcdToken.VarDecl token) {
        if (rejectAfterFreeze(token)) {
            return;
        }
        if (token.width() < 1) {
            diagnostics.report(DiagnosticKind.MALFORMED_LINE, token,
                    "variable '" + token.name() + "' has non-positive width " + token.width());
            return;
        }
        if (!SignalId.isValidToken(token.id())) {
            diagnostics.report(DiagnosticKind.MALFORMED_LINE, token,
                    "illegal identifier '" + token.id() + "'");
            return;
        }

        Signal existing = byToken.get(token.id());
        if (existing != null) {
            diagnostics.report(DiagnosticKind.DUPLICATE_IDENTIFIER, token,
                    "identifier '" + token.id() + "' already declared as " + existing.name()
                            + "; ignoring '" + token.name() + "'");
            return;
        }

        Signal signal = Signal.declare(SignalId.of(token.id()), token.kind(), token.width(),
                List.copyOf(scopes), token.name());
        if (!names.add(signal.name())) {
            diagnostics.report(DiagnosticKind.DUPLICATE_IDENTIFIER, token,
                    "name '" + signal.name() + "' already declared; ignoring identifier '" + token.id() + "'");
            return;
        }
        byToken.put(token.id(), signal);
    }

    /**
     * Freezes the table. The first {@code $enddefinitions} wins; a repeated
     * one is reported and otherwise ignored.
     */
    public void onEndDefinitions(VcdToken.EndDefinitions token) {
        if (rejectAfterFreeze(token)) {
            return;
        }
        frozen = new SymbolTable(byToken);
    }

    private boolean rejectAfterFreeze(VcdToken token) {
        if (frozen == null) {
            return false;
        }
        diagnostics.report(DiagnosticKind.DECLARATION_AFTER_FREEZE, token,
                "declaration after $enddefinitions ignored");
        return true;
    }
}

package com.questrail.vcd.internal.symbols;

import com.questrail.vcd.api.SignalId;
import com.questrail.vcd.model.Signal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Frozen identifier-to-signal table produced by {@link SymbolTableBuilder}.
 *
 * <p>Iteration order is declaration order.</p>
 */
public final class SymbolTable
{
    private final Map<String, Signal> byToken;
    private final List<Signal> signals;

    SymbolTable(Map<String, Signal> byToken) {
        this.byToken = Collections.unmodifiableMap(new LinkedHashMap<>(byToken));
        this.signals = List.copyOf(byToken.values());
    }

    /**
     * Resolves a raw identifier token as it appears in a value change.
     */
    public Optional<Signal> lookup(String token) {
        return Optional.ofNullable(byToken.get(token));
    }

    public Optional<Signal> lookup(SignalId id) {
        return lookup(id.token());
    }

    public List<Signal> signals() {
        return signals;
    }

    public int size() {
        return signals.size();
    }
}

package com.questrail.vcd.mapping;

import com.questrail.vcd.api.SignalId;
import com.questrail.vcd.api.VcdDocument;
import com.questrail.vcd.model.Signal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * SignalIndex
 * -----------------------------------------------------------------------------
 * Resolves the names humans use for signals to the identifier tokens a
 * document is keyed by.
 *
 * <h2>Why this exists</h2>
 * Value changes refer to signals through opaque tokens such as {@code !} or
 * {@code %}. People and reports refer to them by hierarchical name
 * ({@code spi_master_tb.dut.sclk}), by the trailing part of that name
 * ({@code sclk}), or by a short display label ({@code SCLK}). This class keeps
 * all of those lookups out of the query engine.
 *
 * <h2>Resolution</h2>
 * <ul>
 *   <li>{@link #byName(String)} - exact hierarchical name</li>
 *   <li>{@link #tryResolveBySuffix(String)} - case-insensitive match on the end
 *       of the hierarchical name, first in declaration order; best effort</li>
 *   <li>{@link #tryResolveByLabel(String)} - via {@link SignalAliases}</li>
 * </ul>
 */
public final class SignalIndex
{
    private final List<Signal> signals;
    private final Map<String, Signal> byName;
    private final SignalAliases aliases;

    public SignalIndex(VcdDocument document) {
        this(document, SignalAliases.none());
    }

    public SignalIndex(VcdDocument document, SignalAliases aliases) {
        Objects.requireNonNull(document, "document");
        this.aliases = Objects.requireNonNull(aliases, "aliases");
        this.signals = document.signals();

        Map<String, Signal> tmp = new LinkedHashMap<>(signals.size() * 2);
        for (Signal signal : signals) {
            tmp.putIfAbsent(signal.name(), signal);
        }
        this.byName = Collections.unmodifiableMap(tmp);
    }

    public int size() {
        return signals.size();
    }

    public Optional<Signal> byName(String name) {
        Objects.requireNonNull(name, "name");
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Attempts to resolve a signal whose hierarchical name ends with
     * {@code suffix}, ignoring case.
     * <p>
     * A match must start at a scope boundary: {@code clk} matches
     * {@code top.clk} but not {@code top.sclk}.
     */
    public Optional<Signal> tryResolveBySuffix(String suffix) {
        Objects.requireNonNull(suffix, "suffix");
        String wanted = suffix.toLowerCase(Locale.ROOT);
        for (Signal signal : signals) {
            String name = signal.name().toLowerCase(Locale.ROOT);
            if (name.equals(wanted) || name.endsWith("." + wanted)) {
                return Optional.of(signal);
            }
        }
        return Optional.empty();
    }

    /**
     * Attempts to resolve a signal by its display label.
     */
    public Optional<Signal> tryResolveByLabel(String label) {
        Objects.requireNonNull(label, "label");
        for (Signal signal : signals) {
            if (aliases.labelOf(signal).filter(label::equals).isPresent()) {
                return Optional.of(signal);
            }
        }
        return Optional.empty();
    }

    /**
     * Tries every lookup in turn: exact name, label, identifier token, suffix.
     */
    public Optional<Signal> resolve(String text) {
        Objects.requireNonNull(text, "text");
        Optional<Signal> found = byName(text);
        if (found.isEmpty()) {
            found = tryResolveByLabel(text);
        }
        if (found.isEmpty() && SignalId.isValidToken(text)) {
            SignalId id = SignalId.of(text);
            found = signals.stream().filter(s -> s.id().equals(id)).findFirst();
        }
        if (found.isEmpty()) {
            found = tryResolveBySuffix(text);
        }
        return found;
    }

    /**
     * Display label for a signal: its alias if one is configured, else its
     * hierarchical name.
     */
    public String displayName(Signal signal) {
        Objects.requireNonNull(signal, "signal");
        return aliases.labelOf(signal).orElse(signal.name());
    }
}

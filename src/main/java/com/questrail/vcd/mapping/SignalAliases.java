package com.questrail.vcd.mapping;

import com.questrail.vcd.model.Signal;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Display labels for signals, keyed by hierarchical name or by identifier token.
 *
 * <p>A label keyed by hierarchical name takes precedence over one keyed by token.
 * Labels are descriptive only and never affect queries.</p>
 */
public final class SignalAliases
{
    private static final SignalAliases NONE = new SignalAliases(Map.of(), Map.of());

    private final Map<String, String> byName;
    private final Map<String, String> byToken;

    private SignalAliases(Map<String, String> byName, Map<String, String> byToken) {
        this.byName = Collections.unmodifiableMap(new HashMap<>(byName));
        this.byToken = Collections.unmodifiableMap(new HashMap<>(byToken));
    }

    public static SignalAliases none() {
        return NONE;
    }

    public Optional<String> labelOf(Signal signal) {
        Objects.requireNonNull(signal, "signal");
        String label = byName.get(signal.name());
        if (label == null) {
            label = byToken.get(signal.id().token());
        }
        return Optional.ofNullable(label);
    }

    public boolean isEmpty() {
        return byName.isEmpty() && byToken.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, String> byName = new HashMap<>();
        private final Map<String, String> byToken = new HashMap<>();

        public Builder aliasName(String hierarchicalName, String label) {
            byName.put(Objects.requireNonNull(hierarchicalName, "hierarchicalName"),
                    Objects.requireNonNull(label, "label"));
            return this;
        }

        public Builder aliasToken(String token, String label) {
            byToken.put(Objects.requireNonNull(token, "token"),
                    Objects.requireNonNull(label, "label"));
            return this;
        }

        public SignalAliases build() {
            return new SignalAliases(byName, byToken);
        }
    }
}

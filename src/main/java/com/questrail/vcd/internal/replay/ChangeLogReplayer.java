package com.questrail.vcd.internal.replay;

import com.questrail.vcd.api.SignalId;
import com.questrail.vcd.codec.VcdToken;
import com.questrail.vcd.internal.DiagnosticLog;
import com.questrail.vcd.internal.symbols.SymbolTable;
import com.questrail.vcd.model.ChangeLog;
import com.questrail.vcd.model.Signal;
import com.questrail.vcd.observability.DiagnosticKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ChangeLogReplayer
 * -----------------------------------------------------------------------------
 * Walks the value section of a dump and appends every change to the change log
 * of the signal it names.
 *
 * <h2>Time cursor</h2>
 * <p>A single cursor starts at 0. Changes seen before the first time marker
 * (typically the {@code $dumpvars} burst) therefore apply at time 0. A time
 * marker that goes backwards is reported as
 * {@link DiagnosticKind#TIME_ORDERING_VIOLATION} and the cursor stays where it
 * was, so following changes apply at the last known time and every change
 * log remains non-decreasing.</p>
 *
 * <h2>Discarded events</h2>
 * <ul>
 *   <li>Undeclared identifier: {@link DiagnosticKind#UNKNOWN_SIGNAL_REFERENCE}</li>
 *   <li>Illegal value digits: {@link DiagnosticKind#MALFORMED_LINE}</li>
 * </ul>
 *
 * <p>Owned by a single parse; not thread-safe.</p>
 */
public final class ChangeLogReplayer
{
    /**
     * Result of a completed replay.
     *
     * @param logs    one change log per declared signal, declaration order
     * @param maxTime greatest cursor value observed
     * @param changes total number of changes appended
     */
    public record Result(Map<SignalId, ChangeLog> logs, long maxTime, long changes) {}

    private final SymbolTable symbols;
    private final ValueNormalizer normalizer;
    private final DiagnosticLog diagnostics;
    private final Map<SignalId, ChangeLog.Builder> builders = new LinkedHashMap<>();

    private long currentTime;
    private long maxTime;
    private long changes;

    public ChangeLogReplayer(SymbolTable symbols, ValueNormalizer normalizer, DiagnosticLog diagnostics) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        for (Signal signal : symbols.signals()) {
            builders.put(signal.id(), ChangeLog.builder());
        }
    }

    public long currentTime() {
        return currentTime;
    }

    public void onTimeMarker(VcdToken.TimeMarker token) {
        if (token.time() < currentTime) {
            diagnostics.report(DiagnosticKind.TIME_ORDERING_VIOLATION, token,
                    "time " + token.time() + " precedes current time " + currentTime
                            + "; applying following changes at " + currentTime);
            return;
        }
        currentTime = token.time();
        maxTime = Math.max(maxTime, currentTime);
    }

    public void onScalarChange(VcdToken.ScalarChange token) {
        apply(token, token.id(), String.valueOf(token.value()));
    }

    public void onVectorChange(VcdToken.VectorChange token) {
        apply(token, token.id(), token.bits());
    }

    private void apply(VcdToken token, String idToken, String digits) {
        Optional<Signal> signal = symbols.lookup(idToken);
        if (signal.isEmpty()) {
            diagnostics.report(DiagnosticKind.UNKNOWN_SIGNAL_REFERENCE, token,
                    "value change for undeclared identifier '" + idToken + "' discarded");
            return;
        }
        Signal s = signal.get();
        Optional<String> value = normalizer.normalize(digits, s.width());
        if (value.isEmpty()) {
            diagnostics.report(DiagnosticKind.MALFORMED_LINE, token,
                    "illegal value '" + digits + "' for " + s.name());
            return;
        }
        builders.get(s.id()).append(currentTime, value.get());
        changes++;
    }

    public Result finish() {
        Map<SignalId, ChangeLog> logs = new LinkedHashMap<>();
        builders.forEach((id, builder) -> logs.put(id, builder.build()));
        return new Result(Collections.unmodifiableMap(logs), maxTime, changes);
    }
}

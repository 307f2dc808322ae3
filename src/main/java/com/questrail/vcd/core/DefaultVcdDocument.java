package com.questrail.vcd.core;

import com.questrail.vcd.api.SignalId;
import com.questrail.vcd.api.Table;
import com.questrail.vcd.api.TimeGrid;
import com.questrail.vcd.api.UnboundSignalException;
import com.questrail.vcd.api.VcdDocument;
import com.questrail.vcd.model.ChangeLog;
import com.questrail.vcd.model.Signal;
import com.questrail.vcd.model.Timescale;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable {@link VcdDocument} assembled by the parser.
 *
 * <p>Signals and their change logs are held in declaration order. All state is
 * fixed at construction.</p>
 */
public final class DefaultVcdDocument implements VcdDocument
{
    private static final TabularProjector PROJECTOR = new TabularProjector();

    private final Timescale timescale;
    private final Map<String, String> headers;
    private final Map<SignalId, Signal> signals;
    private final Map<SignalId, ChangeLog> logs;
    private final List<Signal> signalList;
    private final long maxTime;

    public DefaultVcdDocument(Timescale timescale,
                              Map<String, String> headers,
                              List<Signal> signals,
                              Map<SignalId, ChangeLog> logs,
                              long maxTime) {
        this.timescale = Objects.requireNonNull(timescale, "timescale");
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(headers, "headers")));
        Objects.requireNonNull(signals, "signals");
        Objects.requireNonNull(logs, "logs");

        Map<SignalId, Signal> byId = new LinkedHashMap<>();
        Map<SignalId, ChangeLog> logsById = new LinkedHashMap<>();
        for (Signal signal : signals) {
            if (byId.put(signal.id(), signal) != null) {
                throw new IllegalArgumentException("Duplicate signal id: " + signal.id());
            }
            logsById.put(signal.id(), logs.getOrDefault(signal.id(), ChangeLog.empty()));
        }
        this.signals = Collections.unmodifiableMap(byId);
        this.logs = Collections.unmodifiableMap(logsById);
        this.signalList = List.copyOf(signals);

        if (maxTime < 0) {
            throw new IllegalArgumentException("maxTime must be non-negative");
        }
        this.maxTime = maxTime;
    }

    @Override
    public Timescale timescale() {
        return timescale;
    }

    @Override
    public Optional<String> header(String key) {
        Objects.requireNonNull(key, "key");
        return Optional.ofNullable(headers.get(key));
    }

    @Override
    public List<Signal> signals() {
        return signalList;
    }

    @Override
    public Optional<Signal> signal(SignalId id) {
        Objects.requireNonNull(id, "id");
        return Optional.ofNullable(signals.get(id));
    }

    @Override
    public ChangeLog changes(SignalId id) {
        Objects.requireNonNull(id, "id");
        ChangeLog log = logs.get(id);
        if (log == null) {
            throw new UnboundSignalException(id);
        }
        return log;
    }

    @Override
    public String valueAt(SignalId id, long t) {
        Signal signal = requireSignal(Objects.requireNonNull(id, "id"));
        return logs.get(id).valueAt(t).orElseGet(signal::unknownValue);
    }

    @Override
    public Table project(List<SignalId> ids, TimeGrid grid) {
        return PROJECTOR.project(this, ids, grid);
    }

    @Override
    public long maxTime() {
        return maxTime;
    }

    @Override
    public String toString() {
        return "VcdDocument[timescale=" + timescale + ", signals=" + signalList.size() + ", maxTime=" + maxTime + "]";
    }
}

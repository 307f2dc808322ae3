package com.questrail.vcd.report;

import com.questrail.vcd.api.VcdDocument;
import com.questrail.vcd.model.ChangeEvent;
import com.questrail.vcd.model.ChangeLog;
import com.questrail.vcd.model.Signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One line of a signal overview: name, width, how many changes were recorded
 * and the value the signal ends on.
 *
 * @param signal       the summarized signal
 * @param totalChanges recorded change count, repeated identical values included
 * @param transitions  changes whose value differs from the previous recorded value
 * @param finalValue   last recorded value, or unknown if none was recorded
 */
public record SignalSummary(Signal signal, int totalChanges, int transitions, String finalValue)
{
    public SignalSummary {
        Objects.requireNonNull(signal, "signal");
        Objects.requireNonNull(finalValue, "finalValue");
    }

    public static SignalSummary of(Signal signal, ChangeLog log) {
        Objects.requireNonNull(signal, "signal");
        Objects.requireNonNull(log, "log");
        String finalValue = log.last().map(ChangeEvent::value).orElseGet(signal::unknownValue);
        return new SignalSummary(signal, log.size(), TransitionStatistics.countTransitions(log), finalValue);
    }

    /**
     * Summarizes every signal of a document in declaration order.
     */
    public static List<SignalSummary> of(VcdDocument document) {
        Objects.requireNonNull(document, "document");
        List<SignalSummary> summaries = new ArrayList<>(document.signals().size());
        for (Signal signal : document.signals()) {
            summaries.add(of(signal, document.changes(signal.id())));
        }
        return summaries;
    }
}

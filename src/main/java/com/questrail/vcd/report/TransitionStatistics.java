package com.questrail.vcd.report;

import com.questrail.vcd.api.SignalId;
import com.questrail.vcd.api.Table;
import com.questrail.vcd.api.VcdDocument;
import com.questrail.vcd.model.ChangeLog;
import com.questrail.vcd.model.Signal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Transition counts over change logs and projected tables.
 *
 * <p>A transition is a recorded value that differs from the value before it.
 * The first recorded value counts as a transition out of the unknown state
 * unless it is itself all-unknown. Repeated identical values are not
 * transitions.</p>
 */
public final class TransitionStatistics
{
    private TransitionStatistics() {}

    public static int countTransitions(ChangeLog log) {
        Objects.requireNonNull(log, "log");
        int count = 0;
        String previous = null;
        for (int i = 0; i < log.size(); i++) {
            String value = log.get(i).value();
            if (previous == null ? !isUnknown(value) : !value.equals(previous)) {
                count++;
            }
            previous = value;
        }
        return count;
    }

    /**
     * Transition count per signal, declaration order.
     */
    public static Map<SignalId, Integer> perSignal(VcdDocument document) {
        Objects.requireNonNull(document, "document");
        Map<SignalId, Integer> counts = new LinkedHashMap<>();
        for (Signal signal : document.signals()) {
            counts.put(signal.id(), countTransitions(document.changes(signal.id())));
        }
        return Collections.unmodifiableMap(counts);
    }

    public static long total(VcdDocument document) {
        return perSignal(document).values().stream().mapToLong(Integer::longValue).sum();
    }

    /**
     * Counts value changes between consecutive rows of one table column.
     */
    public static int countTransitions(Table table, SignalId column) {
        Objects.requireNonNull(table, "table");
        List<String> series = table.series(column);
        int count = 0;
        for (int i = 1; i < series.size(); i++) {
            if (!series.get(i).equals(series.get(i - 1))) {
                count++;
            }
        }
        return count;
    }

    static boolean isUnknown(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) != 'x') {
                return false;
            }
        }
        return true;
    }
}

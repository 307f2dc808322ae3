package com.questrail.vcd.core;

import com.questrail.vcd.api.SignalId;
import com.questrail.vcd.api.Table;
import com.questrail.vcd.api.TimeGrid;
import com.questrail.vcd.api.VcdDocument;
import com.questrail.vcd.model.ChangeLog;
import com.questrail.vcd.model.Signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * TabularProjector
 * -----------------------------------------------------------------------------
 * Samples several signals of a {@link VcdDocument} on a common time grid.
 *
 * <p>Every requested signal is resolved before any sampling starts, so an
 * undeclared id fails the whole projection up front rather than producing a
 * partial table. Each cell is a point-in-time lookup; cells before a signal's
 * first change hold the width-appropriate unknown value.</p>
 *
 * <p>Stateless and safe to share.</p>
 */
public final class TabularProjector
{
    public Table project(VcdDocument document, List<SignalId> ids, TimeGrid grid) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(ids, "ids");
        Objects.requireNonNull(grid, "grid");

        List<Signal> signals = new ArrayList<>(ids.size());
        for (SignalId id : ids) {
            signals.add(document.requireSignal(Objects.requireNonNull(id, "id")));
        }

        List<Long> times = gridTimes(document, signals, grid);
        List<Table.Row> rows = new ArrayList<>(times.size());
        for (long t : times) {
            List<String> values = new ArrayList<>(signals.size());
            for (Signal signal : signals) {
                values.add(document.valueAt(signal.id(), t));
            }
            rows.add(new Table.Row(t, values));
        }
        return new Table(ids, rows);
    }

    private static List<Long> gridTimes(VcdDocument document, List<Signal> signals, TimeGrid grid) {
        if (grid instanceof TimeGrid.Explicit explicit) {
            return explicit.times();
        }
        TreeSet<Long> union = new TreeSet<>();
        for (Signal signal : signals) {
            ChangeLog log = document.changes(signal.id());
            for (long t : log.times()) {
                union.add(t);
            }
        }
        return List.copyOf(union);
    }
}

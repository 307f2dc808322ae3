package com.questrail.vcd.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Table
 * -----------------------------------------------------------------------------
 * A rectangular, time-aligned projection of several signals.
 *
 * <p>One row per grid timestamp, one column per requested signal. The
 * constructor enforces the shape guarantees that downstream consumers
 * (CSV export, plotting, statistics) rely on:</p>
 * <ul>
 *   <li>rows are strictly ascending in time, with no duplicate timestamps</li>
 *   <li>every row has exactly one value per column; cells are never missing</li>
 * </ul>
 *
 * @param columns the projected signals, in request order
 * @param rows    the sampled rows, ascending by time
 */
public record Table(List<SignalId> columns, List<Row> rows)
{
    public Table {
        columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
        rows = List.copyOf(Objects.requireNonNull(rows, "rows"));

        long previous = Long.MIN_VALUE;
        boolean first = true;
        for (Row row : rows) {
            if (row.values().size() != columns.size()) {
                throw new IllegalArgumentException(
                        "Row at time " + row.time() + " has " + row.values().size()
                                + " values for " + columns.size() + " columns");
            }
            if (!first && row.time() <= previous) {
                throw new IllegalArgumentException(
                        "Rows must be strictly ascending in time: " + row.time()
                                + " follows " + previous);
            }
            previous = row.time();
            first = false;
        }
    }

    /**
     * A single sampled instant.
     *
     * @param time   timestamp in document time units
     * @param values one value per column, in column order
     */
    public record Row(long time, List<String> values) {
        public Row {
            values = List.copyOf(Objects.requireNonNull(values, "values"));
        }

        public String value(int column) {
            return values.get(column);
        }
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Returns the sampled timestamps in row order.
     */
    public List<Long> times() {
        List<Long> times = new ArrayList<>(rows.size());
        for (Row row : rows) {
            times.add(row.time());
        }
        return times;
    }

    /**
     * Extracts one column as a series of values in row order.
     *
     * @throws IllegalArgumentException if the signal is not a column of this table
     */
    public List<String> series(SignalId id) {
        Objects.requireNonNull(id, "id");
        int column = columns.indexOf(id);
        if (column < 0) {
            throw new IllegalArgumentException("Signal is not a column of this table: " + id);
        }
        List<String> series = new ArrayList<>(rows.size());
        for (Row row : rows) {
            series.add(row.value(column));
        }
        return series;
    }
}

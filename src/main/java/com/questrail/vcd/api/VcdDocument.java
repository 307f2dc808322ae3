package com.questrail.vcd.api;

import com.questrail.vcd.model.ChangeLog;
import com.questrail.vcd.model.Signal;
import com.questrail.vcd.model.Timescale;

import java.util.List;
import java.util.Optional;

/**
 * VcdDocument
 * -----------------------------------------------------------------------------
 * The fully reconstructed contents of one Value-Change Dump.
 *
 * <p>A document is produced by a single parse pass and is immutable from then
 * on. It aggregates:</p>
 * <ul>
 *   <li>the {@link Timescale} applying to every timestamp</li>
 *   <li>the declared {@link Signal}s, in declaration order</li>
 *   <li>one {@link ChangeLog} per signal</li>
 *   <li>the greatest timestamp seen while replaying</li>
 * </ul>
 *
 * <h2>Query semantics</h2>
 * <p>{@link #valueAt(SignalId, long)} answers "what did this signal hold at
 * time T" from the sparse change history:</p>
 * <ul>
 *   <li>before the first recorded change the value is unknown: {@code x}
 *       repeated to the signal width</li>
 *   <li>between two changes the earlier one holds</li>
 *   <li>after the last change the last value holds forever</li>
 *   <li>several changes at the same time resolve to the last one recorded</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are deeply immutable. Any number of threads may query the
 * same document concurrently without coordination.</p>
 */
public interface VcdDocument
{
    Timescale timescale();

    /**
     * Returns the body of a header command such as {@code date} or
     * {@code version}, if the dump carried one.
     *
     * @param key header keyword without the leading {@code $}
     */
    Optional<String> header(String key);

    /**
     * Returns all declared signals in declaration order.
     */
    List<Signal> signals();

    /**
     * Looks up a declared signal.
     */
    Optional<Signal> signal(SignalId id);

    /**
     * Looks up a declared signal, failing if it is not declared.
     *
     * @throws UnboundSignalException if the id is not declared
     */
    default Signal requireSignal(SignalId id) {
        return signal(id).orElseThrow(() -> new UnboundSignalException(id));
    }

    /**
     * Returns the recorded change history of a signal.
     *
     * @throws UnboundSignalException if the id is not declared
     */
    ChangeLog changes(SignalId id);

    /**
     * Returns the value in effect for a signal at time {@code t}.
     *
     * @throws UnboundSignalException if the id is not declared
     */
    String valueAt(SignalId id, long t);

    /**
     * Samples several signals on a common time grid.
     *
     * @param ids  signals to project, one column each, in the given order
     * @param grid timestamps to sample
     * @return a rectangular table with strictly ascending rows
     * @throws UnboundSignalException if any id is not declared
     */
    Table project(List<SignalId> ids, TimeGrid grid);

    /**
     * The greatest timestamp observed while replaying the dump.
     */
    long maxTime();
}

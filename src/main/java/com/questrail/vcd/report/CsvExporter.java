package com.questrail.vcd.report;

import com.questrail.vcd.api.SignalId;
import com.questrail.vcd.api.Table;
import com.questrail.vcd.api.TimeGrid;
import com.questrail.vcd.api.VcdDocument;
import com.questrail.vcd.mapping.SignalIndex;
import com.questrail.vcd.model.ChangeEvent;
import com.questrail.vcd.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * CsvExporter
 * -----------------------------------------------------------------------------
 * Writes documents and projections as comma-separated text for plotting tools
 * and spreadsheets.
 *
 * <ul>
 *   <li>{@link #writeTable} - one row per sampled time, one column per signal</li>
 *   <li>{@link #writeSeries} - the raw change history of one signal</li>
 *   <li>{@link #writeSummary} - name, width, change count and final value per signal</li>
 *   <li>{@link #exportAll} - all of the above as files in one directory</li>
 * </ul>
 *
 * <p>Column headers use {@link SignalIndex#displayName(Signal)}, so configured
 * aliases appear in place of hierarchical names. Fields are quoted per
 * RFC 4180 when they contain a comma, a quote or a line break. Lines end with
 * {@code \n}.</p>
 */
public final class CsvExporter
{
    private static final Logger log = LoggerFactory.getLogger(CsvExporter.class);

    public static final String TIMING_FILE = "timing_data.csv";
    public static final String SUMMARY_FILE = "signal_summary.csv";

    private final VcdDocument document;
    private final SignalIndex index;

    public CsvExporter(VcdDocument document, SignalIndex index) {
        this.document = Objects.requireNonNull(document, "document");
        this.index = Objects.requireNonNull(index, "index");
    }

    public CsvExporter(VcdDocument document) {
        this(document, new SignalIndex(document));
    }

    public void writeTable(Table table, Writer out) throws IOException {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(out, "out");

        List<String> header = new ArrayList<>(table.columns().size() + 1);
        header.add(timeHeader());
        for (SignalId id : table.columns()) {
            header.add(index.displayName(document.requireSignal(id)));
        }
        writeRow(out, header);

        for (Table.Row row : table.rows()) {
            List<String> fields = new ArrayList<>(row.values().size() + 1);
            fields.add(Long.toString(row.time()));
            fields.addAll(row.values());
            writeRow(out, fields);
        }
    }

    public void writeSeries(SignalId id, Writer out) throws IOException {
        Objects.requireNonNull(out, "out");
        Signal signal = document.requireSignal(Objects.requireNonNull(id, "id"));
        writeRow(out, List.of(timeHeader(), index.displayName(signal)));
        for (ChangeEvent event : document.changes(id).events()) {
            writeRow(out, List.of(Long.toString(event.time()), event.value()));
        }
    }

    public void writeSummary(List<SignalSummary> summaries, Writer out) throws IOException {
        Objects.requireNonNull(summaries, "summaries");
        Objects.requireNonNull(out, "out");
        writeRow(out, List.of("Signal Name", "Width (bits)", "Total Changes", "Transitions", "Final Value"));
        for (SignalSummary s : summaries) {
            writeRow(out, List.of(
                    index.displayName(s.signal()),
                    Integer.toString(s.signal().width()),
                    Integer.toString(s.totalChanges()),
                    Integer.toString(s.transitions()),
                    s.finalValue()));
        }
    }

    /**
     * Writes the full timing table of every signal, the summary, and one series
     * file per signal into {@code directory}, creating it if needed.
     *
     * @return the files written, timing table first
     */
    public List<Path> exportAll(Path directory) throws IOException {
        Objects.requireNonNull(directory, "directory");
        Files.createDirectories(directory);
        List<Path> written = new ArrayList<>();

        List<SignalId> all = document.signals().stream().map(Signal::id).toList();
        Path timing = directory.resolve(TIMING_FILE);
        try (Writer out = Files.newBufferedWriter(timing, StandardCharsets.UTF_8)) {
            writeTable(document.project(all, TimeGrid.allChangeTimes()), out);
        }
        written.add(timing);

        Path summary = directory.resolve(SUMMARY_FILE);
        try (Writer out = Files.newBufferedWriter(summary, StandardCharsets.UTF_8)) {
            writeSummary(SignalSummary.of(document), out);
        }
        written.add(summary);

        Set<String> usedNames = new HashSet<>();
        for (Signal signal : document.signals()) {
            Path series = directory.resolve(uniqueSeriesFileName(signal, usedNames));
            try (Writer out = Files.newBufferedWriter(series, StandardCharsets.UTF_8)) {
                writeSeries(signal.id(), out);
            }
            written.add(series);
        }

        log.info("Exported {} CSV files for {} signals to {}", written.size(), document.signals().size(), directory);
        return written;
    }

    String seriesFileName(Signal signal) {
        String safe = index.displayName(signal).replaceAll("[^A-Za-z0-9._-]", "_");
        return "signal_" + safe + "_data.csv";
    }

    /**
     * Series file name not yet in {@code usedNames}. Display names that only
     * differ in characters replaced during sanitizing get a numeric suffix,
     * so no export overwrites another.
     */
    String uniqueSeriesFileName(Signal signal, Set<String> usedNames) {
        String name = seriesFileName(signal);
        String stem = name.substring(0, name.length() - "_data.csv".length());
        for (int n = 2; !usedNames.add(name); n++) {
            name = stem + "_" + n + "_data.csv";
        }
        return name;
    }

    private String timeHeader() {
        return "Time (" + document.timescale() + ")";
    }

    private static void writeRow(Writer out, List<String> fields) throws IOException {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                out.write(',');
            }
            out.write(quote(fields.get(i)));
        }
        out.write('\n');
    }

    static String quote(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0
                && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}

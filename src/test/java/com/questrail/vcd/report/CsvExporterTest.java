package com.questrail.vcd.report;

import com.questrail.vcd.api.SignalId;
import com.questrail.vcd.api.TimeGrid;
import com.questrail.vcd.api.VcdDocument;
import com.questrail.vcd.mapping.SignalAliases;
import com.questrail.vcd.mapping.SignalIndex;
import com.questrail.vcd.parse.VcdParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CsvExporterTest
{
    private static final String DUMP = """
            $timescale 10 ps $end
            $scope module top $end
            $var wire 1 ! clk $end
            $var reg 4 ' nib [3:0] $end
            $upscope $end
            $enddefinitions $end
            #0
            0!
            #5
            1!
            b1001 '
            #10
            0!
            """;

    private final VcdDocument doc = new VcdParser().parse(DUMP).document();

    @Test
    void writesTimingTableWithTimescaleHeader() throws IOException
    {
        StringWriter out = new StringWriter();
        new CsvExporter(doc).writeTable(
                doc.project(List.of(SignalId.of("!"), SignalId.of("'")), TimeGrid.allChangeTimes()), out);

        assertEquals("""
                Time (10ps),top.clk,top.nib
                0,0,xxxx
                5,1,1001
                10,0,1001
                """, out.toString());
    }

    @Test
    void aliasesReplaceColumnHeaders() throws IOException
    {
        SignalAliases aliases = SignalAliases.builder().aliasToken("!", "Clock, main").build();
        StringWriter out = new StringWriter();
        new CsvExporter(doc, new SignalIndex(doc, aliases)).writeSeries(SignalId.of("!"), out);

        assertEquals("""
                Time (10ps),"Clock, main"
                0,0
                5,1
                10,0
                """, out.toString());
    }

    @Test
    void writesSummaryRows() throws IOException
    {
        StringWriter out = new StringWriter();
        new CsvExporter(doc).writeSummary(SignalSummary.of(doc), out);

        assertEquals("""
                Signal Name,Width (bits),Total Changes,Transitions,Final Value
                top.clk,1,3,3,0
                top.nib,4,1,1,1001
                """, out.toString());
    }

    @Test
    void quotesFieldsPerRfc4180()
    {
        assertEquals("plain", CsvExporter.quote("plain"));
        assertEquals("\"a,b\"", CsvExporter.quote("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", CsvExporter.quote("say \"hi\""));
        assertEquals("\"two\nlines\"", CsvExporter.quote("two\nlines"));
    }

    @Test
    void exportAllWritesOneFilePerSignal(@TempDir Path dir) throws IOException
    {
        CsvExporter exporter = new CsvExporter(doc);
        List<Path> written = exporter.exportAll(dir.resolve("out"));

        assertEquals(4, written.size());
        assertEquals(CsvExporter.TIMING_FILE, written.get(0).getFileName().toString());
        assertEquals(CsvExporter.SUMMARY_FILE, written.get(1).getFileName().toString());
        assertEquals("signal_top.clk_data.csv", written.get(2).getFileName().toString());

        List<String> timing = Files.readAllLines(written.get(0), StandardCharsets.UTF_8);
        assertEquals(4, timing.size());
        assertEquals("5,1,1001", timing.get(2));
        for (Path file : written) {
            assertTrue(Files.isRegularFile(file), file::toString);
        }
    }

    @Test
    void sanitizedNameCollisionsGetDistinctFiles(@TempDir Path dir) throws IOException
    {
        VcdDocument clash = new VcdParser().parse("""
                $scope module tb $end
                $var wire 1 ! a[0] $end
                $var wire 1 " a(0) $end
                $upscope $end
                $enddefinitions $end
                #0
                1!
                0"
                """).document();

        List<Path> written = new CsvExporter(clash).exportAll(dir);

        assertEquals(4, written.size());
        assertEquals(4, written.stream().distinct().count());
        assertEquals("signal_tb.a_0__data.csv", written.get(2).getFileName().toString());
        assertEquals("signal_tb.a_0__2_data.csv", written.get(3).getFileName().toString());
        assertEquals("0", Files.readAllLines(written.get(3), StandardCharsets.UTF_8).get(1).split(",")[1]);
    }

    @Test
    void seriesFileNamesAreSanitized()
    {
        SignalAliases aliases = SignalAliases.builder().aliasName("top.nib", "data bus/low").build();
        CsvExporter exporter = new CsvExporter(doc, new SignalIndex(doc, aliases));

        assertEquals("signal_data_bus_low_data.csv",
                exporter.seriesFileName(doc.requireSignal(SignalId.of("'"))));
    }
}

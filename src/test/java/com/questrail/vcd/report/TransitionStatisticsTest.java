package com.questrail.vcd.report;

import com.questrail.vcd.api.SignalId;
import com.questrail.vcd.api.TimeGrid;
import com.questrail.vcd.api.VcdDocument;
import com.questrail.vcd.model.ChangeLog;
import com.questrail.vcd.model.Signal;
import com.questrail.vcd.parse.VcdParser;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class TransitionStatisticsTest
{
    @Test
    void firstKnownValueCountsAsTransition()
    {
        ChangeLog log = ChangeLog.builder()
                .append(0, "0")
                .append(10, "1")
                .append(20, "1")
                .append(30, "0")
                .build();
        assertEquals(3, TransitionStatistics.countTransitions(log));
    }

    @Test
    void initialUnknownIsNotATransition()
    {
        ChangeLog log = ChangeLog.builder()
                .append(0, "xxxx")
                .append(10, "1010")
                .build();
        assertEquals(1, TransitionStatistics.countTransitions(log));
        assertEquals(0, TransitionStatistics.countTransitions(ChangeLog.empty()));
        assertTrue(TransitionStatistics.isUnknown("xx"));
        assertFalse(TransitionStatistics.isUnknown("x0"));
    }

    @Test
    void countsPerSignalOverFixture() throws URISyntaxException
    {
        VcdDocument doc = fixture();
        Map<SignalId, Integer> counts = TransitionStatistics.perSignal(doc);

        assertEquals(4, counts.get(SignalId.of("!")));
        assertEquals(3, counts.get(SignalId.of("\"")));
        assertEquals(2, counts.get(SignalId.of("#")));
        assertEquals(3, counts.get(SignalId.of("$")));
        assertEquals(3, counts.get(SignalId.of("%")));
        assertEquals(2, counts.get(SignalId.of("'")));
        assertEquals(17, TransitionStatistics.total(doc));
    }

    @Test
    void countsColumnChangesInProjectedTable() throws URISyntaxException
    {
        VcdDocument doc = fixture();
        SignalId sclk = SignalId.of("!");
        var table = doc.project(List.of(sclk), TimeGrid.explicit(0, 15, 25, 35, 45, 55));

        assertEquals(List.of("x", "x", "1", "0", "1", "0"), table.series(sclk));
        assertEquals(4, TransitionStatistics.countTransitions(table, sclk));
    }

    @Test
    void summaryReportsChangesAndFinalValue() throws URISyntaxException
    {
        VcdDocument doc = fixture();
        List<SignalSummary> summaries = SignalSummary.of(doc);

        assertEquals(6, summaries.size());
        SignalSummary data = summaries.get(5);
        assertEquals("spi_master_tb.dut.data", data.signal().name());
        assertEquals(3, data.totalChanges());
        assertEquals(2, data.transitions());
        assertEquals("00000101", data.finalValue());
    }

    @Test
    void summaryOfSilentSignalIsUnknown()
    {
        Signal idle = Signal.declare(SignalId.of("~"), "wire", 3, List.of("top"), "idle");
        SignalSummary summary = SignalSummary.of(idle, ChangeLog.empty());

        assertEquals(0, summary.totalChanges());
        assertEquals(0, summary.transitions());
        assertEquals("xxx", summary.finalValue());
    }

    private VcdDocument fixture() throws URISyntaxException
    {
        Path file = Path.of(getClass().getResource("/fixtures/spi_waveform.vcd").toURI());
        return new VcdParser().parse(file).document();
    }
}

package com.questrail.vcd.core;

import com.questrail.vcd.api.SignalId;
import com.questrail.vcd.api.UnboundSignalException;
import com.questrail.vcd.model.ChangeLog;
import com.questrail.vcd.model.Signal;
import com.questrail.vcd.model.Timescale;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultVcdDocumentTest
{
    private static final SignalId CLK = SignalId.of("!");
    private static final SignalId BUS = SignalId.of("'");
    private static final SignalId IDLE = SignalId.of("%");

    private static DefaultVcdDocument document() {
        Signal clk = Signal.declare(CLK, "wire", 1, List.of("tb"), "clk");
        Signal bus = Signal.declare(BUS, "reg", 4, List.of("tb", "dut"), "bus");
        Signal idle = Signal.declare(IDLE, "wire", 2, List.of("tb"), "idle");

        ChangeLog clkLog = ChangeLog.builder()
                .append(0, "0")
                .append(10, "1")
                .append(20, "0")
                .build();
        ChangeLog busLog = ChangeLog.builder()
                .append(5, "1010")
                .append(5, "1100")
                .build();

        return new DefaultVcdDocument(
                new Timescale(10, Timescale.Unit.PS),
                Map.of("version", "test bench"),
                List.of(clk, bus, idle),
                Map.of(CLK, clkLog, BUS, busLog),
                20);
    }

    @Test
    void valueAtReturnsLastChangeAtOrBeforeTime()
    {
        DefaultVcdDocument doc = document();
        assertEquals("0", doc.valueAt(CLK, 0));
        assertEquals("0", doc.valueAt(CLK, 9));
        assertEquals("1", doc.valueAt(CLK, 10));
        assertEquals("1", doc.valueAt(CLK, 19));
        assertEquals("0", doc.valueAt(CLK, Long.MAX_VALUE));
    }

    @Test
    void valueBeforeFirstChangeIsUnknownOfDeclaredWidth()
    {
        DefaultVcdDocument doc = document();
        assertEquals("xxxx", doc.valueAt(BUS, 4));
        assertEquals("xx", doc.valueAt(IDLE, 100));
    }

    @Test
    void sameTimestampChangesResolveToLastRecorded()
    {
        assertEquals("1100", document().valueAt(BUS, 5));
    }

    @Test
    void signalsWithoutChangesHaveEmptyLogs()
    {
        DefaultVcdDocument doc = document();
        assertTrue(doc.changes(IDLE).isEmpty());
        assertEquals(3, doc.changes(CLK).size());
    }

    @Test
    void unknownIdentifierIsRejected()
    {
        DefaultVcdDocument doc = document();
        SignalId missing = SignalId.of("@");

        assertTrue(doc.signal(missing).isEmpty());
        UnboundSignalException e = assertThrows(UnboundSignalException.class, () -> doc.valueAt(missing, 0));
        assertEquals(missing, e.signalId());
        assertThrows(UnboundSignalException.class, () -> doc.changes(missing));
        assertThrows(UnboundSignalException.class, () -> doc.requireSignal(missing));
    }

    @Test
    void exposesHeaderAndDeclarationOrder()
    {
        DefaultVcdDocument doc = document();
        assertEquals(new Timescale(10, Timescale.Unit.PS), doc.timescale());
        assertEquals("test bench", doc.header("version").orElseThrow());
        assertTrue(doc.header("date").isEmpty());
        assertEquals(List.of(CLK, BUS, IDLE), doc.signals().stream().map(Signal::id).toList());
        assertEquals(20, doc.maxTime());
        assertEquals("tb.dut.bus", doc.requireSignal(BUS).name());
    }

    @Test
    void duplicateSignalIdsAreRejected()
    {
        Signal a = Signal.declare(CLK, "wire", 1, List.of(), "a");
        Signal b = Signal.declare(CLK, "wire", 1, List.of(), "b");

        assertThrows(IllegalArgumentException.class, () -> new DefaultVcdDocument(
                Timescale.DEFAULT, Map.of(), List.of(a, b), Map.of(), 0));
    }
}

package com.questrail.vcd.model;

import com.questrail.vcd.api.SignalId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SignalTest
{
    @Test
    void declarationJoinsScopePath()
    {
        Signal nested = Signal.declare(SignalId.of("!"), "wire", 1, List.of("tb", "dut"), "sclk");
        Signal top = Signal.declare(SignalId.of("\""), "reg", 4, List.of(), "data");

        assertEquals("tb.dut.sclk", nested.name());
        assertEquals("sclk", nested.leafName());
        assertEquals(List.of("tb", "dut"), nested.scopePath());
        assertEquals("data", top.name());
    }

    @Test
    void unknownValueMatchesWidth()
    {
        Signal bus = Signal.declare(SignalId.of("\""), "reg", 4, List.of(), "data");
        Signal bit = Signal.declare(SignalId.of("!"), "wire", 1, List.of(), "clk");

        assertEquals("xxxx", bus.unknownValue());
        assertFalse(bus.isScalar());
        assertEquals("x", bit.unknownValue());
        assertTrue(bit.isScalar());
    }

    @Test
    void rejectsNonPositiveWidth()
    {
        assertThrows(IllegalArgumentException.class,
                () -> Signal.declare(SignalId.of("#"), "wire", 0, List.of(), "bad"));
    }
}

package com.questrail.vcd.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TimescaleTest
{
    @Test
    void parsesCompactAndSpacedForms()
    {
        assertEquals(new Timescale(1, Timescale.Unit.NS), Timescale.parse("1ns").orElseThrow());
        assertEquals(new Timescale(10, Timescale.Unit.PS), Timescale.parse(" 10 ps ").orElseThrow());
        assertEquals(new Timescale(100, Timescale.Unit.US), Timescale.parse("100US").orElseThrow());
    }

    @Test
    void rejectsIllegalMagnitudesAndUnits()
    {
        assertTrue(Timescale.parse("3ns").isEmpty());
        assertTrue(Timescale.parse("1 minutes").isEmpty());
        assertTrue(Timescale.parse("").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new Timescale(5, Timescale.Unit.NS));
    }

    @Test
    void convertsTicksToSeconds()
    {
        Timescale ts = new Timescale(10, Timescale.Unit.NS);
        assertEquals(1.5e-6, ts.toSeconds(150), 1e-15);
        assertEquals("10ns", ts.toString());
    }
}

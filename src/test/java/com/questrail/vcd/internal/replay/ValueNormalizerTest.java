package com.questrail.vcd.internal.replay;

import com.questrail.vcd.config.VectorExtension;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ValueNormalizerTest
{
    private final ValueNormalizer zero = new ValueNormalizer(VectorExtension.ZERO);
    private final ValueNormalizer ieee = new ValueNormalizer(VectorExtension.IEEE);

    @Test
    void exactWidthPassesThrough()
    {
        assertEquals("1010", zero.normalize("1010", 4).orElseThrow());
        assertEquals("1", zero.normalize("1", 1).orElseThrow());
    }

    @Test
    void shortValuesAreZeroExtended()
    {
        assertEquals("0001", zero.normalize("1", 4).orElseThrow());
        assertEquals("00000101", zero.normalize("101", 8).orElseThrow());
        assertEquals("000x", zero.normalize("x", 4).orElseThrow());
    }

    @Test
    void ieeePolicyCopiesLeadingUnknownOrHighImpedance()
    {
        assertEquals("xxxx", ieee.normalize("x", 4).orElseThrow());
        assertEquals("zzz1", ieee.normalize("z1", 4).orElseThrow());
        assertEquals("0011", ieee.normalize("11", 4).orElseThrow());
    }

    @Test
    void longValuesKeepLeastSignificantDigits()
    {
        assertEquals("0101", zero.normalize("110101", 4).orElseThrow());
    }

    @Test
    void upperCaseDigitsAreLowerCased()
    {
        assertEquals("xz10", zero.normalize("XZ10", 4).orElseThrow());
    }

    @Test
    void illegalDigitsAreRejected()
    {
        assertTrue(zero.normalize("10a1", 4).isEmpty());
        assertTrue(zero.normalize("", 4).isEmpty());
        assertTrue(zero.normalize("1.5", 1).isEmpty());
    }
}

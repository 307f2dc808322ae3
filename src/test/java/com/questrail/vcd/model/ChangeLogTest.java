package com.questrail.vcd.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ChangeLog}.
 */
final class ChangeLogTest
{
    @Test
    void emptyLogHasNoValueAtAnyTime()
    {
        ChangeLog log = ChangeLog.builder().build();

        assertTrue(log.isEmpty());
        assertSame(ChangeLog.empty(), log);
        assertEquals(Optional.empty(), log.valueAt(0));
        assertEquals(Optional.empty(), log.valueAt(Long.MAX_VALUE));
    }

    @Test
    void valueAtReturnsLatestChangeAtOrBefore()
    {
        ChangeLog log = ChangeLog.builder()
                .append(5, "0")
                .append(10, "1")
                .append(20, "0")
                .build();

        assertEquals(Optional.empty(), log.valueAt(4));
        assertEquals("0", log.valueAt(5).orElseThrow());
        assertEquals("0", log.valueAt(9).orElseThrow());
        assertEquals("1", log.valueAt(10).orElseThrow());
        assertEquals("1", log.valueAt(19).orElseThrow());
        assertEquals("0", log.valueAt(20).orElseThrow());
        assertEquals("0", log.valueAt(1_000_000).orElseThrow());
    }

    @Test
    void simultaneousChangesResolveToLastAppended()
    {
        ChangeLog log = ChangeLog.builder()
                .append(0, "x")
                .append(10, "1")
                .append(10, "0")
                .append(10, "z")
                .build();

        assertEquals("z", log.valueAt(10).orElseThrow());
        assertEquals("x", log.valueAt(9).orElseThrow());
        assertEquals(4, log.size());
    }

    @Test
    void repeatedIdenticalValuesAreKept()
    {
        ChangeLog log = ChangeLog.builder()
                .append(0, "1")
                .append(5, "1")
                .append(7, "1")
                .build();

        assertEquals(3, log.size());
        assertEquals(new ChangeEvent(5, "1"), log.get(1));
        assertEquals(new ChangeEvent(7, "1"), log.last().orElseThrow());
    }

    @Test
    void builderRejectsTimeGoingBackwards()
    {
        ChangeLog.Builder builder = ChangeLog.builder().append(10, "1");

        assertThrows(IllegalArgumentException.class, () -> builder.append(9, "0"));
        assertThrows(IllegalArgumentException.class, () -> builder.append(-1, "0"));
    }

    @Test
    void builderGrowsPastInitialCapacity()
    {
        ChangeLog.Builder builder = ChangeLog.builder();
        for (int i = 0; i < 100; i++) {
            builder.append(i * 2L, (i % 2 == 0) ? "0" : "1");
        }
        ChangeLog log = builder.build();

        assertEquals(100, log.size());
        assertEquals("1", log.valueAt(3).orElseThrow());
        assertEquals("1", log.valueAt(198).orElseThrow());
        assertEquals("0", log.valueAt(197).orElseThrow());
        assertEquals(198, log.last().orElseThrow().time());
    }

    @Test
    void equalityIsByContent()
    {
        ChangeLog a = ChangeLog.builder().append(1, "0").append(2, "1").build();
        ChangeLog b = ChangeLog.builder().append(1, "0").append(2, "1").build();
        ChangeLog c = ChangeLog.builder().append(1, "0").append(3, "1").build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void eventsViewMirrorsEntries()
    {
        ChangeLog log = ChangeLog.builder().append(1, "0").append(2, "1").build();

        assertEquals(2, log.events().size());
        assertEquals(new ChangeEvent(1, "0"), log.events().get(0));
        assertThrows(UnsupportedOperationException.class, () -> log.events().add(new ChangeEvent(3, "0")));
    }
}

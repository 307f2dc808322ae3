package com.questrail.vcd.core;

import com.questrail.vcd.api.SignalId;
import com.questrail.vcd.api.Table;
import com.questrail.vcd.api.TimeGrid;
import com.questrail.vcd.api.UnboundSignalException;
import com.questrail.vcd.api.VcdDocument;
import com.questrail.vcd.parse.VcdParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TabularProjectorTest
{
    private static final SignalId SCLK = SignalId.of("!");
    private static final SignalId MOSI = SignalId.of("\"");
    private static final SignalId DATA = SignalId.of("'");

    private static final String DUMP = """
            $timescale 1ns $end
            $scope module tb $end
            $var wire 1 ! sclk $end
            $var wire 1 " mosi $end
            $var reg 4 ' data $end
            $upscope $end
            $enddefinitions $end
            #0
            0!
            #10
            1!
            1"
            #20
            0!
            #30
            b11 '
            1!
            """;

    private final VcdDocument doc = new VcdParser().parse(DUMP).document();
    private final TabularProjector projector = new TabularProjector();

    @Test
    void unionGridCoversEveryChangeOfRequestedSignals()
    {
        Table table = projector.project(doc, List.of(MOSI, DATA), TimeGrid.allChangeTimes());

        assertEquals(List.of(10L, 30L), table.times());
        assertEquals(List.of("1", "xxxx"), table.rows().get(0).values());
        assertEquals(List.of("1", "0011"), table.rows().get(1).values());
    }

    @Test
    void everyRowHasOneValuePerColumn()
    {
        Table table = doc.project(List.of(SCLK, MOSI, DATA), TimeGrid.allChangeTimes());

        assertEquals(List.of(0L, 10L, 20L, 30L), table.times());
        for (Table.Row row : table.rows()) {
            assertEquals(3, row.values().size());
        }
        assertEquals(List.of("0", "1", "0", "1"), table.series(SCLK));
        assertEquals(List.of("x", "1", "1", "1"), table.series(MOSI));
    }

    @Test
    void explicitGridIsSortedAndDeduplicated()
    {
        Table table = projector.project(doc, List.of(SCLK), TimeGrid.explicit(25, 5, 25, 0, 1_000));

        assertEquals(List.of(0L, 5L, 25L, 1_000L), table.times());
        assertEquals(List.of("0", "0", "0", "1"), table.series(SCLK));
    }

    @Test
    void cellsMatchPointQueries()
    {
        Table table = projector.project(doc, List.of(SCLK, DATA), TimeGrid.explicit(List.of(3L, 17L, 31L)));
        for (Table.Row row : table.rows()) {
            assertEquals(doc.valueAt(SCLK, row.time()), row.value(0));
            assertEquals(doc.valueAt(DATA, row.time()), row.value(1));
        }
    }

    @Test
    void unknownSignalFailsWholeProjection()
    {
        assertThrows(UnboundSignalException.class,
                () -> projector.project(doc, List.of(SCLK, SignalId.of("@")), TimeGrid.allChangeTimes()));
    }

    @Test
    void noSignalsYieldsEmptyTable()
    {
        Table table = projector.project(doc, List.of(), TimeGrid.allChangeTimes());
        assertTrue(table.isEmpty());
        assertTrue(table.columns().isEmpty());

        Table sampled = projector.project(doc, List.of(), TimeGrid.explicit(1, 2));
        assertEquals(2, sampled.rowCount());
        assertTrue(sampled.rows().get(0).values().isEmpty());
    }

    @Test
    void tableRejectsIllShapedRows()
    {
        assertThrows(IllegalArgumentException.class, () -> new Table(List.of(SCLK),
                List.of(new Table.Row(0, List.of("0", "1")))));
        assertThrows(IllegalArgumentException.class, () -> new Table(List.of(SCLK),
                List.of(new Table.Row(5, List.of("0")), new Table.Row(5, List.of("1")))));
        assertThrows(IllegalArgumentException.class,
                () -> doc.project(List.of(SCLK), TimeGrid.allChangeTimes()).series(MOSI));
    }
}

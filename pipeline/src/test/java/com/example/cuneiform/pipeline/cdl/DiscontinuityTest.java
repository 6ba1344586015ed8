package com.example.cuneiform.pipeline.cdl;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DiscontinuityTest {

    @Test
    void typeTakesPrecedenceOverState() {
        assertEquals(Optional.of("\n"), new Discontinuity(DiscontinuityType.LINE_START, "missing", "").toText());
        assertEquals(Optional.empty(), new Discontinuity(DiscontinuityType.OBJECT, "missing", "").toText());
        assertEquals(Optional.of("#SURFACE#"), new Discontinuity(DiscontinuityType.SURFACE, "", "").toText());
        assertEquals(Optional.of("\n#COLUMN#\n"), new Discontinuity(DiscontinuityType.COLUMN, "", "").toText());
    }

    @Test
    void stateRendersOnItsOwnLine() {
        assertEquals(Optional.of("\n#MISSING#\n"), new Discontinuity(DiscontinuityType.NONX, "missing", "").toText());
        assertEquals(Optional.of("\n#MISSING#\n"), new Discontinuity(DiscontinuityType.NONX, "blank", "line").toText());
        assertEquals(Optional.of("\n#BLANK_SPACE#\n"),
                new Discontinuity(DiscontinuityType.NONX, "blank", "space").toText());
        assertEquals(Optional.of("\n#RULING#\n"), new Discontinuity(DiscontinuityType.NONX, "ruling", "").toText());
    }

    @Test
    void meaninglessCombinationsYieldNothing() {
        assertEquals(Optional.empty(), new Discontinuity(DiscontinuityType.NONX, "blank", "").toText());
        assertEquals(Optional.empty(), new Discontinuity(DiscontinuityType.NONX, "", "").toText());
        assertEquals(Optional.empty(), new Discontinuity(DiscontinuityType.CELL_START, null, null).toText());
    }
}

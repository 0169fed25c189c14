package com.hostledger.rentals.reconcile;

import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class OccupancyDiffTest {

    @Test
    void identicalOccupancyIsEmpty() {
        OccupancyDiff diff = OccupancyDiff.compute(codes("D D x x"), codes("D D x x"));
        assertTrue(diff.isEmpty());
    }

    @Test
    void detectsFreedAndClaimedSlots() {
        OccupancyDiff diff = OccupancyDiff.compute(codes("D D x x"), codes("D x I x"));
        assertEquals(Collections.singletonList(1), diff.ended);
        assertEquals(Collections.singletonList(2), diff.started);
    }

    @Test
    void codeChangeIsReportedAsReassignment() {
        OccupancyDiff diff = OccupancyDiff.compute(codes("D I x x"), codes("R I x x"));
        assertEquals(Collections.singletonList(0), diff.ended);
        assertEquals(Collections.singletonList(0), diff.started);
    }

    @Test
    void slotsMissingFromEitherSideAreNotReported() {
        OccupancyDiff grow = OccupancyDiff.compute(codes("D D"), codes("D D I I"));
        assertTrue(grow.isEmpty());

        OccupancyDiff shrink = OccupancyDiff.compute(codes("D D I I"), codes("x D"));
        assertEquals(Collections.singletonList(0), shrink.ended);
        assertTrue(shrink.started.isEmpty());

        assertTrue(OccupancyDiff.compute(codes("D D I I"), new String[0]).isEmpty());
    }

    private static String[] codes(String occupancy) {
        return occupancy.split(" ");
    }
}

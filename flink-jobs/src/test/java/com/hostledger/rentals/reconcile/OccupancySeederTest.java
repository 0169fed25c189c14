package com.hostledger.rentals.reconcile;

import org.junit.jupiter.api.Test;

import com.hostledger.rentals.model.RentalCategory;
import com.hostledger.rentals.model.RentalSession;
import com.hostledger.rentals.model.SessionStatus;
import com.hostledger.rentals.registry.RentalRegistry;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.hostledger.rentals.reconcile.Snapshots.T0;
import static com.hostledger.rentals.reconcile.Snapshots.snapshot;
import static com.hostledger.rentals.reconcile.Snapshots.withCounters;
import static org.junit.jupiter.api.Assertions.*;

class OccupancySeederTest {

    @Test
    void splitFavorsFirstSession() {
        List<List<Integer>> chunks = OccupancySeeder.split(Arrays.asList(0, 1, 2, 3), 2);
        assertEquals(Arrays.asList(Arrays.asList(0, 1, 2), Collections.singletonList(3)), chunks);
    }

    @Test
    void splitAlwaysYieldsAtLeastOneSession() {
        assertEquals(1, OccupancySeeder.split(Arrays.asList(4, 5), 0).size());
        assertEquals(2, OccupancySeeder.split(Arrays.asList(4, 5), 7).size());
        assertTrue(OccupancySeeder.split(Collections.emptyList(), 3).isEmpty());
    }

    @Test
    void groupsByCategoryAndSplitsByRunningCounters() {
        RentalRegistry registry = OccupancySeeder.seed(
                withCounters(snapshot("D D D D", T0, 100.0), 2, 2, 2, 2));

        assertEquals(2, registry.sessions.size());
        RentalSession first = registry.sessions.get("m42-0001");
        RentalSession second = registry.sessions.get("m42-0002");
        assertEquals(Arrays.asList(0, 1, 2), first.gpus);
        assertEquals(Collections.singletonList(3), second.gpus);
        assertEquals(SessionStatus.RUNNING, first.status);
        assertEquals(T0, first.startTs);
        assertEquals(0.50, first.gpuContractedRate, 1e-12);
        assertEquals("m42-0002", registry.slotToSession.get(3));
    }

    @Test
    void mixedCategoriesSeedSeparateSessions() {
        RentalRegistry registry = OccupancySeeder.seed(
                withCounters(snapshot("D I I x", T0, 100.0), 2, 1, 2, 1));

        assertEquals(2, registry.sessions.size());
        RentalSession onDemand = registry.sessions.get("m42-0001");
        RentalSession interruptible = registry.sessions.get("m42-0002");
        assertEquals(RentalCategory.ON_DEMAND, onDemand.category);
        assertEquals(Collections.singletonList(0), onDemand.gpus);
        assertEquals(RentalCategory.INTERRUPTIBLE, interruptible.category);
        assertEquals(Arrays.asList(1, 2), interruptible.gpus);
        assertEquals(0.30, interruptible.openGpuSegment().rate, 1e-12);
    }

    @Test
    void occupiedSlotsWithoutRunningCountersStillSeedOneSession() {
        RentalRegistry registry = OccupancySeeder.seed(
                withCounters(snapshot("R R x x", T0, 0.0), 0, 0, 0, 0));

        assertEquals(1, registry.sessions.size());
        assertEquals(Arrays.asList(0, 1), registry.sessions.get("m42-0001").gpus);
    }

    @Test
    void idleMachineSeedsEmptyRegistryWithBaseline() {
        RentalRegistry registry = OccupancySeeder.seed(
                withCounters(snapshot("x x x x", T0, 12.0), 0, 0, 0, 0));

        assertTrue(registry.sessions.isEmpty());
        assertEquals(12.0, registry.allocDiskSpace, 1e-12);
        assertEquals(T0, registry.lastObservedAt);
    }
}

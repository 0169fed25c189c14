package com.hostledger.rentals.reconcile;

import org.junit.jupiter.api.Test;

import com.hostledger.rentals.model.MachineState;
import com.hostledger.rentals.model.RentalCategory;
import com.hostledger.rentals.registry.RentalRegistry;

import static com.hostledger.rentals.reconcile.Snapshots.T0;
import static com.hostledger.rentals.reconcile.Snapshots.snapshot;
import static com.hostledger.rentals.reconcile.Snapshots.withCounters;
import static org.junit.jupiter.api.Assertions.*;

class PauseBudgetTest {

    @Test
    void storedCountsPerClass() {
        assertEquals(1, PauseBudget.storedOnDemand(2, 1));
        assertEquals(0, PauseBudget.storedOnDemand(1, 3));
        // resident 5 (2 on-demand), running 2 (1 on-demand): 3 other resident, 1 other running
        assertEquals(2, PauseBudget.storedOther(5, 2, 2, 1));
        assertEquals(0, PauseBudget.storedOther(1, 1, 1, 1));
    }

    @Test
    void budgetIsGrowthOfStoredCountPerClass() {
        RentalRegistry previous = new RentalRegistry(42L);
        previous.recordObservation(withCounters(snapshot("D I I x", T0, 50.0), 3, 1, 3, 1));
        MachineState current = withCounters(snapshot("x x x x", T0 + 1, 50.0), 3, 1, 1, 0);

        PauseBudget budget = PauseBudget.estimate(previous, current);

        assertEquals(1, budget.onDemand());
        assertEquals(1, budget.other());
    }

    @Test
    void shrinkingStoredCountNeverGoesNegative() {
        RentalRegistry previous = new RentalRegistry(42L);
        previous.recordObservation(withCounters(snapshot("x x x x", T0, 50.0), 2, 1, 0, 0));
        MachineState current = withCounters(snapshot("D I x x", T0 + 1, 50.0), 2, 1, 2, 1);

        PauseBudget budget = PauseBudget.estimate(previous, current);

        assertEquals(0, budget.onDemand());
        assertEquals(0, budget.other());
    }

    @Test
    void tryConsumeDrawsFromMatchingClass() {
        PauseBudget budget = new PauseBudget(1, 1);

        assertTrue(budget.tryConsume(RentalCategory.ON_DEMAND));
        assertFalse(budget.tryConsume(RentalCategory.ON_DEMAND));
        assertEquals(0, budget.onDemand());
        assertEquals(1, budget.other());
        assertTrue(budget.tryConsume(RentalCategory.INTERRUPTIBLE));
        assertFalse(budget.tryConsume(RentalCategory.RESERVED));
    }

    @Test
    void unknownCategoryUsesOtherClass() {
        PauseBudget budget = new PauseBudget(1, 0);
        assertFalse(budget.tryConsume(null));
        assertEquals(1, budget.onDemand());
    }
}

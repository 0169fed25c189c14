package com.hostledger.rentals.reconcile;

import com.hostledger.rentals.ledger.SegmentLedger;
import com.hostledger.rentals.model.MachineState;
import com.hostledger.rentals.model.RentalCategory;
import com.hostledger.rentals.model.RentalSession;
import com.hostledger.rentals.model.SessionStatus;
import com.hostledger.rentals.registry.RentalRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Adopts rentals that are already in progress when a machine is first observed.
 *
 * <p>Occupied slots are grouped by (category, rate) and each group is split into as many sessions
 * as the running counters of its demand class allow (at least one). Split sizes favor the first
 * session: 4 slots over 2 sessions become [3, 1].</p>
 */
final class OccupancySeeder {
    private static final Logger LOG = LoggerFactory.getLogger(OccupancySeeder.class);

    private OccupancySeeder() {}

    static RentalRegistry seed(MachineState state) {
        RentalRegistry registry = new RentalRegistry(state.machineId);
        long now = state.observedAt;
        String[] codes = state.slotCodes();

        Map<String, List<Integer>> groups = new TreeMap<>();
        Map<String, RentalCategory> groupCategory = new TreeMap<>();
        Map<String, Double> groupRate = new TreeMap<>();
        for (int slot = 0; slot < codes.length; slot++) {
            RentalCategory category = RentalCategory.fromCode(codes[slot]);
            if (category == null) {
                continue;
            }
            double rate = category.marketRate(state);
            String key = groupKey(category, rate);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(slot);
            groupCategory.put(key, category);
            groupRate.put(key, rate);
        }

        int remainingOnDemand = Math.max(state.currentRentalsRunningOnDemand, 0);
        int remainingOther = Math.max(state.currentRentalsRunning - state.currentRentalsRunningOnDemand, 0);

        for (Map.Entry<String, List<Integer>> entry : groups.entrySet()) {
            RentalCategory category = groupCategory.get(entry.getKey());
            double rate = groupRate.get(entry.getKey());
            List<Integer> slots = entry.getValue();

            int desired;
            if (category.isOnDemand()) {
                desired = Math.min(slots.size(), remainingOnDemand);
                remainingOnDemand -= desired;
            } else {
                desired = Math.min(slots.size(), remainingOther);
                remainingOther -= desired;
            }

            for (List<Integer> chunk : split(slots, desired)) {
                RentalSession session = new RentalSession();
                session.sessionId = registry.allocateSessionId();
                session.status = SessionStatus.RUNNING;
                session.gpus = chunk;
                session.category = category;
                session.gpuContractedRate = rate;
                session.storageContractedRate = state.listedStorageCost;
                session.startTs = now;
                session.lastStateChangeTs = now;
                SegmentLedger.openGpuSegment(session, rate, chunk.size(), now);
                SegmentLedger.openStorageSegment(session, state.listedStorageCost, now);

                registry.sessions.put(session.sessionId, session);
                registry.assignSlots(chunk, session.sessionId);
                LOG.info("Detected ongoing rental at startup: machine {}, session {}, type {}, rate {}, gpus {}",
                        state.machineId, session.sessionId, category, rate, chunk);
            }
        }

        registry.recordObservation(state);
        return registry;
    }

    static List<List<Integer>> split(List<Integer> slots, int sessionCount) {
        List<List<Integer>> chunks = new ArrayList<>();
        if (slots.isEmpty()) {
            return chunks;
        }
        int count = Math.max(1, Math.min(sessionCount, slots.size()));
        int remaining = slots.size();
        int cursor = 0;
        for (int i = 0; i < count; i++) {
            int sessionsLeft = count - i;
            int take = Math.max(1, remaining - (sessionsLeft - 1));
            chunks.add(new ArrayList<>(slots.subList(cursor, cursor + take)));
            cursor += take;
            remaining -= take;
        }
        return chunks;
    }

    private static String groupKey(RentalCategory category, double rate) {
        // Sorts by occupancy code, then rate.
        return category.code() + "|" + String.format(Locale.ROOT, "%020.6f", rate);
    }
}

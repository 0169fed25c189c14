package com.hostledger.rentals.reconcile;

import com.hostledger.rentals.ledger.EarningsTotals;
import com.hostledger.rentals.ledger.SegmentLedger;
import com.hostledger.rentals.model.GpuSegment;
import com.hostledger.rentals.model.LifecycleEventType;
import com.hostledger.rentals.model.MachineState;
import com.hostledger.rentals.model.MachineSummary;
import com.hostledger.rentals.model.RentalCategory;
import com.hostledger.rentals.model.RentalLifecycleEvent;
import com.hostledger.rentals.model.RentalSession;
import com.hostledger.rentals.model.SessionStatus;
import com.hostledger.rentals.registry.RentalRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Infers rental lifecycle transitions for one machine from two successive observations.
 *
 * <p>One pass runs in three phases against a single snapshot pair:
 * (a) freed slots: partial release, pause or end per owning session;
 * (b) claimed slots: continuity, resume or new session per (category, rate) group;
 * (c) a residual disk drop not explained by (a) ends the closest-sized stored session.
 * </p>
 *
 * <p>The pass mutates a copy of the prior registry; the caller persists
 * {@link ReconcileResult#registry} only after the pass returned, so an exception never leaves a
 * half-applied registry behind.</p>
 */
public final class RentalReconciler {
    private static final Logger LOG = LoggerFactory.getLogger(RentalReconciler.class);

    private RentalReconciler() {}

    public static ReconcileResult reconcile(RentalRegistry prior, MachineState state, ReconcileSettings settings) {
        RentalRegistry registry = prior.copy();
        registry.machineId = state.machineId;
        ReconcileResult result = new ReconcileResult(registry);
        new Pass(registry, state, settings, result).run();
        return result;
    }

    /**
     * Builds the baseline registry for a machine seen for the first time, adopting rentals that
     * are already in progress.
     */
    public static ReconcileResult seed(MachineState state, ReconcileSettings settings) {
        RentalRegistry registry = OccupancySeeder.seed(state);
        ReconcileResult result = new ReconcileResult(registry);
        result.events.addAll(MachineAlertTracker.evaluate(registry, state, settings.alertPingIntervalMs));
        attachSummary(result, state);
        return result;
    }

    private static void attachSummary(ReconcileResult result, MachineState state) {
        if (result.events.isEmpty()) {
            return;
        }
        MachineSummary summary = MachineSummaries.summarize(result.registry, state);
        for (RentalLifecycleEvent event : result.events) {
            event.machine = summary;
        }
    }

    private static final class ClaimGroup {
        final RentalCategory category;
        final double rate;
        final List<Integer> slots = new ArrayList<>();

        ClaimGroup(RentalCategory category, double rate) {
            this.category = category;
            this.rate = rate;
        }
    }

    /**
     * Working context of one pass.
     */
    private static final class Pass {
        private final RentalRegistry registry;
        private final MachineState state;
        private final ReconcileSettings settings;
        private final ReconcileResult result;
        private final long now;
        private final String[] newCodes;
        private final double diskDelta;
        private final PauseBudget budget;

        private double endedStorageGb;
        private double unattributedDiskGain;

        Pass(RentalRegistry registry, MachineState state, ReconcileSettings settings, ReconcileResult result) {
            this.registry = registry;
            this.state = state;
            this.settings = settings;
            this.result = result;
            this.now = state.observedAt;
            this.newCodes = state.reportedCodes();
            this.diskDelta = state.allocDiskSpace - registry.allocDiskSpace;
            this.budget = PauseBudget.estimate(registry, state);
            this.unattributedDiskGain = Math.max(diskDelta, 0.0);
        }

        void run() {
            String[] oldCodes = registry.previousSlotCodes(state.numGpus);
            OccupancyDiff diff = OccupancyDiff.compute(oldCodes, newCodes);
            if (!diff.isEmpty() || Math.abs(diskDelta) >= settings.diskToleranceGb) {
                LOG.debug("Reconciling machine {} (ended={}, started={}, diskDelta={}, budget={})",
                        state.machineId, diff.ended, diff.started, diskDelta, budget);
            }

            releaseFreedSlots(diff.ended);
            claimSlots(diff.started);
            terminateByDiskDrop();
            applyStoragePriceDrops();

            registry.recordObservation(state);
            if (newCodes.length < oldCodes.length) {
                // Slots the snapshot did not report keep their last known code.
                registry.gpuOccupancy = String.join(" ", mergeCodes(oldCodes, newCodes));
            }
            result.events.addAll(MachineAlertTracker.evaluate(registry, state, settings.alertPingIntervalMs));
            attachSummary(result, state);
        }

        private String[] mergeCodes(String[] oldCodes, String[] reported) {
            String[] merged = Arrays.copyOf(oldCodes, oldCodes.length);
            System.arraycopy(reported, 0, merged, 0, reported.length);
            return merged;
        }

        // (a) ------------------------------------------------------------------

        private void releaseFreedSlots(List<Integer> endedSlots) {
            Map<String, List<Integer>> freedBySession = new LinkedHashMap<>();
            for (Integer slot : endedSlots) {
                String sessionId = registry.slotToSession.remove(slot);
                if (sessionId == null) {
                    LOG.debug("Slot {} freed on machine {} without a tracked session", slot, state.machineId);
                    continue;
                }
                freedBySession.computeIfAbsent(sessionId, k -> new ArrayList<>()).add(slot);
            }

            for (Map.Entry<String, List<Integer>> entry : freedBySession.entrySet()) {
                RentalSession session = registry.sessions.get(entry.getKey());
                if (session == null) {
                    LOG.warn("Slots {} on machine {} mapped to unknown session {}",
                            entry.getValue(), state.machineId, entry.getKey());
                    continue;
                }
                List<Integer> remaining = new ArrayList<>(session.gpus);
                remaining.removeAll(entry.getValue());
                if (!remaining.isEmpty()) {
                    partialRelease(session, entry.getValue(), remaining);
                } else {
                    fullRelease(session);
                }
            }
        }

        private void partialRelease(RentalSession session, List<Integer> freed, List<Integer> remaining) {
            List<Integer> previous = session.gpus;
            GpuSegment open = session.openGpuSegment();
            double fallbackRate = open != null ? open.rate : session.gpuContractedRate;
            RentalCategory category = categoryAt(remaining.get(0));
            double marketRate = category != null ? category.marketRate(state) : fallbackRate;

            session.gpus = remaining;
            SegmentLedger.openGpuSegment(session, session.cappedGpuRate(marketRate), remaining.size(), now);
            LOG.debug("GPUs {} released: machine {}, session {}, remaining {} (was {})",
                    freed, state.machineId, session.sessionId, remaining, previous);
        }

        private void fullRelease(RentalSession session) {
            double tolerance = settings.diskToleranceGb;
            boolean diskUnchanged = Math.abs(diskDelta) < tolerance;
            boolean diskFreedMatches = Math.abs(diskDelta + session.storageGb) < tolerance;

            if (diskUnchanged && budget.tryConsume(session.category)) {
                pause(session);
                return;
            }
            if (!diskFreedMatches) {
                result.ambiguousEnds++;
                LOG.warn("Ambiguous disk change {} GB for session {} on machine {} (held {} GB); treating as ended.",
                        diskDelta, session.sessionId, state.machineId, session.storageGb);
            }
            end(session, "Rental ended");
        }

        private void pause(RentalSession session) {
            SegmentLedger.closeGpuSegment(session, now);
            session.status = SessionStatus.STORED;
            session.lastStateChangeTs = now;
            LOG.info("Session paused: machine {}, session {}, GPUs released {}",
                    state.machineId, session.sessionId, session.gpus);
            emit(LifecycleEventType.PAUSE, session, null, session.gpus, "Session paused");
        }

        private void end(RentalSession session, String message) {
            EarningsTotals totals = SegmentLedger.finalizeSession(session, now);
            registry.sessions.remove(session.sessionId);
            registry.releaseSlotsOf(session.sessionId);
            endedStorageGb += session.storageGb;
            result.archived.add(session.copy());
            LOG.info("{}: machine {}, session {}, duration {} ms, earned {}",
                    message, state.machineId, session.sessionId, totals.durationMs, totals.total());
            emit(LifecycleEventType.END, session, null, session.gpus, message);
        }

        // (b) ------------------------------------------------------------------

        private void claimSlots(List<Integer> startedSlots) {
            Map<String, ClaimGroup> groups = new LinkedHashMap<>();
            for (Integer slot : startedSlots) {
                RentalCategory category = categoryAt(slot);
                if (category == null) {
                    LOG.warn("Slot {} on machine {} claimed with unrecognized code '{}'",
                            slot, state.machineId, codeAt(slot));
                    continue;
                }
                double rate = category.marketRate(state);
                String key = category.name() + "|" + rate;
                groups.computeIfAbsent(key, k -> new ClaimGroup(category, rate)).slots.add(slot);
            }

            for (ClaimGroup group : groups.values()) {
                ClaimMatcher.Match match = ClaimMatcher.match(
                        registry.sessions.values(), group.slots, diskDelta, settings.diskToleranceGb);
                switch (match.kind) {
                    case CONTINUITY:
                        registry.assignSlots(group.slots, match.session.sessionId);
                        LOG.debug("Continuity detected: machine {}, session {}, gpus {}",
                                state.machineId, match.session.sessionId, group.slots);
                        break;
                    case RESUME_EXACT:
                    case RESUME_DISK_CONTINUITY:
                        resume(match.session, group, match.kind);
                        break;
                    case NEW_SESSION:
                    default:
                        start(group);
                        break;
                }
            }
        }

        private void resume(RentalSession session, ClaimGroup group, ClaimMatcher.MatchKind kind) {
            double rate = session.cappedGpuRate(group.rate);
            session.gpus = new ArrayList<>(group.slots);
            session.category = group.category;
            SegmentLedger.openGpuSegment(session, rate, group.slots.size(), now);
            registry.assignSlots(group.slots, session.sessionId);
            String how = kind == ClaimMatcher.MatchKind.RESUME_EXACT ? "Session resumed" : "Session resumed (disk-continuity)";
            LOG.info("{}: machine {}, session {}, gpus {}", how, state.machineId, session.sessionId, group.slots);
            emit(LifecycleEventType.RESUME, session, rate, group.slots, how);
        }

        private void start(ClaimGroup group) {
            RentalSession session = new RentalSession();
            session.sessionId = registry.allocateSessionId();
            session.status = SessionStatus.RUNNING;
            session.gpus = new ArrayList<>(group.slots);
            session.category = group.category;
            session.gpuContractedRate = group.rate;
            session.storageContractedRate = state.listedStorageCost;
            session.startTs = now;
            session.lastStateChangeTs = now;
            sizeStorage(session);

            SegmentLedger.openStorageSegment(
                    session, Math.min(state.listedStorageCost, session.storageContractedRate), now);
            double rate = session.cappedGpuRate(group.rate);
            SegmentLedger.openGpuSegment(session, rate, group.slots.size(), now);

            registry.sessions.put(session.sessionId, session);
            registry.assignSlots(group.slots, session.sessionId);
            LOG.info("New rental: machine {}, session {}, type {}, rate {}, gpus {}, storage {} GB",
                    state.machineId, session.sessionId, group.category, rate, group.slots, session.storageGb);
            emit(LifecycleEventType.START, session, rate, group.slots, "New rental");
        }

        /**
         * Storage comes from an unclaimed client hint when exactly one is available, otherwise
         * from the disk growth of this cycle (attributed to one new session only).
         */
        private void sizeStorage(RentalSession session) {
            MachineState.ClientHint hint = soleUnclaimedHint();
            if (hint != null) {
                session.storageGb = hint.storageGb;
                session.clientRef = hint.clientId;
                session.clientEndTs = hint.clientEndTs;
                unattributedDiskGain = Math.max(unattributedDiskGain - hint.storageGb, 0.0);
                return;
            }
            session.storageGb = unattributedDiskGain;
            unattributedDiskGain = 0.0;
        }

        private MachineState.ClientHint soleUnclaimedHint() {
            if (state.clients == null || state.clients.isEmpty()) {
                return null;
            }
            Set<String> claimed = new HashSet<>();
            for (RentalSession session : registry.sessions.values()) {
                if (session.clientRef != null) {
                    claimed.add(session.clientRef);
                }
            }
            MachineState.ClientHint found = null;
            for (MachineState.ClientHint hint : state.clients) {
                if (hint == null || hint.clientId == null || hint.storageGb == null || hint.storageGb <= 0.0) {
                    continue;
                }
                if (claimed.contains(hint.clientId)) {
                    continue;
                }
                if (found != null) {
                    return null;
                }
                found = hint;
            }
            return found;
        }

        // (c) ------------------------------------------------------------------

        private void terminateByDiskDrop() {
            if (diskDelta >= -settings.diskDropNoiseGb) {
                return;
            }
            double residualDrop = -diskDelta - endedStorageGb;
            if (residualDrop <= settings.diskDropNoiseGb) {
                return;
            }
            List<RentalSession> stored = registry.sessionsWithStatus(SessionStatus.STORED);
            if (stored.isEmpty()) {
                return;
            }
            RentalSession best = null;
            double bestDiff = Double.MAX_VALUE;
            for (RentalSession session : stored) {
                double diff = Math.abs(session.storageGb - residualDrop);
                if (diff < bestDiff) {
                    best = session;
                    bestDiff = diff;
                }
            }
            if (best != null && bestDiff <= settings.diskToleranceGb) {
                end(best, "Rental ended (disk-only)");
            } else {
                LOG.warn("Disk-only drop {} GB on machine {} did not match a stored session within tolerance.",
                        residualDrop, state.machineId);
            }
        }

        private void applyStoragePriceDrops() {
            if (state.listedStorageCost <= 0.0) {
                return;
            }
            for (RentalSession session : registry.sessions.values()) {
                if (session.openStorageSegment() == null) {
                    continue;
                }
                double ceiling = session.storageContractedRate > 0.0 ? session.storageContractedRate : state.listedStorageCost;
                if (SegmentLedger.openStorageSegment(session, Math.min(state.listedStorageCost, ceiling), now)) {
                    LOG.debug("Storage rate lowered: machine {}, session {}, rate {}",
                            state.machineId, session.sessionId, state.listedStorageCost);
                }
            }
        }

        // ----------------------------------------------------------------------

        private void emit(
                LifecycleEventType type,
                RentalSession session,
                Double rate,
                List<Integer> gpuIndices,
                String message) {
            RentalLifecycleEvent event = new RentalLifecycleEvent(type, state.machineId, now);
            event.session = session.copy();
            event.rentalType = session.category;
            event.rate = rate;
            event.gpuIndices = new ArrayList<>(gpuIndices);
            event.message = message;
            result.events.add(event);
        }

        private String codeAt(int slot) {
            return slot < newCodes.length ? newCodes[slot] : RentalCategory.FREE_CODE;
        }

        private RentalCategory categoryAt(int slot) {
            return RentalCategory.fromCode(codeAt(slot));
        }
    }
}

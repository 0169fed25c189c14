package com.hostledger.rentals.reconcile;

import com.hostledger.rentals.model.RentalSession;
import com.hostledger.rentals.model.SessionStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Decides which session, if any, a newly claimed slot group belongs to.
 *
 * <p>Candidates are scored by a fixed priority; the lowest rank wins and ties go to the session
 * that was registered first:
 * <ol>
 *   <li>CONTINUITY: a running session already owns exactly the claimed slots.</li>
 *   <li>RESUME_EXACT: a stored session last held exactly the claimed slots.</li>
 *   <li>RESUME_DISK_CONTINUITY: the machine has exactly one stored session and allocated disk
 *       did not move this cycle.</li>
 *   <li>NEW_SESSION: nothing matched.</li>
 * </ol>
 * </p>
 */
public final class ClaimMatcher {
    private ClaimMatcher() {}

    public enum MatchKind {
        CONTINUITY,
        RESUME_EXACT,
        RESUME_DISK_CONTINUITY,
        NEW_SESSION
    }

    public static final class Match {
        public final MatchKind kind;
        public final RentalSession session;

        private Match(MatchKind kind, RentalSession session) {
            this.kind = kind;
            this.session = session;
        }

        static Match newSession() {
            return new Match(MatchKind.NEW_SESSION, null);
        }
    }

    public static Match match(
            Collection<RentalSession> sessions,
            List<Integer> claimedSlots,
            double diskDelta,
            double diskTolerance) {
        List<Integer> claimed = sorted(claimedSlots);
        int storedCount = 0;
        for (RentalSession session : sessions) {
            if (session.status == SessionStatus.STORED) {
                storedCount++;
            }
        }
        boolean diskUnchanged = Math.abs(diskDelta) < diskTolerance;

        Match best = Match.newSession();
        for (RentalSession session : sessions) {
            MatchKind kind = score(session, claimed, storedCount, diskUnchanged);
            if (kind.ordinal() < best.kind.ordinal()) {
                best = new Match(kind, session);
            }
        }
        return best;
    }

    static MatchKind score(RentalSession session, List<Integer> claimed, int storedCount, boolean diskUnchanged) {
        boolean sameSlots = sorted(session.gpus).equals(claimed);
        if (session.status == SessionStatus.RUNNING && sameSlots) {
            return MatchKind.CONTINUITY;
        }
        if (session.status == SessionStatus.STORED) {
            if (sameSlots) {
                return MatchKind.RESUME_EXACT;
            }
            if (storedCount == 1 && diskUnchanged) {
                return MatchKind.RESUME_DISK_CONTINUITY;
            }
        }
        return MatchKind.NEW_SESSION;
    }

    private static List<Integer> sorted(List<Integer> slots) {
        List<Integer> copy = new ArrayList<>(slots);
        copy.sort(null);
        return copy;
    }
}

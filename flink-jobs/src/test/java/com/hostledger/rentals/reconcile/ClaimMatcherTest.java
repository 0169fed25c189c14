package com.hostledger.rentals.reconcile;

import org.junit.jupiter.api.Test;

import com.hostledger.rentals.model.RentalSession;
import com.hostledger.rentals.model.SessionStatus;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClaimMatcherTest {
    private static final double TOLERANCE = 1.0;

    @Test
    void runningSessionWithSameSlotsIsContinuity() {
        RentalSession running = session("a", SessionStatus.RUNNING, 1, 0);

        ClaimMatcher.Match match = ClaimMatcher.match(
                Collections.singletonList(running), Arrays.asList(0, 1), 0.0, TOLERANCE);

        assertEquals(ClaimMatcher.MatchKind.CONTINUITY, match.kind);
        assertSame(running, match.session);
    }

    @Test
    void exactResumeBeatsDiskContinuity() {
        RentalSession other = session("a", SessionStatus.STORED, 3);
        RentalSession exact = session("b", SessionStatus.STORED, 0, 1);

        ClaimMatcher.Match match = ClaimMatcher.match(
                Arrays.asList(other, exact), Arrays.asList(1, 0), 0.0, TOLERANCE);

        assertEquals(ClaimMatcher.MatchKind.RESUME_EXACT, match.kind);
        assertSame(exact, match.session);
    }

    @Test
    void diskContinuityNeedsSingleStoredSessionAndStableDisk() {
        RentalSession stored = session("a", SessionStatus.STORED, 0, 1);
        List<RentalSession> sessions = Collections.singletonList(stored);

        assertEquals(ClaimMatcher.MatchKind.RESUME_DISK_CONTINUITY,
                ClaimMatcher.match(sessions, Arrays.asList(2, 3), 0.5, TOLERANCE).kind);
        assertEquals(ClaimMatcher.MatchKind.NEW_SESSION,
                ClaimMatcher.match(sessions, Arrays.asList(2, 3), 25.0, TOLERANCE).kind);

        RentalSession second = session("b", SessionStatus.STORED, 3);
        assertEquals(ClaimMatcher.MatchKind.NEW_SESSION,
                ClaimMatcher.match(Arrays.asList(stored, second), Collections.singletonList(2), 0.0, TOLERANCE).kind);
    }

    @Test
    void nothingMatchingStartsNewSession() {
        ClaimMatcher.Match match = ClaimMatcher.match(
                Collections.singletonList(session("a", SessionStatus.RUNNING, 0)),
                Collections.singletonList(1), 0.0, TOLERANCE);

        assertEquals(ClaimMatcher.MatchKind.NEW_SESSION, match.kind);
        assertNull(match.session);
    }

    @Test
    void tieGoesToFirstRegisteredSession() {
        RentalSession first = session("a", SessionStatus.STORED, 0);
        RentalSession second = session("b", SessionStatus.STORED, 0);

        ClaimMatcher.Match match = ClaimMatcher.match(
                Arrays.asList(first, second), Collections.singletonList(0), 0.0, TOLERANCE);

        assertSame(first, match.session);
    }

    private static RentalSession session(String id, SessionStatus status, Integer... gpus) {
        RentalSession session = new RentalSession();
        session.sessionId = id;
        session.status = status;
        session.gpus = Arrays.asList(gpus);
        return session;
    }
}

package com.questrail.goldenbridge.junit;

import com.questrail.goldenbridge.session.OracleSession;

import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Hands the session of the running test plan from
 * {@link OracleTestPlanListener} to {@link OracleDumpExtension}.
 *
 * <p>Sessions form a stack so a test plan launched from inside another one
 * (a launcher used within a test) sees its own session and restores the
 * outer one when it finishes.</p>
 */
public final class OracleSessions
{
    private static final Deque<OracleSession> ACTIVE = new ConcurrentLinkedDeque<>();

    private OracleSessions() {}

    public static Optional<OracleSession> current() {
        return Optional.ofNullable(ACTIVE.peekFirst());
    }

    static void push(OracleSession session) {
        ACTIVE.addFirst(Objects.requireNonNull(session, "session"));
    }

    static void remove(OracleSession session) {
        ACTIVE.removeFirstOccurrence(session);
    }
}

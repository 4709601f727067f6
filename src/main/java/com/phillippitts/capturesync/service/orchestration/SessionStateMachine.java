package com.phillippitts.capturesync.service.orchestration;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe registry of the single active session.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → ACTIVE (via begin)
 * ACTIVE → IDLE (via end, only by the session that is registered)
 * </pre>
 *
 * <p>A session stays registered until its upload loops have exited, so no new start can reset
 * the directories while a drain is still reading them.
 */
final class SessionStateMachine {

    private final Lock lock = new ReentrantLock();
    private ActiveSession active;

    /**
     * @return {@code true} if the session was registered, {@code false} if another is active
     */
    boolean begin(ActiveSession session) {
        if (session == null) {
            throw new NullPointerException("session cannot be null");
        }
        lock.lock();
        try {
            if (active != null) {
                return false;
            }
            active = session;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unregisters the session if it is still the active one.
     *
     * @return {@code true} if it was unregistered by this call
     */
    boolean end(ActiveSession expected) {
        lock.lock();
        try {
            if (active == null || active != expected) {
                return false;
            }
            active = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Active session, or {@code null} when idle. */
    ActiveSession current() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    boolean isActive() {
        return current() != null;
    }
}

package com.attendance.tracker.core;

import com.attendance.tracker.enums.CancelCause;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * In-memory store of in-flight collection sessions keyed by admin id.
 * Single JVM only. A stalled session counts as absent and is cancelled when displaced.
 */
public final class CollectionSessionRegistry {

    private final ConcurrentMap<String, CollectionSession> map = new ConcurrentHashMap<>();

    /**
     * Registers the session unless a live one exists for the same admin.
     *
     * @param onTimedOut receives a stalled session this call cancelled and displaced
     * @return false when a live session is already registered
     */
    public boolean setIfAbsent(CollectionSession session, Instant now, Consumer<CollectionSession> onTimedOut) {
        final String key = session.getAdminId();

        for (; ; ) {
            final CollectionSession existing = map.get(key);
            if (existing != null) {
                if (existing.isStalled(now) || existing.getState().isTerminal()) {
                    if (map.replace(key, existing, session)) {
                        boolean timedOut;
                        synchronized (existing) {
                            timedOut = !existing.getState().isTerminal();
                            existing.cancel(CancelCause.TIMEOUT, now);
                        }
                        if (timedOut) onTimedOut.accept(existing);
                        return true;
                    }
                    // lost race; retry
                } else {
                    return false;
                }
            } else if (map.putIfAbsent(key, session) == null) {
                return true;
            }
            // lost race; retry
        }
    }

    public Optional<CollectionSession> get(String adminId) {
        return Optional.ofNullable(map.get(adminId));
    }

    /**
     * Removes the entry only if it still maps to this exact session.
     */
    public boolean remove(CollectionSession session) {
        return map.remove(session.getAdminId(), session);
    }

    /**
     * Cancels and removes every stalled session.
     *
     * @return the sessions that were cancelled
     */
    public List<CollectionSession> sweep(Instant now) {
        List<CollectionSession> cancelled = new ArrayList<>();
        for (CollectionSession s : map.values()) {
            synchronized (s) {
                if (!s.isStalled(now)) continue;
                s.cancel(CancelCause.TIMEOUT, now);
            }
            if (map.remove(s.getAdminId(), s)) {
                cancelled.add(s);
            }
        }
        return cancelled;
    }

    public int size() {
        return map.size();
    }
}

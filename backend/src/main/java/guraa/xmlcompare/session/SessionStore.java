package guraa.xmlcompare.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide store of authenticated sessions.
 * Lookups take the read lock and may run concurrently; creation, logout and
 * the expiry sweep take the write lock.
 */
@Slf4j
@Component
public class SessionStore {

    private final Map<String, Session> sessions = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void put(Session session) {
        lock.writeLock().lock();
        try {
            sessions.put(session.getId(), session);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Stored session {} for {}", session.getId(), session.getUrl());
    }

    /**
     * Look up a live session. Expired sessions are reported as absent even
     * before the sweep removes them.
     *
     * @param sessionId The session id
     * @return The session, if present and not expired
     */
    public Optional<Session> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            Session session = sessions.get(sessionId);
            if (session == null || session.isExpired()) {
                return Optional.empty();
            }
            return Optional.of(session);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Remove a session.
     *
     * @param sessionId The session id
     * @return true if a session was removed
     */
    public boolean remove(String sessionId) {
        lock.writeLock().lock();
        try {
            return sessions.remove(sessionId) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove every session expired at the given instant.
     *
     * @param now The reference instant
     * @return The number of sessions removed
     */
    public int sweepExpired(Instant now) {
        int removed = 0;
        lock.writeLock().lock();
        try {
            Iterator<Session> it = sessions.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpiredAt(now)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return removed;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return sessions.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}

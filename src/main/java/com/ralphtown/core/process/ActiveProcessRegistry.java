package com.ralphtown.core.process;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runtime-only record of which session occupies which repository.
 * <p>
 * Both maps sit behind one lock and are only reachable through atomic
 * check-and-mutate operations. The lock is never held across process I/O.
 */
class ActiveProcessRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ActiveProcess> bySession = new HashMap<>();
    private final Map<String, String> sessionByRepo = new HashMap<>();

    /**
     * Reserves the run slot for a session and its repository.
     *
     * @throws SessionAlreadyRunningException if the session already holds a slot
     * @throws RepoBusyException              if another session holds the repository
     */
    ActiveProcess reserve(String sessionId, String repoId) {
        lock.lock();
        try {
            if (bySession.containsKey(sessionId)) {
                throw new SessionAlreadyRunningException(sessionId);
            }
            if (sessionByRepo.containsKey(repoId)) {
                throw new RepoBusyException(repoId);
            }
            ActiveProcess entry = new ActiveProcess(sessionId, repoId);
            bySession.put(sessionId, entry);
            sessionByRepo.put(repoId, sessionId);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the entry if it is still the one registered for its session.
     *
     * @return true if this call removed it
     */
    boolean release(ActiveProcess entry) {
        lock.lock();
        try {
            if (bySession.get(entry.sessionId()) != entry) {
                return false;
            }
            bySession.remove(entry.sessionId());
            sessionByRepo.remove(entry.repoId(), entry.sessionId());
            return true;
        } finally {
            lock.unlock();
        }
    }

    Optional<ActiveProcess> get(String sessionId) {
        lock.lock();
        try {
            return Optional.ofNullable(bySession.get(sessionId));
        } finally {
            lock.unlock();
        }
    }

    boolean contains(ActiveProcess entry) {
        lock.lock();
        try {
            return bySession.get(entry.sessionId()) == entry;
        } finally {
            lock.unlock();
        }
    }

    boolean isRepoBusy(String repoId) {
        lock.lock();
        try {
            return sessionByRepo.containsKey(repoId);
        } finally {
            lock.unlock();
        }
    }

    boolean isSessionRunning(String sessionId) {
        lock.lock();
        try {
            return bySession.containsKey(sessionId);
        } finally {
            lock.unlock();
        }
    }

    List<ActiveProcess> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(bySession.values());
        } finally {
            lock.unlock();
        }
    }
}

package com.example.imagebot.conversion.service;

import com.example.imagebot.conversion.model.StagedImage;
import com.example.imagebot.conversion.model.StatusHandle;
import com.example.imagebot.conversion.support.IntakeRejectedException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class SessionStore {

    private final Map<Long, Session> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxBatchSize;

    public SessionStore(Clock clock, @Value("${app.conversion.max-batch-size:50}") int maxBatchSize) {
        this.clock = clock;
        this.maxBatchSize = Math.max(1, maxBatchSize);
    }

    /**
     * Appends {@code image} to the user's pending list, creating the session on first use.
     *
     * @return the number of pending images after the append
     * @throws IntakeRejectedException when the session already holds the maximum batch size
     */
    public int add(long userId, StagedImage image) {
        while (true) {
            Session session = sessions.computeIfAbsent(userId, id -> new Session());
            session.lock.lock();
            try {
                if (sessions.get(userId) != session) {
                    // cleared between lookup and lock, retry against the live session
                    continue;
                }
                if (session.pending.size() >= maxBatchSize) {
                    throw new IntakeRejectedException(IntakeRejectedException.Reason.BATCH_FULL,
                            "Batch limit of %d images reached".formatted(maxBatchSize));
                }
                session.pending.add(image);
                session.lastActivity = clock.instant();
                return session.pending.size();
            } finally {
                session.lock.unlock();
            }
        }
    }

    public int remainingCapacity(long userId) {
        return maxBatchSize - snapshot(userId).size();
    }

    public List<StagedImage> snapshot(long userId) {
        Session session = sessions.get(userId);
        if (session == null) {
            return List.of();
        }
        session.lock.lock();
        try {
            return List.copyOf(session.pending);
        } finally {
            session.lock.unlock();
        }
    }

    public Optional<StatusHandle> statusHandle(long userId) {
        Session session = sessions.get(userId);
        if (session == null) {
            return Optional.empty();
        }
        session.lock.lock();
        try {
            return Optional.ofNullable(session.statusHandle);
        } finally {
            session.lock.unlock();
        }
    }

    public void updateStatusHandle(long userId, StatusHandle handle) {
        Session session = sessions.get(userId);
        if (session == null) {
            return;
        }
        session.lock.lock();
        try {
            session.statusHandle = handle;
        } finally {
            session.lock.unlock();
        }
    }

    /**
     * Detaches the user's session and hands its pending images to the caller, who then owns the
     * staged files. Nothing else, the idle sweep included, can reach them afterwards.
     */
    public List<StagedImage> take(long userId) {
        Session session = sessions.remove(userId);
        if (session == null) {
            return List.of();
        }
        session.lock.lock();
        try {
            List<StagedImage> taken = List.copyOf(session.pending);
            session.pending.clear();
            session.statusHandle = null;
            return taken;
        } finally {
            session.lock.unlock();
        }
    }

    // Drops the session and deletes whatever it still had staged.
    public void clear(long userId) {
        List<StagedImage> dropped = take(userId);
        if (!dropped.isEmpty()) {
            log.debug("Clearing session for user={} pending={}", userId, dropped.size());
            dropped.forEach(StagedImage::deleteSilently);
        }
    }

    public List<StagedImage> expireIdleSessions(Instant cutoff) {
        List<StagedImage> expired = new ArrayList<>();
        Iterator<Map.Entry<Long, Session>> iterator = sessions.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<Long, Session> entry = iterator.next();
            Session session = entry.getValue();
            if (!session.lock.tryLock()) {
                continue;
            }
            try {
                if (sessions.get(entry.getKey()) == session && session.lastActivity.isBefore(cutoff)) {
                    log.info("Expiring idle session for user={} pending={}", entry.getKey(), session.pending.size());
                    expired.addAll(session.pending);
                    session.pending.clear();
                    session.statusHandle = null;
                    iterator.remove();
                }
            } finally {
                session.lock.unlock();
            }
        }
        return expired;
    }

    int sessionCount() {
        return sessions.size();
    }

    private final class Session {
        private final ReentrantLock lock = new ReentrantLock();
        private final List<StagedImage> pending = new ArrayList<>();
        private StatusHandle statusHandle;
        private Instant lastActivity = clock.instant();
    }
}

// Copyright 2021-present StarRocks, Inc. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     https://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.sluice.qe;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.sluice.common.CloseableLock;
import com.sluice.common.DuplicateEntryException;
import com.sluice.common.UnknownSessionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Maps a session id to the queries submitted under it. A session is present only while at least
 * one of its queries is registered; the session interrupt flag lives and dies with it.
 * <p>
 * All mutations take the write lock, lookups take the read lock. Interrupt listeners are called
 * after the write lock has been released.
 */
public class SessionRegistry {
    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private static class SessionBucket {
        // arrival order
        private final Set<QueryEntry> entries = Sets.newLinkedHashSet();
        private final AtomicBoolean interrupted = new AtomicBoolean(false);

        private boolean hasEntry(Predicate<QueryEntry> predicate) {
            return entries.stream().anyMatch(predicate);
        }
    }

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    // signalled on every registration, removal, admission and interrupt
    private final Condition changed = lock.writeLock().newCondition();
    private final Map<String, SessionBucket> sessions = Maps.newHashMap();
    private final List<SessionInterruptListener> interruptListeners = new CopyOnWriteArrayList<>();

    public void addInterruptListener(SessionInterruptListener listener) {
        interruptListeners.add(Preconditions.checkNotNull(listener));
    }

    public void register(String sessionId, QueryEntry entry) throws DuplicateEntryException {
        Preconditions.checkArgument(sessionId.equals(entry.getSessionId()),
                "entry %s does not belong to session %s", entry.getQueryId(), sessionId);
        try (CloseableLock ignored = CloseableLock.write(lock)) {
            SessionBucket bucket = sessions.computeIfAbsent(sessionId, k -> new SessionBucket());
            if (!bucket.entries.add(entry)) {
                throw new DuplicateEntryException(entry.getQueryId(), sessionId);
            }
            entry.bindSessionInterruptFlag(bucket.interrupted);
            changed.signalAll();
        }
        LOG.debug("register query {} of session {}", entry.getQueryId(), sessionId);
    }

    public boolean deregister(String sessionId, QueryEntry entry) {
        boolean removed;
        boolean sessionRemoved = false;
        try (CloseableLock ignored = CloseableLock.write(lock)) {
            SessionBucket bucket = sessions.get(sessionId);
            if (bucket == null) {
                return false;
            }
            removed = bucket.entries.remove(entry);
            if (bucket.entries.isEmpty()) {
                sessions.remove(sessionId);
                sessionRemoved = true;
            }
            changed.signalAll();
        }
        if (removed) {
            LOG.debug("deregister query {} of session {}, session removed: {}",
                    entry.getQueryId(), sessionId, sessionRemoved);
        }
        return removed;
    }

    /**
     * Wakes up the threads waiting in {@link #awaitRunning}. The entry state itself has already been
     * changed by the dispatch queue.
     */
    public void onAdmitted(QueryEntry entry) {
        try (CloseableLock ignored = CloseableLock.write(lock)) {
            changed.signalAll();
        }
    }

    /**
     * Returns the session of the most recently admitted query that is still running.
     */
    public Optional<String> lookupCurrentSession() {
        try (CloseableLock ignored = CloseableLock.read(lock)) {
            QueryEntry latest = null;
            for (SessionBucket bucket : sessions.values()) {
                for (QueryEntry entry : bucket.entries) {
                    if (entry.getState() == QueryEntryState.RUNNING
                            && (latest == null || entry.getAdmissionSeq() > latest.getAdmissionSeq())) {
                        latest = entry;
                    }
                }
            }
            return latest == null ? Optional.empty() : Optional.of(latest.getSessionId());
        }
    }

    public boolean isEnrolled(String sessionId) {
        try (CloseableLock ignored = CloseableLock.read(lock)) {
            SessionBucket bucket = sessions.get(sessionId);
            return bucket != null && bucket.hasEntry(e -> e.getState().isActive());
        }
    }

    public List<QueryEntrySummary> entriesFor(String sessionId) {
        try (CloseableLock ignored = CloseableLock.read(lock)) {
            SessionBucket bucket = sessions.get(sessionId);
            if (bucket == null) {
                return ImmutableList.of();
            }
            return bucket.entries.stream().map(QueryEntry::toSummary).collect(ImmutableList.toImmutableList());
        }
    }

    public List<QueryEntrySummary> allEntries() {
        try (CloseableLock ignored = CloseableLock.read(lock)) {
            return sessions.values().stream()
                    .flatMap(bucket -> bucket.entries.stream())
                    .map(QueryEntry::toSummary)
                    .collect(ImmutableList.toImmutableList());
        }
    }

    public int sessionCount() {
        try (CloseableLock ignored = CloseableLock.read(lock)) {
            return sessions.size();
        }
    }

    /**
     * Raises the interrupt flag of a session and returns the number of its pending or running
     * queries at that moment.
     */
    public int setInterrupt(String sessionId) throws UnknownSessionException {
        int activeEntries;
        try (CloseableLock ignored = CloseableLock.write(lock)) {
            SessionBucket bucket = sessionId == null ? null : sessions.get(sessionId);
            if (bucket == null) {
                throw new UnknownSessionException(sessionId);
            }
            activeEntries = (int) bucket.entries.stream().filter(e -> e.getState().isActive()).count();
            if (activeEntries == 0) {
                throw new UnknownSessionException(sessionId);
            }
            bucket.interrupted.set(true);
            changed.signalAll();
        }
        LOG.info("interrupt session {}, pending or running queries: {}", sessionId, activeEntries);
        for (SessionInterruptListener listener : interruptListeners) {
            listener.onSessionInterrupted(sessionId);
        }
        return activeEntries;
    }

    public boolean isInterrupted(String sessionId) {
        try (CloseableLock ignored = CloseableLock.read(lock)) {
            SessionBucket bucket = sessions.get(sessionId);
            return bucket != null && bucket.interrupted.get();
        }
    }

    public boolean awaitRunning(String sessionId, long timeout, TimeUnit unit) throws InterruptedException {
        return awaitSession(sessionId, bucket -> bucket != null
                && bucket.hasEntry(e -> e.getState() == QueryEntryState.RUNNING), timeout, unit);
    }

    public boolean awaitEnrolled(String sessionId, long timeout, TimeUnit unit) throws InterruptedException {
        return awaitSession(sessionId, bucket -> bucket != null
                && bucket.hasEntry(e -> e.getState().isActive()), timeout, unit);
    }

    /**
     * Waits until exactly {@code count} queries of the session are registered. A count of zero waits
     * for the session to disappear.
     */
    public boolean awaitEntryCount(String sessionId, int count, long timeout, TimeUnit unit)
            throws InterruptedException {
        Preconditions.checkArgument(count >= 0, "count must not be negative: %s", count);
        return awaitSession(sessionId, bucket -> (bucket == null ? 0 : bucket.entries.size()) == count,
                timeout, unit);
    }

    private boolean awaitSession(String sessionId, Predicate<SessionBucket> condition, long timeout, TimeUnit unit)
            throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        try (CloseableLock ignored = CloseableLock.write(lock)) {
            while (!condition.test(sessions.get(sessionId))) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = changed.awaitNanos(nanos);
            }
            return true;
        }
    }
}

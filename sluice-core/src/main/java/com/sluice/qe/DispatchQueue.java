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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;
import com.sluice.common.CloseableLock;
import com.sluice.common.Config;
import com.sluice.common.ErrorCode;
import com.sluice.common.PendingQueryInterruptedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounds the number of concurrently running queries.
 * <p>
 * A query asks for a slot with {@link #acquireSlot} and waits in FIFO order of arrival until one is
 * free. A query pinned to an executor is additionally held back while another query runs on that
 * executor; the grant then goes to the longest waiting query that can run. Granting a slot and
 * moving the query to RUNNING happen atomically under the queue lock.
 * <p>
 * While runtime interrupt is enabled a waiting query whose session has been interrupted is never
 * granted a slot. It stays pending until its own interrupt check ends it, so it fails as a pending
 * query rather than entering the kernel.
 * <p>
 * Waiting is done in bounded iterations of {@link Config#dispatch_queue_wait_interval_ms}; after
 * every iteration the caller supplied {@link PendingInterruptCheck} decides whether the query must
 * give up waiting.
 */
public class DispatchQueue implements SessionInterruptListener {
    private static final Logger LOG = LogManager.getLogger(DispatchQueue.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition slotChanged = lock.newCondition();

    // query ids are assigned in arrival order
    private final TreeSet<QueryEntry> waitingQueue = new TreeSet<>(Comparator.comparingLong(QueryEntry::getQueryId));
    private final Set<Integer> busyExecutors = Sets.newHashSet();
    private int capacity;
    private int occupied = 0;
    private long nextAdmissionSeq = 0;

    private final InterruptChecker interruptChecker;

    public DispatchQueue(int capacity) {
        this(capacity, new InterruptChecker());
    }

    public DispatchQueue(int capacity, InterruptChecker interruptChecker) {
        checkCapacity(capacity);
        this.capacity = capacity;
        this.interruptChecker = Preconditions.checkNotNull(interruptChecker);
    }

    public SlotLease acquireSlot(QueryEntry entry, PendingInterruptCheck interruptCheck)
            throws PendingQueryInterruptedException, InterruptedException {
        try (CloseableLock ignored = CloseableLock.lock(lock)) {
            Preconditions.checkState(entry.getState() == QueryEntryState.PENDING,
                    "query %s is not pending: %s", entry.getQueryId(), entry.getState());
            waitingQueue.add(entry);
            grantWaitingQueries();

            long iteration = 0;
            while (entry.getState() != QueryEntryState.RUNNING) {
                try {
                    slotChanged.await(Config.dispatch_queue_wait_interval_ms, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    if (entry.getState() == QueryEntryState.RUNNING) {
                        // granted while being interrupted, hand the slot back
                        releaseGrantedSlot(entry);
                    } else {
                        waitingQueue.remove(entry);
                    }
                    entry.finish(QueryEntryState.FAILED);
                    LOG.warn("query {} of session {} was interrupted while waiting for a dispatch slot",
                            entry.getQueryId(), entry.getSessionId());
                    throw e;
                }
                if (entry.getState() == QueryEntryState.RUNNING) {
                    break;
                }
                // a held back ticket becomes grantable once runtime interrupt is disabled
                grantWaitingQueries();
                if (entry.getState() == QueryEntryState.RUNNING) {
                    break;
                }
                iteration++;
                try {
                    interruptCheck.check(iteration);
                } catch (PendingQueryInterruptedException e) {
                    waitingQueue.remove(entry);
                    entry.finish(QueryEntryState.INTERRUPTED);
                    LOG.info("pending query {} of session {} is interrupted after {} wait iterations",
                            entry.getQueryId(), entry.getSessionId(), iteration);
                    throw e;
                }
            }
            return new SlotLease(this, entry);
        }
    }

    public void releaseSlot(SlotLease lease) {
        if (!lease.markReleased()) {
            return;
        }
        try (CloseableLock ignored = CloseableLock.lock(lock)) {
            releaseGrantedSlot(lease.getEntry());
        }
    }

    public void resize(int newCapacity) {
        checkCapacity(newCapacity);
        try (CloseableLock ignored = CloseableLock.lock(lock)) {
            int oldCapacity = capacity;
            capacity = newCapacity;
            LOG.info("resize dispatch queue from {} to {}, occupied: {}, pending: {}",
                    oldCapacity, newCapacity, occupied, waitingQueue.size());
            grantWaitingQueries();
        }
    }

    @Override
    public void onSessionInterrupted(String sessionId) {
        wakeUpWaiters();
    }

    public void wakeUpWaiters() {
        try (CloseableLock ignored = CloseableLock.lock(lock)) {
            slotChanged.signalAll();
        }
    }

    public int getCapacity() {
        try (CloseableLock ignored = CloseableLock.lock(lock)) {
            return capacity;
        }
    }

    public int getOccupied() {
        try (CloseableLock ignored = CloseableLock.lock(lock)) {
            return occupied;
        }
    }

    public int getPendingCount() {
        try (CloseableLock ignored = CloseableLock.lock(lock)) {
            return waitingQueue.size();
        }
    }

    @VisibleForTesting
    boolean isExecutorBusy(int executorId) {
        try (CloseableLock ignored = CloseableLock.lock(lock)) {
            return busyExecutors.contains(executorId);
        }
    }

    // must hold lock
    private void releaseGrantedSlot(QueryEntry entry) {
        occupied--;
        if (entry.isPinnedToExecutor()) {
            busyExecutors.remove(entry.getExecutorId());
        }
        LOG.debug("query {} released its dispatch slot, occupied: {}/{}", entry.getQueryId(), occupied, capacity);
        grantWaitingQueries();
    }

    // must hold lock
    private void grantWaitingQueries() {
        boolean granted = false;
        boolean holdBackInterrupted = interruptChecker.isEnabled();
        Iterator<QueryEntry> iter = waitingQueue.iterator();
        while (occupied < capacity && iter.hasNext()) {
            QueryEntry entry = iter.next();
            if (entry.isPinnedToExecutor() && busyExecutors.contains(entry.getExecutorId())) {
                continue;
            }
            if (holdBackInterrupted && entry.isSessionInterrupted()) {
                continue;
            }
            iter.remove();
            if (!entry.transitionToRunning(nextAdmissionSeq++)) {
                LOG.warn("skip granting dispatch slot to query {} in state {}", entry.getQueryId(), entry.getState());
                continue;
            }
            occupied++;
            if (entry.isPinnedToExecutor()) {
                busyExecutors.add(entry.getExecutorId());
            }
            granted = true;
            LOG.debug("grant dispatch slot to query {} of session {}, occupied: {}/{}",
                    entry.getQueryId(), entry.getSessionId(), occupied, capacity);
        }
        if (granted) {
            slotChanged.signalAll();
        }
    }

    private static void checkCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException(ErrorCode.ERR_INVALID_DISPATCH_CAPACITY.formatErrorMsg(capacity));
        }
    }
}

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

import com.sluice.common.PendingQueryInterruptedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static com.sluice.qe.QeTestUtils.SESSION1;
import static com.sluice.qe.QeTestUtils.SESSION2;
import static com.sluice.qe.QeTestUtils.newEntry;

public class DispatchQueueTest {
    private static final long TIMEOUT_SECONDS = 10;

    private ExecutorService executor;

    @BeforeEach
    public void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private Future<SlotLease> acquireAsync(DispatchQueue queue, QueryEntry entry, PendingInterruptCheck check) {
        return executor.submit(() -> queue.acquireSlot(entry, check));
    }

    private static void waitPending(DispatchQueue queue, int count) throws InterruptedException {
        Assertions.assertTrue(QeTestUtils.waitUntil(() -> queue.getPendingCount() == count,
                TIMEOUT_SECONDS, TimeUnit.SECONDS));
    }

    @Test
    public void testGrantWhenSlotIsFree() throws Exception {
        DispatchQueue queue = new DispatchQueue(2);
        QueryEntry entry = newEntry(SESSION1);

        SlotLease lease = queue.acquireSlot(entry, PendingInterruptCheck.NEVER);

        Assertions.assertEquals(QueryEntryState.RUNNING, entry.getState());
        Assertions.assertTrue(entry.getAdmittedTimeMs() >= entry.getArrivalTimeMs());
        Assertions.assertEquals(1, queue.getOccupied());

        lease.release();
        lease.release();
        Assertions.assertTrue(lease.isReleased());
        Assertions.assertEquals(0, queue.getOccupied());
    }

    @Test
    public void testReleaseGrantsLongestWaitingQuery() throws Exception {
        DispatchQueue queue = new DispatchQueue(1);
        SlotLease first = queue.acquireSlot(newEntry(SESSION1), PendingInterruptCheck.NEVER);

        QueryEntry second = newEntry(SESSION2);
        Future<SlotLease> secondLease = acquireAsync(queue, second, PendingInterruptCheck.NEVER);
        waitPending(queue, 1);
        QueryEntry third = newEntry(SESSION1);
        Future<SlotLease> thirdLease = acquireAsync(queue, third, PendingInterruptCheck.NEVER);
        waitPending(queue, 2);

        first.close();
        secondLease.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        Assertions.assertEquals(QueryEntryState.RUNNING, second.getState());
        Assertions.assertEquals(QueryEntryState.PENDING, third.getState());
        Assertions.assertEquals(1, queue.getOccupied());
        Assertions.assertEquals(1, queue.getPendingCount());

        secondLease.get().release();
        thirdLease.get(TIMEOUT_SECONDS, TimeUnit.SECONDS).release();
        Assertions.assertTrue(third.getAdmissionSeq() > second.getAdmissionSeq());
        Assertions.assertEquals(0, queue.getOccupied());
    }

    @Test
    public void testBusyExecutorHoldsBackPinnedQuery() throws Exception {
        DispatchQueue queue = new DispatchQueue(3);
        SlotLease running = queue.acquireSlot(newEntry(SESSION1, 0), PendingInterruptCheck.NEVER);
        Assertions.assertTrue(queue.isExecutorBusy(0));

        QueryEntry pinned = newEntry(SESSION2, 0);
        Future<SlotLease> pinnedLease = acquireAsync(queue, pinned, PendingInterruptCheck.NEVER);
        waitPending(queue, 1);
        Assertions.assertEquals(QueryEntryState.PENDING, pinned.getState());

        // a later query without executor constraint is not blocked by the pinned one
        QueryEntry free = newEntry(SESSION2);
        SlotLease freeLease = queue.acquireSlot(free, PendingInterruptCheck.NEVER);
        Assertions.assertEquals(QueryEntryState.RUNNING, free.getState());
        Assertions.assertEquals(QueryEntryState.PENDING, pinned.getState());

        QueryEntry otherExecutor = newEntry(SESSION1, 1);
        SlotLease otherLease = queue.acquireSlot(otherExecutor, PendingInterruptCheck.NEVER);
        Assertions.assertEquals(QueryEntryState.RUNNING, otherExecutor.getState());

        otherLease.release();
        freeLease.release();
        Assertions.assertEquals(QueryEntryState.PENDING, pinned.getState());

        running.release();
        pinnedLease.get(TIMEOUT_SECONDS, TimeUnit.SECONDS).release();
        Assertions.assertEquals(QueryEntryState.RUNNING, pinned.getState());
        Assertions.assertFalse(queue.isExecutorBusy(0));
    }

    @Test
    public void testResize() throws Exception {
        DispatchQueue queue = new DispatchQueue(1);
        SlotLease first = queue.acquireSlot(newEntry(SESSION1), PendingInterruptCheck.NEVER);
        QueryEntry second = newEntry(SESSION2);
        Future<SlotLease> secondLease = acquireAsync(queue, second, PendingInterruptCheck.NEVER);
        waitPending(queue, 1);

        queue.resize(2);
        SlotLease lease2 = secondLease.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        Assertions.assertEquals(2, queue.getOccupied());

        // shrinking keeps both running queries
        queue.resize(1);
        Assertions.assertEquals(2, queue.getOccupied());
        QueryEntry third = newEntry(SESSION1);
        Future<SlotLease> thirdLease = acquireAsync(queue, third, PendingInterruptCheck.NEVER);
        waitPending(queue, 1);

        first.release();
        Assertions.assertEquals(QueryEntryState.PENDING, third.getState());
        lease2.release();
        thirdLease.get(TIMEOUT_SECONDS, TimeUnit.SECONDS).release();
        Assertions.assertEquals(QueryEntryState.RUNNING, third.getState());
    }

    @Test
    public void testResizeRejectsNonPositiveCapacity() {
        DispatchQueue queue = new DispatchQueue(1);
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class, () -> queue.resize(0));
        Assertions.assertEquals("Dispatch queue capacity must be positive, but got 0", e.getMessage());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new DispatchQueue(-1));
        Assertions.assertEquals(1, queue.getCapacity());
    }

    @Test
    public void testPendingInterruptCheckRemovesTicket() throws Exception {
        DispatchQueue queue = new DispatchQueue(1);
        SlotLease first = queue.acquireSlot(newEntry(SESSION1), PendingInterruptCheck.NEVER);

        QueryEntry waiting = newEntry(SESSION2);
        AtomicLong lastIteration = new AtomicLong();
        Future<SlotLease> lease = acquireAsync(queue, waiting, iteration -> {
            lastIteration.set(iteration);
            if (iteration == 3) {
                throw new PendingQueryInterruptedException();
            }
        });

        ExecutionException e = Assertions.assertThrows(ExecutionException.class,
                () -> lease.get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        Assertions.assertTrue(e.getCause() instanceof PendingQueryInterruptedException);
        Assertions.assertEquals(3, lastIteration.get());
        Assertions.assertEquals(QueryEntryState.INTERRUPTED, waiting.getState());
        Assertions.assertEquals(0, queue.getPendingCount());
        Assertions.assertEquals(1, queue.getOccupied());
        first.release();
    }

    @Test
    public void testThreadInterruptFailsWaitingQuery() throws Exception {
        DispatchQueue queue = new DispatchQueue(1);
        SlotLease first = queue.acquireSlot(newEntry(SESSION1), PendingInterruptCheck.NEVER);

        QueryEntry waiting = newEntry(SESSION2);
        Future<SlotLease> lease = acquireAsync(queue, waiting, PendingInterruptCheck.NEVER);
        waitPending(queue, 1);
        lease.cancel(true);

        Assertions.assertTrue(QeTestUtils.waitUntil(() -> waiting.getState() == QueryEntryState.FAILED,
                TIMEOUT_SECONDS, TimeUnit.SECONDS));
        Assertions.assertEquals(0, queue.getPendingCount());
        first.release();
        Assertions.assertEquals(0, queue.getOccupied());
    }

    @Test
    public void testInterruptedSessionIsNotGrantedFreedSlot() throws Exception {
        InterruptChecker checker = new InterruptChecker();
        checker.enable(1.0, 5);
        DispatchQueue queue = new DispatchQueue(1, checker);
        SlotLease first = queue.acquireSlot(newEntry(SESSION1), PendingInterruptCheck.NEVER);

        AtomicBoolean interrupted = new AtomicBoolean(false);
        QueryEntry held = newEntry(SESSION1);
        held.bindSessionInterruptFlag(interrupted);
        Future<SlotLease> heldLease = acquireAsync(queue, held,
                iteration -> checker.checkPendingQuery(held, iteration, 0));
        waitPending(queue, 1);
        QueryEntry other = newEntry(SESSION2);
        Future<SlotLease> otherLease = acquireAsync(queue, other, PendingInterruptCheck.NEVER);
        waitPending(queue, 2);

        interrupted.set(true);
        first.release();

        // the slot skips the interrupted ticket and goes to the next one in line
        otherLease.get(TIMEOUT_SECONDS, TimeUnit.SECONDS).release();
        ExecutionException e = Assertions.assertThrows(ExecutionException.class,
                () -> heldLease.get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        Assertions.assertTrue(e.getCause() instanceof PendingQueryInterruptedException);
        Assertions.assertEquals("Query execution has been interrupted (pending query)", e.getCause().getMessage());
        Assertions.assertEquals(QueryEntryState.INTERRUPTED, held.getState());
        Assertions.assertEquals(-1, held.getAdmissionSeq());
        Assertions.assertEquals(0, queue.getPendingCount());
        Assertions.assertEquals(0, queue.getOccupied());
    }

    @Test
    public void testInterruptedSessionIsGrantedOnceInterruptIsDisabled() throws Exception {
        InterruptChecker checker = new InterruptChecker();
        checker.enable(1.0, 5);
        DispatchQueue queue = new DispatchQueue(1, checker);
        SlotLease first = queue.acquireSlot(newEntry(SESSION1), PendingInterruptCheck.NEVER);

        QueryEntry held = newEntry(SESSION1);
        held.bindSessionInterruptFlag(new AtomicBoolean(true));
        Future<SlotLease> heldLease = acquireAsync(queue, held, PendingInterruptCheck.NEVER);
        waitPending(queue, 1);

        first.release();
        Assertions.assertFalse(QeTestUtils.waitUntil(() -> held.getState() == QueryEntryState.RUNNING,
                200, TimeUnit.MILLISECONDS));
        Assertions.assertEquals(1, queue.getPendingCount());

        checker.disable();
        heldLease.get(TIMEOUT_SECONDS, TimeUnit.SECONDS).release();
        Assertions.assertEquals(0, queue.getOccupied());
    }
}

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
import com.google.common.base.Strings;
import com.sluice.common.Config;
import com.sluice.common.DuplicateEntryException;
import com.sluice.common.ErrorCode;
import com.sluice.common.InvalidConfException;
import com.sluice.common.PendingQueryInterruptedException;
import com.sluice.common.QueryInterruptedException;
import com.sluice.common.SluiceException;
import com.sluice.common.ThreadPoolManager;
import com.sluice.common.UnknownSessionException;
import com.sluice.execution.CatalogReadinessCheck;
import com.sluice.execution.ExecutionKernel;
import com.sluice.execution.ExecutorDeviceType;
import com.sluice.execution.KernelException;
import com.sluice.execution.PhysicalPlan;
import com.sluice.execution.ProgressCheckpoint;
import com.sluice.execution.QueryPlanner;
import com.sluice.execution.ResultSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives a submitted query through its lifecycle:
 * <pre>
 *   plan -> register PENDING -> wait for a dispatch slot -> RUNNING -> readiness check -> execute
 * </pre>
 * Whatever the outcome, the query is removed from the registry and its slot is given back before
 * the submission returns.
 * <p>
 * Any caller may interrupt all queries of a session with {@link #interrupt}. A pending query gives
 * up waiting, a running query stops at the next progress checkpoint that consults the session
 * flag. A result the kernel produced before it saw the flag is still returned.
 */
public class QueryCoordinator {
    private static final Logger LOG = LogManager.getLogger(QueryCoordinator.class);

    private static final String WORKER_POOL_NAME = "query-worker";

    private final QueryPlanner planner;
    private final CatalogReadinessCheck readinessCheck;
    private final ExecutionKernel kernel;
    private final SessionRegistry registry = new SessionRegistry();
    private final DispatchQueue dispatchQueue;
    private final InterruptChecker interruptChecker;
    private final AtomicLong nextQueryId = new AtomicLong(0);

    private ThreadPoolExecutor workerPool;

    public QueryCoordinator(QueryPlanner planner, CatalogReadinessCheck readinessCheck, ExecutionKernel kernel)
            throws InvalidConfException {
        this(planner, readinessCheck, kernel, Config.dispatch_queue_capacity, InterruptChecker.fromConfig());
    }

    public QueryCoordinator(QueryPlanner planner, CatalogReadinessCheck readinessCheck, ExecutionKernel kernel,
                            int dispatchCapacity, InterruptChecker interruptChecker) {
        this.planner = Preconditions.checkNotNull(planner);
        this.readinessCheck = Preconditions.checkNotNull(readinessCheck);
        this.kernel = Preconditions.checkNotNull(kernel);
        this.interruptChecker = Preconditions.checkNotNull(interruptChecker);
        this.dispatchQueue = new DispatchQueue(dispatchCapacity, this.interruptChecker);
        this.registry.addInterruptListener(dispatchQueue);
    }

    public QueryResult submit(String queryText, String sessionId) {
        return submit(queryText, sessionId, QueryEntry.ANY_EXECUTOR, ExecutorDeviceType.CPU, 0);
    }

    public QueryResult submit(String queryText, String sessionId, ExecutorDeviceType deviceType,
                              int pendingCheckFreq) {
        return submit(queryText, sessionId, QueryEntry.ANY_EXECUTOR, deviceType, pendingCheckFreq);
    }

    /**
     * Runs a query on the calling thread and blocks until it reached a final state.
     *
     * @param executorId       executor the query must run on, {@link QueryEntry#ANY_EXECUTOR} for none.
     *                         At most one query runs on an executor at a time.
     * @param pendingCheckFreq wait iterations between two pending interrupt checks, a value below 1
     *                         uses the frequency of the interrupt checker
     */
    public QueryResult submit(String queryText, String sessionId, int executorId, ExecutorDeviceType deviceType,
                              int pendingCheckFreq) {
        checkSessionId(sessionId);

        PhysicalPlan plan;
        try {
            plan = planner.plan(queryText);
        } catch (SluiceException e) {
            LOG.warn("failed to plan query of session {}: {}", sessionId, e.getMessage());
            return QueryResult.failed(-1, QueryError.of(QueryError.Kind.PLAN_ERROR, e));
        }

        QueryEntry entry = new QueryEntry(nextQueryId.incrementAndGet(), sessionId, queryText, deviceType,
                executorId);
        try {
            registry.register(sessionId, entry);
        } catch (DuplicateEntryException e) {
            LOG.warn("failed to register query {}", entry.getQueryId(), e);
            return QueryResult.failed(entry.getQueryId(), QueryError.of(QueryError.Kind.INTERNAL_ERROR, e));
        }
        LOG.debug("submit query {} of session {}: {}", entry.getQueryId(), sessionId, queryText);

        SlotLease lease = null;
        try {
            try {
                lease = dispatchQueue.acquireSlot(entry,
                        iteration -> interruptChecker.checkPendingQuery(entry, iteration, pendingCheckFreq));
            } catch (PendingQueryInterruptedException e) {
                return QueryResult.failed(entry.getQueryId(),
                        QueryError.of(QueryError.Kind.PENDING_QUERY_INTERRUPTED, e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return QueryResult.failed(entry.getQueryId(), new QueryError(QueryError.Kind.INTERNAL_ERROR,
                        ErrorCode.ERR_UNKNOWN_ERROR, "Interrupted while waiting for a dispatch slot"));
            }
            registry.onAdmitted(entry);
            return execute(entry, plan);
        } finally {
            registry.deregister(sessionId, entry);
            if (lease != null) {
                lease.release();
            }
            LOG.info("query {} of session {} finished with state {}",
                    entry.getQueryId(), sessionId, entry.getState());
        }
    }

    public CompletableFuture<QueryResult> submitAsync(String queryText, String sessionId) {
        return submitAsync(queryText, sessionId, QueryEntry.ANY_EXECUTOR, ExecutorDeviceType.CPU, 0);
    }

    public CompletableFuture<QueryResult> submitAsync(String queryText, String sessionId, int executorId,
                                                      ExecutorDeviceType deviceType, int pendingCheckFreq) {
        checkSessionId(sessionId);
        return CompletableFuture.supplyAsync(
                () -> submit(queryText, sessionId, executorId, deviceType, pendingCheckFreq), getWorkerPool());
    }

    private QueryResult execute(QueryEntry entry, PhysicalPlan plan) {
        try {
            readinessCheck.checkReady(plan);
        } catch (SluiceException e) {
            entry.finish(QueryEntryState.FAILED);
            LOG.warn("query {} is not ready to run: {}", entry.getQueryId(), e.getMessage());
            return QueryResult.failed(entry.getQueryId(), QueryError.of(QueryError.Kind.CATALOG_ERROR, e));
        }

        ProgressCheckpoint checkpoint = interruptChecker.createRunningCheckpoint(entry);
        try {
            ResultSet resultSet = kernel.execute(plan, entry.getDeviceType(), checkpoint);
            entry.finish(QueryEntryState.COMPLETED);
            return QueryResult.ok(entry.getQueryId(), resultSet);
        } catch (QueryInterruptedException e) {
            entry.finish(QueryEntryState.INTERRUPTED);
            LOG.info("running query {} of session {} is interrupted", entry.getQueryId(), entry.getSessionId());
            QueryError.Kind kind = e.isPendingQuery() ? QueryError.Kind.PENDING_QUERY_INTERRUPTED
                    : QueryError.Kind.RUNNING_QUERY_INTERRUPTED;
            return QueryResult.failed(entry.getQueryId(), QueryError.of(kind, e));
        } catch (KernelException e) {
            entry.finish(QueryEntryState.FAILED);
            LOG.warn("query {} failed in kernel: {}", entry.getQueryId(), e.getMessage());
            return QueryResult.failed(entry.getQueryId(), QueryError.of(QueryError.Kind.KERNEL_ERROR, e));
        } catch (RuntimeException e) {
            entry.finish(QueryEntryState.FAILED);
            LOG.warn("query {} failed with unexpected error", entry.getQueryId(), e);
            return QueryResult.failed(entry.getQueryId(), new QueryError(QueryError.Kind.INTERNAL_ERROR,
                    ErrorCode.ERR_UNKNOWN_ERROR, Strings.nullToEmpty(e.getMessage())));
        }
    }

    /**
     * Requests cancellation of every pending and running query of {@code targetSessionId} and
     * returns without waiting for them to stop.
     */
    public void interrupt(String targetSessionId, String callerSessionId) throws UnknownSessionException {
        LOG.info("session {} requests to interrupt session {}", callerSessionId, targetSessionId);
        registry.setInterrupt(targetSessionId);
    }

    public void resizeDispatchQueue(int capacity) {
        dispatchQueue.resize(capacity);
    }

    public void enableRuntimeInterrupt(double runningCheckFreq, int pendingCheckFreq) throws InvalidConfException {
        interruptChecker.enable(runningCheckFreq, pendingCheckFreq);
    }

    public Optional<String> currentRunningSession() {
        return registry.lookupCurrentSession();
    }

    public boolean isSessionEnrolled(String sessionId) {
        return registry.isEnrolled(sessionId);
    }

    public List<QueryEntrySummary> sessionEntries(String sessionId) {
        return registry.entriesFor(sessionId);
    }

    public SessionRegistry getSessionRegistry() {
        return registry;
    }

    public DispatchQueue getDispatchQueue() {
        return dispatchQueue;
    }

    public InterruptChecker getInterruptChecker() {
        return interruptChecker;
    }

    public synchronized void shutdown() {
        if (workerPool != null) {
            workerPool.shutdown();
            LOG.info("query coordinator is shut down");
        }
    }

    private synchronized ThreadPoolExecutor getWorkerPool() {
        if (workerPool == null) {
            workerPool = ThreadPoolManager.newDaemonFixedThreadPool(Config.query_worker_thread_num,
                    Config.query_worker_queue_size, WORKER_POOL_NAME);
        }
        return workerPool;
    }

    private static void checkSessionId(String sessionId) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(sessionId), "session id is empty");
        if (sessionId.length() != Config.session_id_length) {
            LOG.warn("length of session id {} is {}, expected {}", sessionId, sessionId.length(),
                    Config.session_id_length);
        }
    }
}

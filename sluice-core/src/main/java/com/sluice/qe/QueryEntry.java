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
import com.sluice.execution.ExecutorDeviceType;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One submitted query. The coordinator owns the lifecycle of the entry, the registry and the
 * dispatch queue only hold references to it.
 * <p>
 * Legal transitions:
 * <pre>
 *   PENDING -> RUNNING -> COMPLETED | INTERRUPTED | FAILED
 *   PENDING -> INTERRUPTED | FAILED
 * </pre>
 * Every transition is a compare-and-set, so a racing grant and interrupt resolve to exactly one
 * winner.
 */
public class QueryEntry {
    public static final int ANY_EXECUTOR = -1;

    private final long queryId;
    private final String sessionId;
    private final String queryText;
    private final ExecutorDeviceType deviceType;
    private final int executorId;
    private final long arrivalTimeMs;

    private final AtomicReference<QueryEntryState> state = new AtomicReference<>(QueryEntryState.PENDING);
    private volatile long admittedTimeMs = -1;
    private volatile long admissionSeq = -1;
    // interrupt flag of the owning session, bound on registration
    private volatile AtomicBoolean sessionInterruptFlag;

    public QueryEntry(long queryId, String sessionId, String queryText, ExecutorDeviceType deviceType,
                      int executorId) {
        Preconditions.checkArgument(executorId >= ANY_EXECUTOR, "invalid executor id: %s", executorId);
        this.queryId = queryId;
        this.sessionId = Preconditions.checkNotNull(sessionId);
        this.queryText = queryText;
        this.deviceType = Preconditions.checkNotNull(deviceType);
        this.executorId = executorId;
        this.arrivalTimeMs = System.currentTimeMillis();
    }

    public long getQueryId() {
        return queryId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getQueryText() {
        return queryText;
    }

    public ExecutorDeviceType getDeviceType() {
        return deviceType;
    }

    public int getExecutorId() {
        return executorId;
    }

    public boolean isPinnedToExecutor() {
        return executorId != ANY_EXECUTOR;
    }

    public long getArrivalTimeMs() {
        return arrivalTimeMs;
    }

    public long getAdmittedTimeMs() {
        return admittedTimeMs;
    }

    public long getAdmissionSeq() {
        return admissionSeq;
    }

    public QueryEntryState getState() {
        return state.get();
    }

    boolean transitionToRunning(long seq) {
        if (!state.compareAndSet(QueryEntryState.PENDING, QueryEntryState.RUNNING)) {
            return false;
        }
        admittedTimeMs = System.currentTimeMillis();
        admissionSeq = seq;
        return true;
    }

    boolean finish(QueryEntryState finalState) {
        Preconditions.checkArgument(finalState.isFinalState(), "%s is not a final state", finalState);
        while (true) {
            QueryEntryState current = state.get();
            if (current.isFinalState()) {
                return false;
            }
            if (finalState == QueryEntryState.COMPLETED && current != QueryEntryState.RUNNING) {
                return false;
            }
            if (state.compareAndSet(current, finalState)) {
                return true;
            }
        }
    }

    void bindSessionInterruptFlag(AtomicBoolean flag) {
        this.sessionInterruptFlag = flag;
    }

    public boolean isSessionInterrupted() {
        AtomicBoolean flag = sessionInterruptFlag;
        return flag != null && flag.get();
    }

    public QueryEntrySummary toSummary() {
        return new QueryEntrySummary(queryId, sessionId, state.get(), queryText, deviceType.name(), executorId,
                arrivalTimeMs, admittedTimeMs);
    }

    @Override
    public String toString() {
        return "QueryEntry{queryId=" + queryId + ", sessionId=" + sessionId + ", state=" + state.get() + "}";
    }
}

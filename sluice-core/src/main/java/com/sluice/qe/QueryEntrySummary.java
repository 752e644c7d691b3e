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

import com.google.gson.annotations.SerializedName;
import com.sluice.common.GsonUtils;

/**
 * Point in time view of a {@link QueryEntry}, safe to hand out to status displays.
 */
public class QueryEntrySummary {
    @SerializedName("queryId")
    private final long queryId;
    @SerializedName("sessionId")
    private final String sessionId;
    @SerializedName("state")
    private final QueryEntryState state;
    @SerializedName("query")
    private final String queryText;
    @SerializedName("deviceType")
    private final String deviceType;
    @SerializedName("executorId")
    private final int executorId;
    @SerializedName("arrivalTimeMs")
    private final long arrivalTimeMs;
    @SerializedName("admittedTimeMs")
    private final long admittedTimeMs;

    QueryEntrySummary(long queryId, String sessionId, QueryEntryState state, String queryText, String deviceType,
                      int executorId, long arrivalTimeMs, long admittedTimeMs) {
        this.queryId = queryId;
        this.sessionId = sessionId;
        this.state = state;
        this.queryText = queryText;
        this.deviceType = deviceType;
        this.executorId = executorId;
        this.arrivalTimeMs = arrivalTimeMs;
        this.admittedTimeMs = admittedTimeMs;
    }

    public long getQueryId() {
        return queryId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public QueryEntryState getState() {
        return state;
    }

    public String getQueryText() {
        return queryText;
    }

    public String getDeviceType() {
        return deviceType;
    }

    public int getExecutorId() {
        return executorId;
    }

    public long getArrivalTimeMs() {
        return arrivalTimeMs;
    }

    // -1 while the query has not been admitted
    public long getAdmittedTimeMs() {
        return admittedTimeMs;
    }

    public String toJson() {
        return GsonUtils.GSON.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }
}

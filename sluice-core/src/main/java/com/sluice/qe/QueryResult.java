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
import com.sluice.common.SluiceException;
import com.sluice.execution.ResultSet;

/**
 * Outcome of one submission: a result set or a {@link QueryError}, never both.
 */
public class QueryResult {
    private final long queryId;
    private final ResultSet resultSet;
    private final QueryError error;

    private QueryResult(long queryId, ResultSet resultSet, QueryError error) {
        Preconditions.checkArgument((resultSet != null && error == null) || (resultSet == null && error != null));
        this.queryId = queryId;
        this.resultSet = resultSet;
        this.error = error;
    }

    public static QueryResult ok(long queryId, ResultSet resultSet) {
        return new QueryResult(queryId, resultSet, null);
    }

    public static QueryResult failed(long queryId, QueryError error) {
        return new QueryResult(queryId, null, error);
    }

    public boolean isOk() {
        return error == null;
    }

    // -1 when the query failed before it was registered
    public long getQueryId() {
        return queryId;
    }

    public ResultSet getResultSet() {
        return resultSet;
    }

    public QueryError getError() {
        return error;
    }

    public ResultSet getResultSetOrThrow() throws SluiceException {
        if (error != null) {
            throw error.toException();
        }
        return resultSet;
    }

    @Override
    public String toString() {
        return isOk() ? "QueryResult{queryId=" + queryId + ", " + resultSet + "}"
                : "QueryResult{queryId=" + queryId + ", error=" + error + "}";
    }
}

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
import com.sluice.common.ErrorCode;
import com.sluice.common.PendingQueryInterruptedException;
import com.sluice.common.RunningQueryInterruptedException;
import com.sluice.common.SluiceException;
import com.sluice.execution.KernelException;

/**
 * Why a submission did not produce a result.
 */
public class QueryError {
    public enum Kind {
        PENDING_QUERY_INTERRUPTED,
        RUNNING_QUERY_INTERRUPTED,
        KERNEL_ERROR,
        PLAN_ERROR,
        CATALOG_ERROR,
        INTERNAL_ERROR;

        public boolean isInterrupt() {
            return this == PENDING_QUERY_INTERRUPTED || this == RUNNING_QUERY_INTERRUPTED;
        }
    }

    private final Kind kind;
    private final ErrorCode errorCode;
    private final String message;

    public QueryError(Kind kind, ErrorCode errorCode, String message) {
        this.kind = Preconditions.checkNotNull(kind);
        this.errorCode = Preconditions.checkNotNull(errorCode);
        this.message = Preconditions.checkNotNull(message);
    }

    public static QueryError of(Kind kind, SluiceException e) {
        return new QueryError(kind, e.getErrorCode(), e.getMessage());
    }

    public Kind getKind() {
        return kind;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }

    public boolean isInterrupt() {
        return kind.isInterrupt();
    }

    public SluiceException toException() {
        switch (kind) {
            case PENDING_QUERY_INTERRUPTED:
                return new PendingQueryInterruptedException();
            case RUNNING_QUERY_INTERRUPTED:
                return new RunningQueryInterruptedException();
            case KERNEL_ERROR:
                return new KernelException(message);
            default:
                return new SluiceException(message);
        }
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}

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

package com.sluice.common;

/**
 * Raised when a query gives up because its session was interrupted. The concrete subclass tells
 * whether the query was still waiting for a dispatch slot or already executing.
 */
public abstract class QueryInterruptedException extends SluiceException {

    protected QueryInterruptedException(ErrorCode errorCode) {
        super(errorCode);
    }

    public abstract boolean isPendingQuery();
}

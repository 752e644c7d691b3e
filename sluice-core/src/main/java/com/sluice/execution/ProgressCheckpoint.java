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

package com.sluice.execution;

import com.sluice.common.QueryInterruptedException;

/**
 * Cooperative cancellation point exposed to the kernel. The kernel calls {@link #reached} whenever
 * it finished a unit of work; the call throws when the query must stop, and the kernel is expected
 * to unwind without producing a result.
 */
@FunctionalInterface
public interface ProgressCheckpoint {
    ProgressCheckpoint NOOP = (done, total) -> {
    };

    /**
     * @param done units of work finished so far
     * @param total units of work of the whole query, or -1 if unknown
     */
    void reached(long done, long total) throws QueryInterruptedException;
}

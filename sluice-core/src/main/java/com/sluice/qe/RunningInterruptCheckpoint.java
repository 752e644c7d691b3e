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
import com.sluice.common.RunningQueryInterruptedException;
import com.sluice.execution.ProgressCheckpoint;

import java.util.concurrent.atomic.AtomicLong;

public class RunningInterruptCheckpoint implements ProgressCheckpoint {
    private final QueryEntry entry;
    private final long checkInterval;
    private final AtomicLong reachedCount = new AtomicLong(0);

    RunningInterruptCheckpoint(QueryEntry entry, long checkInterval) {
        Preconditions.checkArgument(checkInterval >= 1, "check interval must be positive: %s", checkInterval);
        this.entry = entry;
        this.checkInterval = checkInterval;
    }

    @Override
    public void reached(long done, long total) throws RunningQueryInterruptedException {
        if (reachedCount.incrementAndGet() % checkInterval != 0) {
            return;
        }
        if (entry.isSessionInterrupted()) {
            throw new RunningQueryInterruptedException();
        }
    }

    public long getCheckInterval() {
        return checkInterval;
    }

    public long getReachedCount() {
        return reachedCount.get();
    }
}

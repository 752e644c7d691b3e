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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A dispatch slot held by one running query. Releasing a lease more than once has no effect.
 */
public class SlotLease implements AutoCloseable {
    private final DispatchQueue queue;
    private final QueryEntry entry;
    private final AtomicBoolean released = new AtomicBoolean(false);

    SlotLease(DispatchQueue queue, QueryEntry entry) {
        this.queue = queue;
        this.entry = entry;
    }

    public QueryEntry getEntry() {
        return entry;
    }

    public boolean isReleased() {
        return released.get();
    }

    // returns true only for the call that actually gave the slot back
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    public void release() {
        queue.releaseSlot(this);
    }

    @Override
    public void close() {
        release();
    }
}

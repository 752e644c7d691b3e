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

import com.sluice.common.Config;
import com.sluice.common.ErrorCode;
import com.sluice.common.InvalidConfException;
import com.sluice.common.PendingQueryInterruptedException;
import com.sluice.execution.ProgressCheckpoint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Decides when a query consults the interrupt flag of its session.
 * <p>
 * A pending query checks the flag every {@code pendingFreq} wait iterations. A running query checks
 * it on every {@code ceil(1 / runningFreq)}-th progress checkpoint reported by the kernel, so a
 * running frequency of 1 checks every checkpoint. Nothing is checked until runtime interrupt has
 * been enabled.
 */
public class InterruptChecker {
    private static final Logger LOG = LogManager.getLogger(InterruptChecker.class);

    private static class CheckFrequency {
        private final double runningFreq;
        private final int pendingFreq;
        private final long runningInterval;

        private CheckFrequency(double runningFreq, int pendingFreq) {
            this.runningFreq = runningFreq;
            this.pendingFreq = pendingFreq;
            this.runningInterval = samplingInterval(runningFreq);
        }
    }

    // null while runtime interrupt is disabled
    private volatile CheckFrequency frequency;

    public static InterruptChecker fromConfig() throws InvalidConfException {
        InterruptChecker checker = new InterruptChecker();
        if (Config.enable_runtime_query_interrupt) {
            checker.enable(Config.running_query_interrupt_check_freq, Config.pending_query_interrupt_check_freq);
        }
        return checker;
    }

    public void enable(double runningFreq, int pendingFreq) throws InvalidConfException {
        if (Double.isNaN(runningFreq) || runningFreq <= 0 || runningFreq > 1 || pendingFreq < 1) {
            throw new InvalidConfException(ErrorCode.ERR_INVALID_INTERRUPT_CHECK_FREQ, runningFreq, pendingFreq);
        }
        frequency = new CheckFrequency(runningFreq, pendingFreq);
        LOG.info("enable runtime query interrupt, running check freq: {}, pending check freq: {}",
                runningFreq, pendingFreq);
    }

    public void disable() {
        frequency = null;
        LOG.info("disable runtime query interrupt");
    }

    public boolean isEnabled() {
        return frequency != null;
    }

    public double getRunningCheckFreq() {
        CheckFrequency current = frequency;
        return current == null ? Config.running_query_interrupt_check_freq : current.runningFreq;
    }

    public int getPendingCheckFreq() {
        CheckFrequency current = frequency;
        return current == null ? Config.pending_query_interrupt_check_freq : current.pendingFreq;
    }

    /**
     * @param pendingFreq per query frequency, a value below 1 uses the frequency given to {@link #enable}
     */
    public void checkPendingQuery(QueryEntry entry, long iteration, int pendingFreq)
            throws PendingQueryInterruptedException {
        CheckFrequency current = frequency;
        if (current == null) {
            return;
        }
        int freq = pendingFreq > 0 ? pendingFreq : current.pendingFreq;
        if (iteration % freq != 0) {
            return;
        }
        if (entry.isSessionInterrupted()) {
            throw new PendingQueryInterruptedException();
        }
    }

    public ProgressCheckpoint createRunningCheckpoint(QueryEntry entry) {
        CheckFrequency current = frequency;
        if (current == null) {
            return ProgressCheckpoint.NOOP;
        }
        return new RunningInterruptCheckpoint(entry, current.runningInterval);
    }

    static long samplingInterval(double runningFreq) {
        return Math.max(1L, (long) Math.ceil(1.0 / runningFreq));
    }
}

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

import com.sluice.common.ErrorCode;
import com.sluice.common.QueryInterruptedException;
import com.sluice.common.SluiceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * CPU kernel for {@link CrossJoinCountPlan}. The inner table is scanned in blocks for every row of
 * the outer table, and one progress checkpoint is reported per outer row.
 */
public class NestedLoopCountKernel implements ExecutionKernel {
    private static final Logger LOG = LogManager.getLogger(NestedLoopCountKernel.class);

    public static final String COUNT_COLUMN = "count(1)";
    static final int BLOCK_SIZE = 1024;

    private final InMemoryCatalog catalog;

    public NestedLoopCountKernel(InMemoryCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public ResultSet execute(PhysicalPlan plan, ExecutorDeviceType deviceType, ProgressCheckpoint checkpoint)
            throws KernelException, QueryInterruptedException {
        if (deviceType != ExecutorDeviceType.CPU) {
            throw new KernelException(ErrorCode.ERR_UNSUPPORTED_DEVICE_TYPE, deviceType);
        }
        if (!(plan instanceof CrossJoinCountPlan)) {
            throw new KernelException("Nested loop kernel cannot execute plan: " + plan);
        }
        CrossJoinCountPlan joinPlan = (CrossJoinCountPlan) plan;

        long outerRows;
        long innerRows;
        try {
            outerRows = catalog.getRowCount(joinPlan.getLeftTable());
            innerRows = catalog.getRowCount(joinPlan.getRightTable());
        } catch (SluiceException e) {
            throw new KernelException(e.getMessage());
        }

        long numBlocks = (innerRows + BLOCK_SIZE - 1) / BLOCK_SIZE;
        long count = 0;
        for (long outer = 0; outer < outerRows; outer++) {
            for (long block = 0; block < numBlocks; block++) {
                count += Math.min(BLOCK_SIZE, innerRows - block * BLOCK_SIZE);
            }
            checkpoint.reached(outer + 1, outerRows);
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("nested loop over {} x {} rows finished, count: {}", outerRows, innerRows, count);
        }
        return ResultSet.singleValue(COUNT_COLUMN, count);
    }
}

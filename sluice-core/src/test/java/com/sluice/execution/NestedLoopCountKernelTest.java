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
import com.sluice.common.RunningQueryInterruptedException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.Mockito.mock;

public class NestedLoopCountKernelTest {
    private InMemoryCatalog catalog;
    private NestedLoopCountKernel kernel;

    @BeforeEach
    public void setUp() throws Exception {
        catalog = new InMemoryCatalog();
        catalog.createTable("t_small");
        catalog.loadRows("t_small", 1_000);
        catalog.createTable("t_odd");
        catalog.loadRows("t_odd", NestedLoopCountKernel.BLOCK_SIZE * 3 + 7);
        catalog.createTable("t_empty");
        kernel = new NestedLoopCountKernel(catalog);
    }

    @Test
    public void testCountCrossJoin() throws Exception {
        ResultSet resultSet = kernel.execute(new CrossJoinCountPlan("t_small", "t_small"), ExecutorDeviceType.CPU,
                ProgressCheckpoint.NOOP);
        Assertions.assertEquals(1, resultSet.rowCount());
        Assertions.assertEquals(NestedLoopCountKernel.COUNT_COLUMN, resultSet.getColumnNames().get(0));
        Assertions.assertEquals(1_000_000L, resultSet.getLong(0, 0));
    }

    @Test
    public void testPartialLastBlock() throws Exception {
        ResultSet resultSet = kernel.execute(new CrossJoinCountPlan("t_small", "t_odd"), ExecutorDeviceType.CPU,
                ProgressCheckpoint.NOOP);
        Assertions.assertEquals(1_000L * (NestedLoopCountKernel.BLOCK_SIZE * 3 + 7), resultSet.getLong(0, 0));

        resultSet = kernel.execute(new CrossJoinCountPlan("t_empty", "t_small"), ExecutorDeviceType.CPU,
                ProgressCheckpoint.NOOP);
        Assertions.assertEquals(0L, resultSet.getLong(0, 0));
    }

    @Test
    public void testCheckpointPerOuterRow() throws Exception {
        AtomicLong reached = new AtomicLong();
        AtomicLong lastDone = new AtomicLong();
        kernel.execute(new CrossJoinCountPlan("t_small", "t_odd"), ExecutorDeviceType.CPU, (done, total) -> {
            reached.incrementAndGet();
            lastDone.set(done);
            Assertions.assertEquals(1_000L, total);
        });
        Assertions.assertEquals(1_000L, reached.get());
        Assertions.assertEquals(1_000L, lastDone.get());
    }

    @Test
    public void testCheckpointStopsExecution() {
        AtomicLong reached = new AtomicLong();
        RunningQueryInterruptedException e = Assertions.assertThrows(RunningQueryInterruptedException.class,
                () -> kernel.execute(new CrossJoinCountPlan("t_small", "t_small"), ExecutorDeviceType.CPU,
                        (done, total) -> {
                            if (reached.incrementAndGet() == 5) {
                                throw new RunningQueryInterruptedException();
                            }
                        }));
        Assertions.assertEquals("Query execution has been interrupted", e.getMessage());
        Assertions.assertEquals(5, reached.get());
    }

    @Test
    public void testGpuIsNotSupported() {
        KernelException e = Assertions.assertThrows(KernelException.class,
                () -> kernel.execute(new CrossJoinCountPlan("t_small", "t_small"), ExecutorDeviceType.GPU,
                        ProgressCheckpoint.NOOP));
        Assertions.assertEquals(ErrorCode.ERR_UNSUPPORTED_DEVICE_TYPE, e.getErrorCode());
        Assertions.assertEquals("Execution on device type GPU is not supported", e.getMessage());
    }

    @Test
    public void testUnknownPlanAndTable() {
        Assertions.assertThrows(KernelException.class,
                () -> kernel.execute(mock(PhysicalPlan.class), ExecutorDeviceType.CPU, ProgressCheckpoint.NOOP));
        KernelException e = Assertions.assertThrows(KernelException.class,
                () -> kernel.execute(new CrossJoinCountPlan("t_small", "t_missing"), ExecutorDeviceType.CPU,
                        ProgressCheckpoint.NOOP));
        Assertions.assertEquals("Unknown table 't_missing'", e.getMessage());
    }
}

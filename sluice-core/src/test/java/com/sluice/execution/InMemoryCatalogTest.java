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

import com.google.common.collect.ImmutableSet;
import com.sluice.common.ErrorCode;
import com.sluice.common.SluiceException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class InMemoryCatalogTest {
    private InMemoryCatalog catalog;

    @BeforeEach
    public void setUp() throws Exception {
        catalog = new InMemoryCatalog();
        catalog.createTable("t_small");
    }

    @Test
    public void testCreateAndLoad() throws Exception {
        Assertions.assertEquals(0, catalog.getRowCount("t_small"));
        Assertions.assertEquals(600, catalog.loadRows("t_small", 600));
        Assertions.assertEquals(1000, catalog.loadRows("T_SMALL", 400));
        Assertions.assertEquals(1000, catalog.getRowCount("t_small"));
        Assertions.assertEquals(ImmutableSet.of("t_small"), catalog.getTableNames());
    }

    @Test
    public void testCreateExistingTable() {
        SluiceException e = Assertions.assertThrows(SluiceException.class, () -> catalog.createTable("T_Small"));
        Assertions.assertEquals(ErrorCode.ERR_TABLE_EXISTS_ERROR, e.getErrorCode());
        Assertions.assertEquals("Table 't_small' already exists", e.getMessage());
    }

    @Test
    public void testDropTable() throws Exception {
        catalog.dropTable("t_small", false);
        Assertions.assertFalse(catalog.containsTable("t_small"));
        catalog.dropTable("t_small", true);
        Assertions.assertThrows(SluiceException.class, () -> catalog.dropTable("t_small", false));
        Assertions.assertThrows(SluiceException.class, () -> catalog.loadRows("t_small", 1));
    }

    @Test
    public void testCheckReady() throws Exception {
        catalog.checkReady(new CrossJoinCountPlan("t_small", "t_small"));
        SluiceException e = Assertions.assertThrows(SluiceException.class,
                () -> catalog.checkReady(new CrossJoinCountPlan("t_small", "t_missing")));
        Assertions.assertEquals("Unknown table 't_missing'", e.getMessage());
    }

    @Test
    public void testRejectNegativeRowCount() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> catalog.loadRows("t_small", -1));
    }
}

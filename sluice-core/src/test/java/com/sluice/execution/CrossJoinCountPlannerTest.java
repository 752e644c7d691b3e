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

import com.google.common.collect.ImmutableList;
import com.sluice.common.ErrorCode;
import com.sluice.common.SluiceException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class CrossJoinCountPlannerTest {
    private final CrossJoinCountPlanner planner = new CrossJoinCountPlanner();

    private CrossJoinCountPlan plan(String sql) throws SluiceException {
        return (CrossJoinCountPlan) planner.plan(sql);
    }

    @Test
    public void testPlanCrossJoinCount() throws Exception {
        CrossJoinCountPlan plan = plan("SELECT count(1) FROM t_large t1, t_medium t2;");
        Assertions.assertEquals("t_large", plan.getLeftTable());
        Assertions.assertEquals("t_medium", plan.getRightTable());
        Assertions.assertEquals(ImmutableList.of("t_large", "t_medium"), plan.getTableNames());
    }

    @Test
    public void testOptionalAliasAndSemicolon() throws Exception {
        Assertions.assertEquals("b", plan("select COUNT(*) from a, b").getRightTable());
        Assertions.assertEquals("a", plan("  SELECT count( 1 ) FROM a AS x , b AS y ;  ").getLeftTable());
    }

    @Test
    public void testUnsupportedQuery() {
        SluiceException e = Assertions.assertThrows(SluiceException.class,
                () -> planner.plan("SELECT * FROM t_small"));
        Assertions.assertEquals(ErrorCode.ERR_UNSUPPORTED_QUERY, e.getErrorCode());
        Assertions.assertEquals("Unsupported query: SELECT * FROM t_small", e.getMessage());
        Assertions.assertThrows(SluiceException.class, () -> planner.plan(null));
    }
}

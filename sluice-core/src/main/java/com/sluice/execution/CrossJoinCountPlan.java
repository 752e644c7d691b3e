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

import java.util.List;

/**
 * count(1) over the cartesian product of two tables.
 */
public class CrossJoinCountPlan implements PhysicalPlan {
    private final String leftTable;
    private final String rightTable;

    public CrossJoinCountPlan(String leftTable, String rightTable) {
        this.leftTable = leftTable;
        this.rightTable = rightTable;
    }

    public String getLeftTable() {
        return leftTable;
    }

    public String getRightTable() {
        return rightTable;
    }

    @Override
    public List<String> getTableNames() {
        return ImmutableList.of(leftTable, rightTable);
    }

    @Override
    public String explain() {
        return "AGGREGATE count(1)\n  NESTED LOOP JOIN\n    SCAN " + leftTable + "\n    SCAN " + rightTable;
    }

    @Override
    public String toString() {
        return "CrossJoinCountPlan{" + leftTable + " x " + rightTable + "}";
    }
}

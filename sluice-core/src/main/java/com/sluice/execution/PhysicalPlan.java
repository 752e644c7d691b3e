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

import java.util.List;

/**
 * Physical plan handed to the execution kernel. The dispatch core never looks inside a plan, it
 * only passes it from the planner to the catalog check and the kernel.
 */
public interface PhysicalPlan {

    /**
     * Tables the plan reads, in the order they appear in the query.
     */
    List<String> getTableNames();

    String explain();
}

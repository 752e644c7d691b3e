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
import com.sluice.common.SluiceException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Planner for the single query shape the nested loop kernel runs:
 * {@code SELECT count(1) FROM a t1, b t2;}. Table aliases are optional, the trailing semicolon too.
 */
public class CrossJoinCountPlanner implements QueryPlanner {
    private static final Pattern CROSS_JOIN_COUNT = Pattern.compile(
            "^\\s*SELECT\\s+count\\(\\s*(?:1|\\*)\\s*\\)\\s+FROM\\s+(\\w+)(?:\\s+(?:AS\\s+)?\\w+)?\\s*,"
                    + "\\s*(\\w+)(?:\\s+(?:AS\\s+)?\\w+)?\\s*;?\\s*$",
            Pattern.CASE_INSENSITIVE);

    @Override
    public PhysicalPlan plan(String queryText) throws SluiceException {
        if (queryText == null) {
            throw new SluiceException(ErrorCode.ERR_UNSUPPORTED_QUERY, "null");
        }
        Matcher m = CROSS_JOIN_COUNT.matcher(queryText);
        if (!m.matches()) {
            throw new SluiceException(ErrorCode.ERR_UNSUPPORTED_QUERY, queryText.trim());
        }
        return new CrossJoinCountPlan(m.group(1), m.group(2));
    }
}

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

package com.sluice.common;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

public class CommandLineOptions {
    public static final int ABSENT_CAPACITY = -1;

    private final boolean isHelp;
    private final String confFile;
    private final List<String> queries;
    private final String sessionId;
    private final int capacity;
    private final Map<String, Long> tables;
    private final boolean verbose;

    public CommandLineOptions(boolean isHelp, String confFile, List<String> queries, String sessionId, int capacity,
                              Map<String, Long> tables, boolean verbose) {
        this.isHelp = isHelp;
        this.confFile = confFile;
        this.queries = ImmutableList.copyOf(queries);
        this.sessionId = sessionId;
        this.capacity = capacity;
        this.tables = ImmutableMap.copyOf(tables);
        this.verbose = verbose;
    }

    public boolean isHelp() {
        return isHelp;
    }

    public String getConfFile() {
        return confFile;
    }

    public List<String> getQueries() {
        return queries;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean hasCapacity() {
        return capacity != ABSENT_CAPACITY;
    }

    // table name -> row count, in command line order
    public Map<String, Long> getTables() {
        return tables;
    }

    public boolean isVerbose() {
        return verbose;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("conf file: ").append(confFile).append("\n");
        sb.append("queries: ").append(queries).append("\n");
        sb.append("session id: ").append(sessionId).append("\n");
        sb.append("dispatch capacity: ").append(capacity).append("\n");
        sb.append("tables: ").append(tables).append("\n");
        sb.append("verbose: ").append(verbose).append("\n");
        return sb.toString();
    }
}

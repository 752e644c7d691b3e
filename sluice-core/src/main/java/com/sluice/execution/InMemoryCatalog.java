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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;
import com.sluice.common.ErrorCode;
import com.sluice.common.SluiceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;

/**
 * Catalog of single column tables that only keeps the row count of each table. Table names are
 * case insensitive.
 */
public class InMemoryCatalog implements CatalogReadinessCheck {
    private static final Logger LOG = LogManager.getLogger(InMemoryCatalog.class);

    private final ConcurrentMap<String, Long> tableRowCounts = Maps.newConcurrentMap();

    public void createTable(String tableName) throws SluiceException {
        String name = normalize(tableName);
        if (tableRowCounts.putIfAbsent(name, 0L) != null) {
            throw new SluiceException(ErrorCode.ERR_TABLE_EXISTS_ERROR, name);
        }
        LOG.info("create table {}", name);
    }

    public void dropTable(String tableName, boolean ifExists) throws SluiceException {
        String name = normalize(tableName);
        if (tableRowCounts.remove(name) == null && !ifExists) {
            throw new SluiceException(ErrorCode.ERR_BAD_TABLE_ERROR, name);
        }
        LOG.info("drop table {}", name);
    }

    /**
     * Appends rows to an existing table and returns its new row count.
     */
    public long loadRows(String tableName, long numRows) throws SluiceException {
        Preconditions.checkArgument(numRows >= 0, "numRows must not be negative: %s", numRows);
        String name = normalize(tableName);
        Long newCount = tableRowCounts.computeIfPresent(name, (k, count) -> count + numRows);
        if (newCount == null) {
            throw new SluiceException(ErrorCode.ERR_BAD_TABLE_ERROR, name);
        }
        LOG.info("loaded {} rows into table {}, row count: {}", numRows, name, newCount);
        return newCount;
    }

    public long getRowCount(String tableName) throws SluiceException {
        String name = normalize(tableName);
        Long count = tableRowCounts.get(name);
        if (count == null) {
            throw new SluiceException(ErrorCode.ERR_BAD_TABLE_ERROR, name);
        }
        return count;
    }

    public boolean containsTable(String tableName) {
        return tableRowCounts.containsKey(normalize(tableName));
    }

    public Set<String> getTableNames() {
        return ImmutableSortedSet.copyOf(tableRowCounts.keySet());
    }

    @Override
    public void checkReady(PhysicalPlan plan) throws SluiceException {
        for (String tableName : plan.getTableNames()) {
            if (!containsTable(tableName)) {
                throw new SluiceException(ErrorCode.ERR_BAD_TABLE_ERROR, normalize(tableName));
            }
        }
    }

    private static String normalize(String tableName) {
        Preconditions.checkArgument(tableName != null && !tableName.isEmpty(), "table name is empty");
        return tableName.toLowerCase(Locale.ROOT);
    }
}

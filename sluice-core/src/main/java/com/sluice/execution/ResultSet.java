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
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Materialized, immutable result of a query.
 */
public class ResultSet {
    private final List<String> columnNames;
    private final List<List<Object>> rows;

    public ResultSet(List<String> columnNames, List<List<Object>> rows) {
        for (List<Object> row : rows) {
            Preconditions.checkArgument(row.size() == columnNames.size(),
                    "row has %s values but the result has %s columns", row.size(), columnNames.size());
        }
        this.columnNames = ImmutableList.copyOf(columnNames);
        ImmutableList.Builder<List<Object>> builder = ImmutableList.builder();
        for (List<Object> row : rows) {
            builder.add(ImmutableList.copyOf(row));
        }
        this.rows = builder.build();
    }

    public static ResultSet singleValue(String columnName, Object value) {
        return new ResultSet(ImmutableList.of(columnName), ImmutableList.of(ImmutableList.of(value)));
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public int getColumnCount() {
        return columnNames.size();
    }

    public long rowCount() {
        return rows.size();
    }

    public List<Object> getRow(int rowIndex) {
        return rows.get(rowIndex);
    }

    public Object getValue(int rowIndex, int columnIndex) {
        return rows.get(rowIndex).get(columnIndex);
    }

    public long getLong(int rowIndex, int columnIndex) {
        Object value = getValue(rowIndex, columnIndex);
        Preconditions.checkState(value instanceof Number, "value at (%s, %s) is not numeric: %s",
                rowIndex, columnIndex, value);
        return ((Number) value).longValue();
    }

    @Override
    public String toString() {
        return "ResultSet{columns=" + columnNames + ", rowCount=" + rows.size() + "}";
    }
}

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

import java.util.MissingFormatArgumentException;

/**
 * 1、ErrorCode: The most granular error message, recording the error cause at the bottom of the call stack
 * <p>
 * 2、SqlState: Coarse-grained error information is also recorded in ErrorCode
 * Main references: <a href="https://www.postgresql.org/docs/15/errcodes-appendix.html">...</a>
 * <p>
 * The interrupt messages are matched literally by clients, do not change them.
 */
public enum ErrorCode {
    ERR_TABLE_EXISTS_ERROR(1050, new byte[] {'4', '2', 'S', '0', '1'}, "Table '%s' already exists"),
    ERR_BAD_TABLE_ERROR(1051, new byte[] {'4', '2', 'S', '0', '2'}, "Unknown table '%s'"),
    ERR_UNKNOWN_ERROR(1105, new byte[] {'H', 'Y', '0', '0', '0'}, "Unknown error"),
    ERR_RUNNING_QUERY_INTERRUPTED(1317, new byte[] {'7', '0', '1', '0', '0'},
            "Query execution has been interrupted"),
    ERR_PENDING_QUERY_INTERRUPTED(1317, new byte[] {'7', '0', '1', '0', '0'},
            "Query execution has been interrupted (pending query)"),

    /**
     * 5000 - 5100: Session and dispatch
     */
    ERR_UNKNOWN_SESSION(5001, new byte[] {'4', '2', '0', '0', '0'},
            "Session '%s' has no pending or running query to interrupt"),
    ERR_DUPLICATE_QUERY_ENTRY(5002, new byte[] {'X', 'X', '0', '0', '0'},
            "Query %d is already registered under session '%s'"),
    ERR_INVALID_DISPATCH_CAPACITY(5003, new byte[] {'2', '2', '0', '2', '3'},
            "Dispatch queue capacity must be positive, but got %d"),
    ERR_INVALID_INTERRUPT_CHECK_FREQ(5004, new byte[] {'2', '2', '0', '2', '3'},
            "Invalid interrupt check frequency: running=%s, pending=%s"),

    /**
     * 5100 - 5200: Planning and execution
     */
    ERR_UNSUPPORTED_QUERY(5100, new byte[] {'4', '2', '6', '0', '1'}, "Unsupported query: %s"),
    ERR_UNSUPPORTED_DEVICE_TYPE(5101, new byte[] {'0', 'A', '0', '0', '0'},
            "Execution on device type %s is not supported"),
    ERR_KERNEL_ERROR(5102, new byte[] {'X', 'X', '0', '0', '0'}, "%s"),

    /**
     * 5200 - 5300: Config
     */
    ERROR_CONFIG_NOT_EXIST(5200, new byte[] {'4', '2', '0', '0', '0'}, "Config '%s' does not exist or is not mutable"),
    ;

    ErrorCode(int code, byte[] sqlState, String errorMsg) {
        this.code = code;
        this.sqlState = sqlState;
        this.errorMsg = errorMsg;
    }

    // This is error code
    private final int code;
    // This sql state is compatible with ANSI SQL
    private final byte[] sqlState;
    // Error message format
    private final String errorMsg;

    public int getCode() {
        return code;
    }

    public byte[] getSqlState() {
        return sqlState;
    }

    public String formatErrorMsg(Object... args) {
        try {
            return String.format(errorMsg, args);
        } catch (MissingFormatArgumentException e) {
            return errorMsg;
        }
    }
}

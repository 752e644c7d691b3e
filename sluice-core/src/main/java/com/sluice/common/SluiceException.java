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

import com.google.common.base.Strings;

/**
 * SluiceException is the base class of internal exceptions.
 * <p>
 * An exception built from an {@link ErrorCode} keeps the code, so that callers can tell the cause
 * apart without parsing the message. Exceptions built from a bare message report
 * {@link ErrorCode#ERR_UNKNOWN_ERROR}.
 */
public class SluiceException extends Exception {
    private final ErrorCode errorCode;

    public SluiceException(ErrorCode errorCode, Object... objs) {
        super(errorCode.formatErrorMsg(objs));
        this.errorCode = errorCode;
    }

    public SluiceException(String msg, Throwable cause) {
        super(Strings.nullToEmpty(msg), cause);
        this.errorCode = ErrorCode.ERR_UNKNOWN_ERROR;
    }

    public SluiceException(String msg) {
        super(Strings.nullToEmpty(msg));
        this.errorCode = ErrorCode.ERR_UNKNOWN_ERROR;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}

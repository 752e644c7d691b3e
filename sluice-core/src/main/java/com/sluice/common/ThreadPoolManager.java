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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Factory of the daemon thread pools used inside the process. All pools are named so that their
 * threads can be told apart in a thread dump.
 */
public class ThreadPoolManager {
    private static final Logger LOG = LogManager.getLogger(ThreadPoolManager.class);

    private static final long KEEP_ALIVE_TIME = 60L;

    public static ThreadPoolExecutor newDaemonFixedThreadPool(int numThread, int queueSize, String poolName) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(numThread, numThread, KEEP_ALIVE_TIME, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueSize), namedThreadFactory(poolName),
                new ThreadPoolExecutor.AbortPolicy());
        // idle core threads are allowed to exit, the pool is mostly idle between bursts of submissions
        executor.allowCoreThreadTimeOut(true);
        LOG.info("create thread pool {}, threads: {}, queue size: {}", poolName, numThread, queueSize);
        return executor;
    }

    private static ThreadFactory namedThreadFactory(String poolName) {
        return new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat(poolName + "-%d")
                .setUncaughtExceptionHandler((t, e) -> LOG.warn("uncaught exception in thread {}", t.getName(), e))
                .build();
    }
}

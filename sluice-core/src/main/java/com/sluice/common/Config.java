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

import com.sluice.SluiceMain;

public class Config extends ConfigBase {

    /**
     * The max size of one sys log
     */
    @ConfField
    public static int log_roll_size_mb = 1024; // 1 GB

    /**
     * sys_log_dir:
     * This specifies the log dir. Two kinds of log files are produced:
     * sluice.log:      all logs of the process.
     * sluice.warn.log  all WARNING and ERROR logs of the process.
     * <p>
     * sys_log_level:
     * INFO, WARN, ERROR, FATAL, DEBUG
     * <p>
     * sys_log_roll_num:
     * Maximal log files to be kept within a sys_log_roll_interval.
     * <p>
     * sys_log_verbose_modules:
     * Verbose modules. VERBOSE level is implemented by log4j DEBUG level.
     * eg:
     * sys_log_verbose_modules = com.sluice.qe
     * <p>
     * sys_log_roll_interval:
     * DAY:  log suffix is yyyyMMdd
     * HOUR: log suffix is yyyyMMddHH
     * <p>
     * sys_log_delete_age:
     * default is 7 days, if log's last modify time is 7 days ago, it will be deleted.
     * support format: 7d, 10h, 60m, 120s
     */
    @ConfField
    public static String sys_log_dir = SluiceMain.SLUICE_HOME_DIR + "/log";
    @ConfField
    public static String sys_log_level = "INFO";
    @ConfField
    public static int sys_log_roll_num = 10;
    @ConfField
    public static String[] sys_log_verbose_modules = {};
    @ConfField
    public static String sys_log_roll_interval = "DAY";
    @ConfField
    public static String sys_log_delete_age = "7d";
    /**
     * Log to file by default. set to `true` if you want to log to console
     */
    @ConfField
    public static boolean sys_log_to_console = false;

    /**
     * Number of queries that may execute at the same time. Queries beyond it wait in the dispatch
     * queue in arrival order. Can be changed at runtime through QueryCoordinator#resizeDispatchQueue.
     */
    @ConfField
    public static int dispatch_queue_capacity = 1;

    /**
     * Upper bound of one wait iteration of a pending query, in milliseconds. A pending query is
     * woken up earlier when a slot is released or its session is interrupted.
     */
    @ConfField(mutable = true)
    public static long dispatch_queue_wait_interval_ms = 10;

    /**
     * Whether pending and running queries observe session interrupts. When disabled an interrupt
     * request is recorded but no query checks it.
     */
    @ConfField
    public static boolean enable_runtime_query_interrupt = false;

    /**
     * A pending query checks the interrupt flag of its session once every this many wait iterations.
     */
    @ConfField
    public static int pending_query_interrupt_check_freq = 10;

    /**
     * Sampling rate of the interrupt check of a running query, in (0, 1].
     * The flag is checked on every ceil(1 / freq)-th progress checkpoint reported by the kernel,
     * so 1.0 checks on every checkpoint and 0.1 on every 10th.
     */
    @ConfField
    public static double running_query_interrupt_check_freq = 0.9;

    /**
     * Number of threads serving asynchronous query submissions.
     */
    @ConfField
    public static int query_worker_thread_num = 64;

    @ConfField
    public static int query_worker_queue_size = 1024;

    /**
     * Expected length of a session id. Ids of a different length are accepted with a warning.
     */
    @ConfField(mutable = true)
    public static int session_id_length = 32;
}

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

package com.sluice;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.gson.JsonObject;
import com.sluice.common.CommandLineOptions;
import com.sluice.common.Config;
import com.sluice.common.GsonUtils;
import com.sluice.common.Log4jConfig;
import com.sluice.common.SluiceException;
import com.sluice.execution.CrossJoinCountPlanner;
import com.sluice.execution.InMemoryCatalog;
import com.sluice.execution.NestedLoopCountKernel;
import com.sluice.qe.InterruptChecker;
import com.sluice.qe.QueryCoordinator;
import com.sluice.qe.QueryResult;
import com.sluice.qe.SessionIds;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a batch of queries of one session against an in-memory catalog.
 * <pre>
 *   sluice -t t_small=1000 -t t_large=1000000 -n 2 \
 *       -q "SELECT count(1) FROM t_small t1, t_large t2;" -q "SELECT count(1) FROM t_small t1, t_small t2;"
 * </pre>
 * Without {@code -t} the catalog holds t_small, t_medium and t_large with 1k, 100k and 1M rows.
 */
public class SluiceMain {
    private static final Logger LOG = LogManager.getLogger(SluiceMain.class);

    public static final String SLUICE_HOME_DIR = System.getenv("SLUICE_HOME");

    @VisibleForTesting
    static final Map<String, Long> DEFAULT_TABLES = ImmutableMap.of(
            "t_small", 1_000L,
            "t_medium", 100_000L,
            "t_large", 1_000_000L);

    public static void main(String[] args) {
        CommandLineOptions cmdLineOpts;
        try {
            cmdLineOpts = parseArgs(args);
        } catch (ParseException e) {
            System.err.println("Failed to parse command line: " + e.getMessage());
            printHelp();
            System.exit(-1);
            return;
        }
        if (cmdLineOpts.isHelp()) {
            printHelp();
            System.exit(0);
        }

        int exitCode;
        try {
            String confFile = cmdLineOpts.getConfFile() != null ? cmdLineOpts.getConfFile()
                    : SLUICE_HOME_DIR + "/conf/sluice.conf";
            if (new File(confFile).exists()) {
                new Config().init(confFile);
            }
            Log4jConfig.initLogging();
            if (cmdLineOpts.isVerbose()) {
                Log4jConfig.updateLogging("DEBUG", null);
            }
            LOG.info("sluice starts with options:\n{}", cmdLineOpts);
            exitCode = run(cmdLineOpts, System.out);
        } catch (Throwable e) {
            LOG.error("sluice failed", e);
            exitCode = -1;
        }
        System.exit(exitCode);
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption("h", "help", false, "Print this help");
        options.addOption("c", "conf", true, "Specify the config file, default is $SLUICE_HOME/conf/sluice.conf");
        options.addOption("q", "query", true, "Query to run, can be given more than once");
        options.addOption("s", "session", true, "Session id of the queries, generated when absent");
        options.addOption("n", "capacity", true, "Number of queries allowed to run at the same time");
        options.addOption("t", "table", true, "Table of the catalog as name=rows, can be given more than once");
        options.addOption("v", "verbose", false, "Log at DEBUG level");
        return options;
    }

    private static void printHelp() {
        new HelpFormatter().printHelp("sluice", buildOptions());
    }

    @VisibleForTesting
    static CommandLineOptions parseArgs(String[] args) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(buildOptions(), args);

        int capacity = CommandLineOptions.ABSENT_CAPACITY;
        if (cmd.hasOption("capacity")) {
            try {
                capacity = Integer.parseInt(cmd.getOptionValue("capacity"));
            } catch (NumberFormatException e) {
                throw new ParseException("capacity is not a number: " + cmd.getOptionValue("capacity"));
            }
            if (capacity < 1) {
                throw new ParseException("capacity must be positive: " + capacity);
            }
        }

        Map<String, Long> tables = Maps.newLinkedHashMap();
        String[] tableSpecs = cmd.getOptionValues("table");
        if (tableSpecs != null) {
            for (String tableSpec : tableSpecs) {
                List<String> parts = Splitter.on('=').trimResults().splitToList(tableSpec);
                if (parts.size() != 2 || parts.get(0).isEmpty()) {
                    throw new ParseException("table must be given as name=rows: " + tableSpec);
                }
                try {
                    tables.put(parts.get(0), Long.parseLong(parts.get(1)));
                } catch (NumberFormatException e) {
                    throw new ParseException("row count of table " + parts.get(0) + " is not a number: "
                            + parts.get(1));
                }
            }
        }

        String[] queries = cmd.getOptionValues("query");
        return new CommandLineOptions(cmd.hasOption("help"), cmd.getOptionValue("conf"),
                queries == null ? Lists.newArrayList() : Lists.newArrayList(queries),
                cmd.getOptionValue("session"), capacity, tables, cmd.hasOption("verbose"));
    }

    /**
     * Submits all queries at once, prints one json line per query in submission order and returns
     * the number of failed queries.
     */
    @VisibleForTesting
    static int run(CommandLineOptions opts, PrintStream out) throws SluiceException {
        InMemoryCatalog catalog = new InMemoryCatalog();
        Map<String, Long> tables = opts.getTables().isEmpty() ? DEFAULT_TABLES : opts.getTables();
        for (Map.Entry<String, Long> table : tables.entrySet()) {
            catalog.createTable(table.getKey());
            catalog.loadRows(table.getKey(), table.getValue());
        }

        int capacity = opts.hasCapacity() ? opts.getCapacity() : Config.dispatch_queue_capacity;
        QueryCoordinator coordinator = new QueryCoordinator(new CrossJoinCountPlanner(), catalog,
                new NestedLoopCountKernel(catalog), capacity, InterruptChecker.fromConfig());
        String sessionId = opts.getSessionId() != null ? opts.getSessionId() : SessionIds.generate();

        int failures = 0;
        try {
            List<CompletableFuture<QueryResult>> futures = Lists.newArrayList();
            for (String query : opts.getQueries()) {
                futures.add(coordinator.submitAsync(query, sessionId));
            }
            for (int i = 0; i < futures.size(); i++) {
                QueryResult result = futures.get(i).join();
                JsonObject line = new JsonObject();
                line.addProperty("session", sessionId);
                line.addProperty("query", opts.getQueries().get(i));
                if (result.isOk()) {
                    line.addProperty("count", result.getResultSet().getLong(0, 0));
                } else {
                    line.addProperty("error", result.getError().getMessage());
                    line.addProperty("errorKind", result.getError().getKind().name());
                    failures++;
                }
                out.println(GsonUtils.GSON.toJson(line));
            }
        } finally {
            coordinator.shutdown();
        }
        return failures;
    }
}

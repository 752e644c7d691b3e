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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.Configurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

public class Log4jConfigTest {
    private static final String LOG_DIR = System.getProperty("java.io.tmpdir") + "/sluice-log-test";

    private String sysLogLevel;
    private String sysLogDir;
    private String[] verboseModules;
    private boolean logToConsole;
    private String rollInterval;

    @BeforeEach
    public void setUp() {
        sysLogLevel = Config.sys_log_level;
        sysLogDir = Config.sys_log_dir;
        verboseModules = Config.sys_log_verbose_modules;
        logToConsole = Config.sys_log_to_console;
        rollInterval = Config.sys_log_roll_interval;
        Config.sys_log_dir = LOG_DIR;
    }

    @AfterEach
    public void tearDown() {
        Config.sys_log_level = sysLogLevel;
        Config.sys_log_dir = sysLogDir;
        Config.sys_log_verbose_modules = verboseModules;
        Config.sys_log_to_console = logToConsole;
        Config.sys_log_roll_interval = rollInterval;
        // back to log4j2-test.xml
        Configurator.reconfigure();
    }

    private static Configuration activeConfiguration() {
        LoggerContext context = (LoggerContext) LogManager.getContext(LogManager.class.getClassLoader(), false);
        return context.getConfiguration();
    }

    @Test
    public void testInitLoggingToConsole() throws Exception {
        Config.sys_log_to_console = true;
        Config.sys_log_level = "WARN";
        Config.sys_log_verbose_modules = new String[] {"com.sluice.qe"};

        Log4jConfig.initLogging();

        Configuration configuration = activeConfiguration();
        Assertions.assertTrue(configuration instanceof Log4jConfig);
        Assertions.assertEquals(Level.WARN, configuration.getRootLogger().getLevel());
        Assertions.assertEquals(Level.DEBUG, configuration.getLoggerConfig("com.sluice.qe").getLevel());
        Assertions.assertNotNull(configuration.getAppender("ConsoleErr"));
        Assertions.assertNull(configuration.getAppender("Sys"));
        Assertions.assertNull(configuration.getAppender("SysWF"));

        Log4jConfig.updateLogging("INFO", new String[0]);
        configuration = activeConfiguration();
        Assertions.assertEquals(Level.INFO, configuration.getRootLogger().getLevel());
        Assertions.assertEquals(Level.INFO, configuration.getLoggerConfig("com.sluice.qe").getLevel());
    }

    @Test
    public void testFileLoggerTemplate() throws Exception {
        Config.sys_log_to_console = true;
        Config.sys_log_level = "INFO";
        Config.sys_log_verbose_modules = new String[] {"com.sluice.execution"};
        Log4jConfig.initLogging();

        Config.sys_log_to_console = false;
        Config.sys_log_roll_interval = "HOUR";
        String xml = Log4jConfig.generateActiveLog4jXmlConfig();

        Assertions.assertTrue(xml.contains("fileName=\"" + LOG_DIR + "/sluice.log\""), xml);
        Assertions.assertTrue(xml.contains("fileName=\"" + LOG_DIR + "/sluice.warn.log\""), xml);
        Assertions.assertTrue(xml.contains("sluice.log.%d{yyyyMMddHH}-%i"), xml);
        Assertions.assertTrue(xml.contains("<AppenderRef ref=\"SysWF\" level=\"WARN\"/>"), xml);
        Assertions.assertTrue(xml.contains("<Logger name='com.sluice.execution' level='DEBUG'/>"), xml);
        Assertions.assertTrue(xml.contains("<IfFileName glob=\"sluice.warn.log.*\" />"), xml);
        Assertions.assertFalse(xml.contains("ConsoleErr"), xml);
    }

    @Test
    public void testInvalidConfig() {
        Config.sys_log_to_console = true;
        Config.sys_log_level = "TRACE";
        IOException e = Assertions.assertThrows(IOException.class, Log4jConfig::initLogging);
        Assertions.assertEquals("sys_log_level config error", e.getMessage());

        Config.sys_log_level = "INFO";
        Config.sys_log_roll_interval = "WEEK";
        e = Assertions.assertThrows(IOException.class, Log4jConfig::initLogging);
        Assertions.assertEquals("sys_log_roll_interval config error: WEEK", e.getMessage());
    }
}

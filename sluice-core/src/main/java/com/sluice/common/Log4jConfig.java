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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.ConfigurationSource;
import org.apache.logging.log4j.core.config.xml.XmlConfiguration;
import org.apache.logging.log4j.core.lookup.Interpolator;
import org.apache.logging.log4j.core.lookup.StrSubstitutor;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

/**
 * Builds the log4j configuration from {@link Config} at startup.
 * <p>
 * Logs go either to stderr, so that they never mix with the query results printed on stdout, or to
 * {@code sluice.log} plus {@code sluice.warn.log} under {@link Config#sys_log_dir}.
 */
public class Log4jConfig extends XmlConfiguration {
    private static final Set<String> LOG_LEVELS = ImmutableSet.of("FATAL", "ERROR", "WARN", "INFO", "DEBUG");

    private static final String LAYOUT_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSSXXX} %p (%t|%tid) [%C{1}.%M():%L] %m%n";
    private static final String VERBOSE_LOGGERS = "<!--VERBOSE LOGGERS-->";

    // name, file name, layout key
    private static final String ROLLING_FILE_TEMPLATE =
            "    <RollingFile name=\"%1$s\" fileName=\"${sys_log_dir}/%2$s\"" +
            " filePattern=\"${sys_log_dir}/%2$s.${sys_file_pattern}-%%i\">\n" +
            "      ${%3$s}\n" +
            "      <Policies>\n" +
            "        <TimeBasedTriggeringPolicy/>\n" +
            "        <SizeBasedTriggeringPolicy size=\"${sys_roll_maxsize}MB\"/>\n" +
            "      </Policies>\n" +
            "      <DefaultRolloverStrategy max=\"${sys_roll_num}\" fileIndex=\"min\">\n" +
            "        <Delete basePath=\"${sys_log_dir}/\" maxDepth=\"1\" followLinks=\"true\">\n" +
            "          <IfFileName glob=\"%2$s.*\" />\n" +
            "          <IfLastModified age=\"${sys_log_delete_age}\" />\n" +
            "        </Delete>\n" +
            "      </DefaultRolloverStrategy>\n" +
            "    </RollingFile>\n";

    private static StrSubstitutor strSub;
    private static String sysLogLevel;
    private static String[] verboseModules;

    @VisibleForTesting
    static String generateActiveLog4jXmlConfig() throws IOException {
        if (!LOG_LEVELS.contains(StringUtils.upperCase(sysLogLevel))) {
            throw new IOException("sys_log_level config error");
        }
        Map<String, String> properties = Maps.newHashMap();
        properties.put("sys_log_dir", Config.sys_log_dir);
        properties.put("sys_roll_maxsize", String.valueOf(Config.log_roll_size_mb));
        properties.put("sys_roll_num", String.valueOf(Config.sys_log_roll_num));
        properties.put("sys_log_delete_age", Config.sys_log_delete_age);
        properties.put("sys_log_level", StringUtils.upperCase(sysLogLevel));
        properties.put("sys_file_pattern", getIntervalPattern("sys_log_roll_interval", Config.sys_log_roll_interval));
        properties.put("default_layout", "<PatternLayout charset=\"UTF-8\" pattern=\"" + LAYOUT_PATTERN + "\"/>");
        // the warn log keeps the stack trace of every logged exception
        properties.put("warning_layout", "<PatternLayout charset=\"UTF-8\" pattern=\"" + LAYOUT_PATTERN + " %ex\"/>");

        strSub = new StrSubstitutor(new Interpolator(properties));
        return strSub.replace(generateXmlConfTemplate());
    }

    private static String generateXmlConfTemplate() {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"utf-8\"?>\n");
        sb.append("<Configuration status=\"info\">\n");
        sb.append("  <Appenders>\n");
        if (Config.sys_log_to_console) {
            sb.append("    <Console name=\"ConsoleErr\" target=\"SYSTEM_ERR\" follow=\"true\">\n");
            sb.append("      ${default_layout}\n");
            sb.append("    </Console>\n");
        } else {
            sb.append(String.format(ROLLING_FILE_TEMPLATE, "Sys", "sluice.log", "default_layout"));
            sb.append(String.format(ROLLING_FILE_TEMPLATE, "SysWF", "sluice.warn.log", "warning_layout"));
        }
        sb.append("  </Appenders>\n");
        sb.append("  <Loggers>\n");
        sb.append("    <Root level=\"${sys_log_level}\">\n");
        if (Config.sys_log_to_console) {
            sb.append("      <AppenderRef ref=\"ConsoleErr\"/>\n");
        } else {
            sb.append("      <AppenderRef ref=\"Sys\"/>\n");
            sb.append("      <AppenderRef ref=\"SysWF\" level=\"WARN\"/>\n");
        }
        sb.append("    </Root>\n");
        sb.append(VERBOSE_LOGGERS);
        sb.append("  </Loggers>\n");
        sb.append("</Configuration>");

        StringBuilder loggers = new StringBuilder();
        for (String module : verboseModules) {
            if (StringUtils.isNotBlank(module)) {
                loggers.append("    <Logger name='").append(module.trim()).append("' level='DEBUG'/>\n");
            }
        }
        return sb.toString().replace(VERBOSE_LOGGERS, loggers.toString());
    }

    private static String getIntervalPattern(String name, String config) throws IOException {
        if (config.equalsIgnoreCase("HOUR")) {
            return "%d{yyyyMMddHH}";
        } else if (config.equalsIgnoreCase("DAY")) {
            return "%d{yyyyMMdd}";
        } else {
            throw new IOException(name + " config error: " + config);
        }
    }

    private static void reconfig() throws IOException {
        String xml = generateActiveLog4jXmlConfig();
        ConfigurationSource source =
                new ConfigurationSource(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        LoggerContext context = (LoggerContext) LogManager.getContext(LogManager.class.getClassLoader(), false);
        context.start(new Log4jConfig(source));
    }

    @Override
    public StrSubstitutor getStrSubstitutor() {
        return strSub;
    }

    public Log4jConfig(final ConfigurationSource configSource) {
        super(LoggerContext.getContext(), configSource);
    }

    public static synchronized void initLogging() throws IOException {
        sysLogLevel = Config.sys_log_level;
        verboseModules = Config.sys_log_verbose_modules;
        reconfig();
    }

    /**
     * Changes the root level or the verbose modules of the running configuration. A null argument
     * keeps the current value.
     */
    public static synchronized void updateLogging(String level, String[] verboseNames) throws IOException {
        if (level == null && verboseNames == null) {
            return;
        }
        if (level != null) {
            sysLogLevel = level;
        }
        if (verboseNames != null) {
            verboseModules = verboseNames;
        }
        reconfig();
    }
}

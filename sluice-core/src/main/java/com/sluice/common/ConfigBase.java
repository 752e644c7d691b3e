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
import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileReader;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.reflect.Field;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ConfigBase {
    private static final Logger LOG = LogManager.getLogger(ConfigBase.class);

    @Retention(RetentionPolicy.RUNTIME)
    public @interface ConfField {
        boolean mutable() default false;

        String comment() default "";

        /**
         * alias for a configuration defined in Config, used for compatibility reason.
         * when changing a configuration name, you can put the old name in alias annotation.
         * <p>
         * usage: @ConfField(alias = {"old_name1", "old_name2"})
         *
         * @return an array of alias names
         */
        String[] aliases() default {};
    }

    protected Properties props;
    protected static Field[] configFields;
    protected static Map<String, Field> allMutableConfigs = new HashMap<>();

    public void init(String propFile) throws Exception {
        configFields = this.getClass().getFields();
        initAllMutableConfigs();
        props = new Properties();
        try (FileReader reader = new FileReader(propFile)) {
            props.load(reader);
        }

        replacedByEnv();
        setFields();
    }

    public static synchronized void initAllMutableConfigs() {
        for (Field field : configFields) {
            ConfField confField = field.getAnnotation(ConfField.class);
            if (confField == null || !confField.mutable()) {
                continue;
            }
            allMutableConfigs.put(field.getName(), field);
            for (String aliasName : confField.aliases()) {
                allMutableConfigs.put(aliasName, field);
            }
        }
    }

    public static Map<String, Field> getAllMutableConfigs() {
        return allMutableConfigs;
    }

    public static HashMap<String, String> dump() throws Exception {
        HashMap<String, String> map = new HashMap<String, String>();
        for (Field f : configFields) {
            if (f.getAnnotation(ConfField.class) == null) {
                continue;
            }
            map.put(f.getName(), valueToString(f));
        }
        return map;
    }

    private static String valueToString(Field f) throws IllegalAccessException, InvalidConfException {
        if (!f.getType().isArray()) {
            return String.valueOf(f.get(null));
        }
        switch (f.getType().getSimpleName()) {
            case "int[]":
                return Arrays.toString((int[]) f.get(null));
            case "long[]":
                return Arrays.toString((long[]) f.get(null));
            case "double[]":
                return Arrays.toString((double[]) f.get(null));
            case "boolean[]":
                return Arrays.toString((boolean[]) f.get(null));
            case "String[]":
                return Arrays.toString((String[]) f.get(null));
            default:
                throw new InvalidConfException("unknown type: " + f.getType().getSimpleName());
        }
    }

    // ${VAR} in a value is replaced by the system property or the environment variable VAR
    private void replacedByEnv() throws InvalidConfException {
        Pattern pattern = Pattern.compile("\\$\\{([^\\}]*)\\}");
        for (String key : props.stringPropertyNames()) {
            String value = props.getProperty(key);
            Matcher m = pattern.matcher(value);
            while (m.find()) {
                String envValue = System.getProperty(m.group(1));
                envValue = (envValue != null) ? envValue : System.getenv(m.group(1));
                if (envValue != null) {
                    value = value.replace("${" + m.group(1) + "}", envValue);
                } else {
                    throw new InvalidConfException("no such env variable: " + m.group(1));
                }
            }
            props.setProperty(key, value);
        }
    }

    public String getConfigValue(String confKey, String[] aliases) {
        String confVal = props.getProperty(confKey);
        if (Strings.isNullOrEmpty(confVal)) {
            for (String aliasName : aliases) {
                confVal = props.getProperty(aliasName);
                if (!Strings.isNullOrEmpty(confVal)) {
                    break;
                }
            }
        }

        return confVal;
    }

    private void setFields() throws Exception {
        for (Field f : configFields) {
            // ensure that field has "@ConfField" annotation
            ConfField anno = f.getAnnotation(ConfField.class);
            if (anno == null) {
                continue;
            }

            // ensure that field has property string
            String confVal = getConfigValue(f.getName(), anno.aliases());
            if (Strings.isNullOrEmpty(confVal)) {
                continue;
            }

            setConfigField(f, confVal);
        }
    }

    public static void setConfigField(Field f, String confVal) throws Exception {
        confVal = confVal.trim();
        boolean isEmpty = confVal.isEmpty();

        String[] sa = confVal.split(",");
        for (int i = 0; i < sa.length; i++) {
            sa[i] = sa[i].trim();
        }

        switch (f.getType().getSimpleName()) {
            case "int":
                f.setInt(null, Integer.parseInt(confVal));
                break;
            case "long":
                f.setLong(null, Long.parseLong(confVal));
                break;
            case "double":
                f.setDouble(null, Double.parseDouble(confVal));
                break;
            case "boolean":
                f.setBoolean(null, Boolean.parseBoolean(confVal));
                break;
            case "String":
                f.set(null, confVal);
                break;
            case "int[]":
                int[] ia = isEmpty ? new int[0] : new int[sa.length];
                for (int i = 0; i < ia.length; i++) {
                    ia[i] = Integer.parseInt(sa[i]);
                }
                f.set(null, ia);
                break;
            case "long[]":
                long[] la = isEmpty ? new long[0] : new long[sa.length];
                for (int i = 0; i < la.length; i++) {
                    la[i] = Long.parseLong(sa[i]);
                }
                f.set(null, la);
                break;
            case "double[]":
                double[] da = isEmpty ? new double[0] : new double[sa.length];
                for (int i = 0; i < da.length; i++) {
                    da[i] = Double.parseDouble(sa[i]);
                }
                f.set(null, da);
                break;
            case "boolean[]":
                boolean[] ba = isEmpty ? new boolean[0] : new boolean[sa.length];
                for (int i = 0; i < ba.length; i++) {
                    ba[i] = Boolean.parseBoolean(sa[i]);
                }
                f.set(null, ba);
                break;
            case "String[]":
                f.set(null, isEmpty ? new String[0] : sa);
                break;
            default:
                throw new InvalidConfException("unknown type: " + f.getType().getSimpleName());
        }
    }

    public static synchronized void setMutableConfig(String key, String value) throws InvalidConfException {
        Field field = allMutableConfigs.get(key);
        if (field == null) {
            throw new InvalidConfException(ErrorCode.ERROR_CONFIG_NOT_EXIST, key);
        }

        try {
            ConfigBase.setConfigField(field, value);
        } catch (Exception e) {
            throw new InvalidConfException("Failed to set config '" + key + "'. err: " + e.getMessage());
        }

        LOG.info("set config {} to {}", key, value);
    }

    public static synchronized List<List<String>> getConfigInfo() throws InvalidConfException {
        List<List<String>> configs = Lists.newArrayList();
        for (Field f : configFields) {
            ConfField anno = f.getAnnotation(ConfField.class);
            if (anno == null) {
                continue;
            }

            String confVal;
            try {
                confVal = valueToString(f);
            } catch (IllegalArgumentException | IllegalAccessException e) {
                throw new InvalidConfException("Failed to get config '" + f.getName() + "'. err: " + e.getMessage());
            }

            List<String> config = Lists.newArrayList();
            config.add(f.getName());
            config.add(Arrays.toString(anno.aliases()));
            config.add(Strings.nullToEmpty(confVal));
            config.add(f.getType().getSimpleName());
            config.add(String.valueOf(anno.mutable()));
            config.add(anno.comment());
            configs.add(config);
        }

        return configs;
    }
}

/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.tracebridge.agent.logging;

import org.slf4j.event.Level;
import org.slf4j.impl.SimpleLogger;
import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.source.ConfigurationSource;

import javax.annotation.Nullable;
import java.io.File;
import java.util.List;

/**
 * Defines configuration options related to logging.
 * <p>
 * This class is a bit special compared to other {@link ConfigurationOptionProvider}s,
 * because we have to make sure that we initialize the logger before anyone calls
 * {@link org.slf4j.LoggerFactory#getLogger(Class)}.
 * That's why we don't read the values from the {@link ConfigurationOption} fields but
 * iterate over the {@link ConfigurationSource}s manually to read the values
 * (see {@link #getValue(String, List, String)}).
 * </p>
 */
public class LoggingConfiguration extends ConfigurationOptionProvider {

    static final String SYSTEM_OUT = "System.out";
    static final String LOG_LEVEL_KEY = "log_level";
    static final String LOG_FILE_KEY = "log_file";
    static final String AGENT_LOGGER = "co.tracebridge";
    private static final String DEFAULT_LOG_FILE = SYSTEM_OUT;
    private static final String LOGGING_CATEGORY = "Logging";

    @SuppressWarnings("unused")
    public ConfigurationOption<Level> logLevel = ConfigurationOption.enumOption(Level.class)
        .key(LOG_LEVEL_KEY)
        .configurationCategory(LOGGING_CATEGORY)
        .description("Sets the logging level for the agent.\n" +
            "\n" +
            "This option is case-insensitive.")
        .dynamic(false)
        .buildWithDefault(Level.INFO);

    @SuppressWarnings("unused")
    public ConfigurationOption<String> logFile = ConfigurationOption.stringOption()
        .key(LOG_FILE_KEY)
        .configurationCategory(LOGGING_CATEGORY)
        .description("Sets the path of the agent logs.\n" +
            "\n" +
            "When set to the special value 'System.out',\n" +
            "the logs are sent to standard out.")
        .dynamic(false)
        .buildWithDefault(DEFAULT_LOG_FILE);

    public static void init(List<ConfigurationSource> sources) {
        setLogLevel(getValue(LOG_LEVEL_KEY, sources, Level.INFO.toString()));
        setLogFileLocation(getValue(LOG_FILE_KEY, sources, DEFAULT_LOG_FILE));
    }

    /**
     * The ConfigurationRegistry uses and thereby initializes a logger,
     * so we can't use it here initialize the {@link ConfigurationOption}s in this class.
     */
    static String getValue(String key, List<ConfigurationSource> sources, String defaultValue) {
        for (ConfigurationSource source : sources) {
            final String value = source.getValue(key);
            if (value != null) {
                return value;
            }
        }
        return defaultValue;
    }

    private static void setLogLevel(@Nullable String level) {
        System.setProperty(SimpleLogger.LOG_KEY_PREFIX + AGENT_LOGGER, level != null ? level : Level.INFO.toString());
        System.setProperty(SimpleLogger.SHOW_DATE_TIME_KEY, Boolean.TRUE.toString());
        System.setProperty(SimpleLogger.DATE_TIME_FORMAT_KEY, "yyyy-MM-dd HH:mm:ss.SSS");
    }

    private static void setLogFileLocation(String logFile) {
        if (SYSTEM_OUT.equalsIgnoreCase(logFile)) {
            System.setProperty(SimpleLogger.LOG_FILE_KEY, SYSTEM_OUT);
        } else {
            System.setProperty(SimpleLogger.LOG_FILE_KEY, getActualLogFile(logFile));
        }
    }

    static String getActualLogFile(String logFile) {
        final File logDir = new File(logFile).getAbsoluteFile().getParentFile();
        if (logDir != null && !logDir.exists()) {
            logDir.mkdirs();
        }
        if (logDir == null || !logDir.canWrite()) {
            System.err.println("Log file " + logFile + " is not writable. Falling back to System.out.");
            return SYSTEM_OUT;
        }
        return logFile;
    }
}

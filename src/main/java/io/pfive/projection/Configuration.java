// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/// Yes, this is global state and it's intentional. These are deployment-level tuning values for
/// logging and worker threads, not per-call options: anything that changes the result of a
/// projection belongs in the ProjectionRequest instead. Loaded once from conf.properties on the
/// classpath.
public abstract class Configuration {
    private static final String RESOURCE_NAME = "/conf.properties";

    public static Properties properties = new Properties();
    public static final int PROGRESS_MAX_EVENTS;
    public static final int PROGRESS_MIN_MSEC;
    public static final String WORKER_THREAD_PREFIX;
    public static final boolean LOG_WORKER_TIMING;

    // TODO check for unused keys (due to misspellings)
    static {
        try (InputStream in = Configuration.class.getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) throw new RuntimeException("Missing configuration resource: " + RESOURCE_NAME);
            properties.load(in);
            PROGRESS_MAX_EVENTS = intVal("progress-max-events");
            PROGRESS_MIN_MSEC = intVal("progress-min-msec");
            WORKER_THREAD_PREFIX = stringVal("worker-thread-prefix");
            LOG_WORKER_TIMING = boolVal("log-worker-timing");
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    private static String stringVal (String key) {
        String val = properties.getProperty(key);
        if (val == null) throw new RuntimeException("Missing configuration key: " + key);
        return val.trim();
    }

    private static int intVal (String key) {
        String val = stringVal(key);
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new RuntimeException(message, e);
        }
    }

    private static boolean boolVal (String key) {
        String val = stringVal(key);
        if (val.equalsIgnoreCase("true")) return true;
        if (val.equalsIgnoreCase("yes")) return true;
        if (val.equalsIgnoreCase("false")) return false;
        if (val.equalsIgnoreCase("no")) return false;
        var message = String.format("Boolean value '%s' for configuration key '%s' must be true/false/yes/no.", val, key);
        throw new RuntimeException(message);
    }

}

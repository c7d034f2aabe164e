package com.ordoAetheris.handoff.config;

import com.ordoAetheris.handoff.InvalidConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Run settings for the handoff demo.
 *
 * <p>Lookup order: JVM system property, then {@value #RESOURCE} on the classpath, then the default.
 * Keys: {@value #CAPACITY_KEY}, {@value #ITEMS_KEY}.
 */
public final class PipelineSettings {

    public static final String RESOURCE = "handoff.properties";
    public static final String CAPACITY_KEY = "handoff.capacity";
    public static final String ITEMS_KEY = "handoff.items";

    static final int DEFAULT_CAPACITY = 3;
    static final int DEFAULT_ITEMS = 10;

    private final int capacity;
    private final int itemCount;

    public PipelineSettings(int capacity, int itemCount) {
        if (capacity < 1) throw new InvalidConfigurationException("capacity must be >= 1, got " + capacity);
        if (itemCount < 0) throw new InvalidConfigurationException("item count must be >= 0, got " + itemCount);
        this.capacity = capacity;
        this.itemCount = itemCount;
    }

    public static PipelineSettings load() {
        return load(RESOURCE);
    }

    public static PipelineSettings load(String resource) {
        return fromProperties(loadResource(resource));
    }

    public static PipelineSettings fromProperties(Properties props) {
        int capacity = intValue(props, CAPACITY_KEY, DEFAULT_CAPACITY);
        int items = intValue(props, ITEMS_KEY, DEFAULT_ITEMS);
        return new PipelineSettings(capacity, items);
    }

    static Properties loadResource(String name) {
        Properties props = new Properties();
        try (InputStream in = PipelineSettings.class.getClassLoader().getResourceAsStream(name)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Cannot read " + name, e);
        }
        return props;
    }

    static String optional(Properties props, String key, String defaultVal) {
        String sysVal = System.getProperty(key);
        if (sysVal != null && !sysVal.isBlank()) {
            return sysVal.trim();
        }
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) {
            return defaultVal;
        }
        return val.trim();
    }

    private static int intValue(Properties props, String key, int defaultVal) {
        String raw = optional(props, key, String.valueOf(defaultVal));
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    public int capacity() {
        return capacity;
    }

    public int itemCount() {
        return itemCount;
    }

    @Override
    public String toString() {
        return "PipelineSettings{capacity=" + capacity + ", itemCount=" + itemCount + "}";
    }
}

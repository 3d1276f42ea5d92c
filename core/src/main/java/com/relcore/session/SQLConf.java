package com.relcore.session;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Properties;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * String key/value configuration of a session.
 *
 * <p>Recognised keys and their defaults:
 * <ul>
 *   <li>{@value #DIALECT} - {@code sql}</li>
 *   <li>{@value #CODEGEN_ENABLED} - {@code false}</li>
 *   <li>{@value #SHUFFLE_PARTITIONS} - {@code 200}</li>
 *   <li>{@value #COLUMN_NAME_OF_CORRUPT_RECORD} - {@code _corrupt_record}</li>
 *   <li>{@value #CASE_SENSITIVE} - {@code true}</li>
 *   <li>{@value #COLUMN_BATCH_SIZE} - {@code 10000}</li>
 * </ul>
 *
 * <p>Settings may be changed at any time; readers always see the latest value.
 */
public class SQLConf {

    /** Prefix shared by every configuration key. */
    public static final String PREFIX = "relcore.sql.";

    public static final String DIALECT = "relcore.sql.dialect";
    public static final String CODEGEN_ENABLED = "relcore.sql.codegen";
    public static final String SHUFFLE_PARTITIONS = "relcore.sql.shuffle.partitions";
    public static final String COLUMN_NAME_OF_CORRUPT_RECORD = "relcore.sql.columnNameOfCorruptRecord";
    public static final String CASE_SENSITIVE = "relcore.sql.caseSensitive";
    public static final String COLUMN_BATCH_SIZE = "relcore.sql.inMemoryColumnarStorage.batchSize";

    private static final Map<String, String> DEFAULTS = Map.of(
        DIALECT, "sql",
        CODEGEN_ENABLED, "false",
        SHUFFLE_PARTITIONS, "200",
        COLUMN_NAME_OF_CORRUPT_RECORD, "_corrupt_record",
        CASE_SENSITIVE, "true",
        COLUMN_BATCH_SIZE, "10000");

    private final Map<String, String> settings = new ConcurrentHashMap<>();

    public String dialect() {
        return getConf(DIALECT);
    }

    public boolean codegenEnabled() {
        return Boolean.parseBoolean(getConf(CODEGEN_ENABLED));
    }

    public int numShufflePartitions() {
        return positiveInt(SHUFFLE_PARTITIONS);
    }

    public String columnNameOfCorruptRecord() {
        return getConf(COLUMN_NAME_OF_CORRUPT_RECORD);
    }

    public boolean caseSensitive() {
        return Boolean.parseBoolean(getConf(CASE_SENSITIVE));
    }

    public int columnBatchSize() {
        return positiveInt(COLUMN_BATCH_SIZE);
    }

    private int positiveInt(String key) {
        String value = getConf(key);
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("%s should be an integer, but was %s".formatted(key, value), e);
        }
        if (parsed < 1) {
            throw new IllegalArgumentException("%s should be positive, but was %d".formatted(key, parsed));
        }
        return parsed;
    }

    /**
     * Copies every property into this configuration.
     *
     * @param props the properties
     */
    public void setConf(Properties props) {
        for (String key : props.stringPropertyNames()) {
            setConf(key, props.getProperty(key));
        }
    }

    /**
     * Sets a configuration value.
     *
     * @param key the key
     * @param value the value, must not be null
     */
    public void setConf(String key, String value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null for key: " + key);
        }
        settings.put(key, value);
    }

    /**
     * Returns a configuration value, falling back to the default of a recognised key.
     *
     * @param key the key
     * @return the value
     * @throws NoSuchElementException if the key is neither set nor recognised
     */
    public String getConf(String key) {
        String value = settings.get(key);
        if (value == null) {
            value = DEFAULTS.get(key);
        }
        if (value == null) {
            throw new NoSuchElementException(key);
        }
        return value;
    }

    /**
     * Returns a configuration value, or {@code defaultValue} when it is not set.
     *
     * @param key the key
     * @param defaultValue the fallback
     * @return the value
     */
    public String getConf(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    /**
     * Returns every explicitly set value.
     *
     * @return a sorted snapshot of the settings
     */
    public Map<String, String> getAllConfs() {
        return new TreeMap<>(settings);
    }

    /**
     * Removes every explicitly set value.
     */
    public void clear() {
        settings.clear();
    }
}

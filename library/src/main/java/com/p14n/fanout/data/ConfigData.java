package com.p14n.fanout.data;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

public record ConfigData(int defaultCapacity,
        int maxMessageSize,
        Duration retention,
        Duration sweepInterval,
        int deliveryThreads,
        boolean orderedDelivery) implements FanoutConfig {

    public static final int DEFAULT_CAPACITY = 1000;
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 1024 * 1024;
    public static final Duration DEFAULT_RETENTION = Duration.ofHours(24);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofHours(1);

    public ConfigData {
        if (defaultCapacity <= 0) {
            throw new IllegalArgumentException("defaultCapacity must be positive, was " + defaultCapacity);
        }
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be positive, was " + maxMessageSize);
        }
        if (retention == null || retention.isNegative()) {
            throw new IllegalArgumentException("retention cannot be null or negative");
        }
        if (sweepInterval == null || sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
        if (deliveryThreads < 0) {
            throw new IllegalArgumentException("deliveryThreads cannot be negative, was " + deliveryThreads);
        }
    }

    public ConfigData(int defaultCapacity) {
        this(defaultCapacity, DEFAULT_MAX_MESSAGE_SIZE, DEFAULT_RETENTION, DEFAULT_SWEEP_INTERVAL, 0, false);
    }

    public ConfigData() {
        this(DEFAULT_CAPACITY);
    }

    public ConfigData withOrderedDelivery(boolean ordered) {
        return new ConfigData(defaultCapacity, maxMessageSize, retention, sweepInterval, deliveryThreads, ordered);
    }

    public ConfigData withRetention(Duration r) {
        return new ConfigData(defaultCapacity, maxMessageSize, r, sweepInterval, deliveryThreads, orderedDelivery);
    }

    /**
     * Reads configuration from properties using the {@code fanout.*} keys,
     * falling back to defaults for missing keys.
     *
     * @param props the properties to read
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static ConfigData fromProperties(Properties props) {
        return read(props::getProperty,
                "fanout.default-capacity",
                "fanout.max-message-size",
                "fanout.retention-seconds",
                "fanout.sweep-interval-seconds",
                "fanout.delivery-threads",
                "fanout.ordered-delivery");
    }

    /**
     * Reads configuration from environment style variables such as
     * {@code FANOUT_DEFAULT_CAPACITY}, falling back to defaults for missing
     * keys.
     *
     * @param env the variables to read, usually {@link System#getenv()}
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static ConfigData fromEnvironment(Map<String, String> env) {
        return read(env::get,
                "FANOUT_DEFAULT_CAPACITY",
                "FANOUT_MAX_MESSAGE_SIZE",
                "FANOUT_RETENTION_SECONDS",
                "FANOUT_SWEEP_INTERVAL_SECONDS",
                "FANOUT_DELIVERY_THREADS",
                "FANOUT_ORDERED_DELIVERY");
    }

    private static ConfigData read(Function<String, String> source, String capacityKey, String sizeKey,
            String retentionKey, String sweepKey, String threadsKey, String orderedKey) {
        return new ConfigData(
                intValue(source, capacityKey, DEFAULT_CAPACITY),
                intValue(source, sizeKey, DEFAULT_MAX_MESSAGE_SIZE),
                Duration.ofSeconds(longValue(source, retentionKey, DEFAULT_RETENTION.toSeconds())),
                Duration.ofSeconds(longValue(source, sweepKey, DEFAULT_SWEEP_INTERVAL.toSeconds())),
                intValue(source, threadsKey, 0),
                booleanValue(source, orderedKey, false));
    }

    private static int intValue(Function<String, String> source, String key, int fallback) {
        long v = longValue(source, key, fallback);
        if (v > Integer.MAX_VALUE || v < Integer.MIN_VALUE) {
            throw new IllegalArgumentException("Value for " + key + " out of range: " + v);
        }
        return (int) v;
    }

    private static long longValue(Function<String, String> source, String key, long fallback) {
        var v = source.apply(key);
        if (v == null || v.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + v, e);
        }
    }

    private static boolean booleanValue(Function<String, String> source, String key, boolean fallback) {
        var v = source.apply(key);
        if (v == null || v.isBlank()) {
            return fallback;
        }
        return switch (v.trim().toLowerCase()) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new IllegalArgumentException("Invalid value for " + key + ": " + v);
        };
    }
}

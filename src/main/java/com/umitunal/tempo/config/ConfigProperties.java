package com.umitunal.tempo.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;

/**
 * Typed reads over a {@link Properties} source. Missing keys fall back to the
 * supplied default; malformed values fail with the offending key in the
 * message.
 */
final class ConfigProperties {
    private final Properties properties;

    ConfigProperties(Properties properties) {
        this.properties = properties;
    }

    static Properties loadClasspath(String resource) {
        Properties properties = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ConfigProperties.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Configuration resource not found on classpath: " + resource);
            }
            properties.load(in);
            return properties;
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read configuration resource " + resource, e);
        }
    }

    String getString(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            return Boolean.parseBoolean(value);
        }
        throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
    }

    /**
     * Accepts ISO-8601 durations ({@code PT15S}) or plain milliseconds.
     */
    Duration getDuration(String key, Duration defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofMillis(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": " + value, e);
        }
    }
}

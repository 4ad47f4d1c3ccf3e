package com.shardsql.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings of the pushdown compiler.
 *
 * <p>Values come from, in increasing precedence:
 * <ol>
 *   <li>the defaults below</li>
 *   <li>the classpath resource {@value #RESOURCE_NAME}, when present</li>
 *   <li>JVM system properties with the same keys</li>
 * </ol>
 *
 * <table>
 *   <caption>Keys</caption>
 *   <tr><th>key</th><th>default</th></tr>
 *   <tr><td>{@value #ENABLED}</td><td>true</td></tr>
 *   <tr><td>{@value #JOINS_ENABLED}</td><td>true</td></tr>
 *   <tr><td>{@value #ALIAS_PREFIX}</td><td>query</td></tr>
 *   <tr><td>{@value #FIELD_PREFIX}</td><td>f_</td></tr>
 * </table>
 */
public final class PushdownConfig {

    public static final String RESOURCE_NAME = "shardsql-pushdown.properties";

    public static final String ENABLED = "shardsql.pushdown.enabled";
    public static final String JOINS_ENABLED = "shardsql.pushdown.joins.enabled";
    public static final String ALIAS_PREFIX = "shardsql.pushdown.alias.prefix";
    public static final String FIELD_PREFIX = "shardsql.pushdown.field.prefix";

    private static final PushdownConfig DEFAULTS = new PushdownConfig(true, true, "query", "f_");

    private final boolean enabled;
    private final boolean joinsEnabled;
    private final String aliasPrefix;
    private final String fieldPrefix;

    private PushdownConfig(boolean enabled, boolean joinsEnabled, String aliasPrefix, String fieldPrefix) {
        this.enabled = enabled;
        this.joinsEnabled = joinsEnabled;
        this.aliasPrefix = validatePrefix(ALIAS_PREFIX, aliasPrefix);
        this.fieldPrefix = validatePrefix(FIELD_PREFIX, fieldPrefix);
    }

    public static PushdownConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Loads the configuration from the classpath resource and system properties.
     *
     * @return the effective configuration
     * @throws IllegalArgumentException if a value is malformed
     */
    public static PushdownConfig load() {
        Properties properties = new Properties();
        try (InputStream in = PushdownConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
        for (String key : new String[] {ENABLED, JOINS_ENABLED, ALIAS_PREFIX, FIELD_PREFIX}) {
            String value = System.getProperty(key);
            if (value != null) {
                properties.setProperty(key, value);
            }
        }
        return fromProperties(properties);
    }

    /**
     * Builds a configuration from properties; missing keys take their defaults.
     *
     * @param properties the properties
     * @return the configuration
     * @throws IllegalArgumentException if a value is malformed
     */
    public static PushdownConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        return new PushdownConfig(
            parseBoolean(ENABLED, properties.getProperty(ENABLED), DEFAULTS.enabled),
            parseBoolean(JOINS_ENABLED, properties.getProperty(JOINS_ENABLED), DEFAULTS.joinsEnabled),
            properties.getProperty(ALIAS_PREFIX, DEFAULTS.aliasPrefix).trim(),
            properties.getProperty(FIELD_PREFIX, DEFAULTS.fieldPrefix).trim());
    }

    public PushdownConfig withEnabled(boolean value) {
        return new PushdownConfig(value, joinsEnabled, aliasPrefix, fieldPrefix);
    }

    public PushdownConfig withJoinsEnabled(boolean value) {
        return new PushdownConfig(enabled, value, aliasPrefix, fieldPrefix);
    }

    public PushdownConfig withAliasPrefix(String value) {
        return new PushdownConfig(enabled, joinsEnabled, value, fieldPrefix);
    }

    public PushdownConfig withFieldPrefix(String value) {
        return new PushdownConfig(enabled, joinsEnabled, aliasPrefix, value);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isJoinsEnabled() {
        return joinsEnabled;
    }

    /** Prefix of the root query alias. */
    public String aliasPrefix() {
        return aliasPrefix;
    }

    /** Prefix of synthetic output field names. */
    public String fieldPrefix() {
        return fieldPrefix;
    }

    private static boolean parseBoolean(String key, String value, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        return switch (value.trim().toLowerCase()) {
            case "true"  -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException(
                "Invalid value for %s: '%s'. Valid values: true, false".formatted(key, value));
        };
    }

    // Prefixes end up inside generated identifiers, so they are held to plain identifier characters.
    private static String validatePrefix(String key, String value) {
        if (value == null || !value.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
            throw new IllegalArgumentException(
                "Invalid value for %s: '%s'. Must start with a letter or underscore and contain only letters, digits and underscores"
                    .formatted(key, value));
        }
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PushdownConfig)) return false;
        PushdownConfig that = (PushdownConfig) obj;
        return enabled == that.enabled &&
               joinsEnabled == that.joinsEnabled &&
               aliasPrefix.equals(that.aliasPrefix) &&
               fieldPrefix.equals(that.fieldPrefix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, joinsEnabled, aliasPrefix, fieldPrefix);
    }

    @Override
    public String toString() {
        return String.format("PushdownConfig(enabled=%s, joinsEnabled=%s, aliasPrefix=%s, fieldPrefix=%s)",
            enabled, joinsEnabled, aliasPrefix, fieldPrefix);
    }
}

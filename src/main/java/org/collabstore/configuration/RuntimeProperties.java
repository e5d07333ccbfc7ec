package org.collabstore.configuration;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

import net.jcip.annotations.Immutable;

/**
 * Immutable key/value configuration of the collaborative store.
 * <p>
 * Values are kept as strings and converted on access. Typed accessors take a {@link Property} and fall back to its
 * default when the key is missing.
 * </p>
 *
 * @since 1.0
 */
@Immutable
public interface RuntimeProperties {

    String PROPERTY_PREFIX = "collabstore";

    RuntimeProperties EMPTY = from(new Properties());

    /**
     * Create a new {@link Builder configuration builder}.
     *
     * @return the configuration builder
     */
    static Builder create() {
        return new Builder();
    }

    /**
     * Obtain a configuration instance by copying the supplied Properties object.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static RuntimeProperties from(Properties properties) {
        Properties props = new Properties();
        if (properties != null) {
            properties.stringPropertyNames().forEach(key -> props.setProperty(key.trim(), properties.getProperty(key)));
        }
        return new RuntimeProperties() {
            @Override
            public String getString(String key) {
                return key != null ? props.getProperty(key) : null;
            }

            @Override
            public Set<String> keys() {
                return props.stringPropertyNames();
            }

            @Override
            public String toString() {
                return props.toString();
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied map. Values are converted with {@link Object#toString()},
     * {@code null} values are dropped.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static RuntimeProperties from(Map<String, ?> properties) {
        Properties props = new Properties();
        if (properties != null) {
            properties.forEach((k, v) -> {
                if (k != null && v != null)
                    props.setProperty(k, v.toString());
            });
        }
        return from(props);
    }

    /**
     * Obtain a configuration instance by loading the Properties from the supplied stream. The stream is closed.
     *
     * @param stream the stream containing the properties; may not be null
     * @return the configuration; never null
     * @throws IOException if there is an error reading the stream
     */
    static RuntimeProperties load(InputStream stream) throws IOException {
        Objects.requireNonNull(stream, "stream can not be null");
        try (stream) {
            Properties properties = new Properties();
            properties.load(stream);
            return from(properties);
        }
    }

    /**
     * Get the set of keys in this configuration.
     *
     * @return the set of keys; never null but possibly empty
     */
    Set<String> keys();

    /**
     * Get the string value associated with the given key.
     *
     * @param key the key for the configuration property
     * @return the value, or null if the key is null or absent
     */
    String getString(String key);

    default String getString(Property property) {
        String value = getString(property.name());
        return value != null ? value : property.defaultValueAsString();
    }

    default boolean getBoolean(Property property) {
        return getBoolean(property.name(), () -> Boolean.parseBoolean(property.defaultValueAsString()));
    }

    /**
     * Get the boolean value associated with the given key, using the supplier when the key is missing or its value is
     * neither {@code true} nor {@code false}.
     */
    default boolean getBoolean(String key, BooleanSupplier defaultValueSupplier) {
        String value = getString(key);
        if (value != null) {
            value = value.trim().toLowerCase();
            if (value.equals("true"))
                return true;
            if (value.equals("false"))
                return false;
        }
        return defaultValueSupplier.getAsBoolean();
    }

    default long getLong(Property property) {
        return getLong(property.name(), () -> Long.parseLong(property.defaultValueAsString()));
    }

    /**
     * Get the long value associated with the given key, using the supplier when the key is missing.
     *
     * @throws IllegalArgumentException if the key is present but its value does not parse as a long
     */
    default long getLong(String key, LongSupplier defaultValueSupplier) {
        String value = getString(key);
        if (value == null)
            return defaultValueSupplier.getAsLong();
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("property %s: '%s' is not a number", key, value), e);
        }
    }

    default Map<String, String> asMap() {
        Map<String, String> props = new HashMap<>();
        keys().forEach(key -> {
            String value = getString(key);
            if (value != null)
                props.put(key, value);
        });
        return props;
    }

    final class Builder {
        private final Properties properties = new Properties();

        private Builder() { }

        public Builder with(String key, String value) {
            if (value == null)
                properties.remove(key);
            else
                properties.setProperty(key, value);
            return this;
        }

        public Builder with(Property property, Object value) {
            return with(property.name(), value != null ? value.toString() : null);
        }

        public Builder with(RuntimeProperties other) {
            other.asMap().forEach(this::with);
            return this;
        }

        public Builder without(String key) {
            properties.remove(key);
            return this;
        }

        public RuntimeProperties build() {
            return RuntimeProperties.from(properties);
        }
    }
}

package de.burger.dispatch.config;

import de.burger.dispatch.infrastructure.logging.SuppressLogging;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable bundle of named options handed to a variant when it is constructed.
 * Replacing an option yields a new instance; existing instances never change.
 */
@SuppressLogging
public final class Configuration {
    private static final Configuration EMPTY = new Configuration(Map.of());

    private final Map<String, Object> options;

    private Configuration(Map<String, Object> options) {
        this.options = options;
    }

    public static Configuration empty() {
        return EMPTY;
    }

    public static Configuration of(Map<String, ?> options) {
        Objects.requireNonNull(options, "options");
        Builder builder = builder();
        options.forEach(builder::with);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Copy of this configuration with {@code name} set to {@code value}. */
    public Configuration with(String name, Object value) {
        return new Builder(options).with(name, value).build();
    }

    public boolean has(String name) {
        return options.containsKey(name);
    }

    public boolean isEmpty() {
        return options.isEmpty();
    }

    /** Option names in insertion order. */
    public Set<String> names() {
        return options.keySet();
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(options.get(name));
    }

    public Object require(String name) {
        Object value = options.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing option '" + name + "'");
        }
        return value;
    }

    public String getString(String name, String defaultValue) {
        Object value = options.get(name);
        return value == null ? defaultValue : value.toString();
    }

    public int getInt(String name, int defaultValue) {
        Object value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof String s) {
            return parse(name, s, Integer::parseInt);
        }
        throw wrongType(name, value, "int");
    }

    public long getLong(String name, long defaultValue) {
        Object value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof String s) {
            return parse(name, s, Long::parseLong);
        }
        throw wrongType(name, value, "long");
    }

    public double getDouble(String name, double defaultValue) {
        Object value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            return parse(name, s, Double::parseDouble);
        }
        throw wrongType(name, value, "double");
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        Object value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
            return Boolean.parseBoolean(s);
        }
        throw wrongType(name, value, "boolean");
    }

    private static <N> N parse(String name, String raw, Function<String, N> parser) {
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option '" + name + "' is not numeric: " + raw, e);
        }
    }

    private static IllegalArgumentException wrongType(String name, Object value, String expected) {
        return new IllegalArgumentException(
            "Option '" + name + "' expected " + expected + " but was " + value.getClass().getSimpleName());
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Configuration other && options.equals(other.options));
    }

    @Override
    public int hashCode() {
        return options.hashCode();
    }

    @Override
    public String toString() {
        return "Configuration" + options;
    }

    public static final class Builder {
        private final Map<String, Object> options;

        private Builder() {
            this.options = new LinkedHashMap<>();
        }

        private Builder(Map<String, Object> seed) {
            this.options = new LinkedHashMap<>(seed);
        }

        public Builder with(String name, Object value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Option name must not be blank");
            }
            options.put(name, value);
            return this;
        }

        public Configuration build() {
            if (options.isEmpty()) {
                return EMPTY;
            }
            return new Configuration(Collections.unmodifiableMap(new LinkedHashMap<>(options)));
        }
    }
}

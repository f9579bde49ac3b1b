package com.hooktide.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flat string parameters for a dispatch, split into two namespaces:
 *
 *   body.*       → fields extracted from the webhook payload
 *   extensions.* → fields produced by enrichment (resource id, targets, ...)
 *
 * The namespaces live in separate maps, so a payload field can never replace an
 * enrichment field with the same base name. Within a namespace a key can be set
 * only once; a second put is a programming error.
 */
public final class ParameterSet {

    public static final String BODY_PREFIX = "body.";
    public static final String EXTENSIONS_PREFIX = "extensions.";

    private final Map<String, String> body;
    private final Map<String, String> extensions;

    private ParameterSet(Map<String, String> body, Map<String, String> extensions) {
        this.body = Collections.unmodifiableMap(new LinkedHashMap<>(body));
        this.extensions = Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> body(String name) {
        return Optional.ofNullable(body.get(name));
    }

    public Optional<String> extension(String name) {
        return Optional.ofNullable(extensions.get(name));
    }

    public Map<String, String> bodyFields() {
        return body;
    }

    public Map<String, String> extensionFields() {
        return extensions;
    }

    /**
     * Returns a copy with one more extension field.
     *
     * @throws IllegalStateException if the field is already set
     */
    public ParameterSet withExtension(String name, String value) {
        Builder builder = new Builder();
        builder.body.putAll(body);
        builder.extensions.putAll(extensions);
        builder.extension(name, value);
        return builder.build();
    }

    /** Qualified view: "body.revision", "extensions.resourceId", ... */
    public Map<String, String> flatten() {
        Map<String, String> flat = new LinkedHashMap<>();
        body.forEach((k, v) -> flat.put(BODY_PREFIX + k, v));
        extensions.forEach((k, v) -> flat.put(EXTENSIONS_PREFIX + k, v));
        return Collections.unmodifiableMap(flat);
    }

    @Override
    public String toString() {
        return "ParameterSet" + flatten();
    }

    public static final class Builder {

        private final Map<String, String> body = new LinkedHashMap<>();
        private final Map<String, String> extensions = new LinkedHashMap<>();

        private Builder() {
        }

        /** Adds a payload field; null values are skipped. */
        public Builder body(String name, String value) {
            put(body, BODY_PREFIX, name, value);
            return this;
        }

        /** Adds an enrichment field; null values are skipped. */
        public Builder extension(String name, String value) {
            put(extensions, EXTENSIONS_PREFIX, name, value);
            return this;
        }

        private static void put(Map<String, String> target, String prefix, String name, String value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Parameter name must not be blank");
            }
            if (value == null) {
                return;
            }
            if (target.putIfAbsent(name, value) != null) {
                throw new IllegalStateException("Parameter already bound: " + prefix + name);
            }
        }

        public ParameterSet build() {
            return new ParameterSet(body, extensions);
        }
    }
}

package com.example.chunker.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free-form statement metadata (account number, holder, period, ...) in the order it was found.
 * Chunk serialization depends on that order, so entries are kept in insertion order and a repeated
 * key updates its value in place.
 */
public final class StatementMetadata {

    private static final StatementMetadata EMPTY = new StatementMetadata(new LinkedHashMap<>());

    private final LinkedHashMap<String, String> entries;

    private StatementMetadata(LinkedHashMap<String, String> entries) {
        this.entries = entries;
    }

    public static StatementMetadata empty() {
        return EMPTY;
    }

    public static StatementMetadata of(String key, String value) {
        return builder().put(key, value).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonValue
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    public String get(String key) {
        return entries.get(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof StatementMetadata that && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    public static final class Builder {
        private final LinkedHashMap<String, String> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, String value) {
            entries.put(key, value);
            return this;
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        public StatementMetadata build() {
            if (entries.isEmpty()) {
                return EMPTY;
            }
            return new StatementMetadata(new LinkedHashMap<>(entries));
        }
    }
}

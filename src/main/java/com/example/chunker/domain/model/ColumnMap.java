package com.example.chunker.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Maps canonical column roles to column indices of a normalized header.
 * Each role maps to at most one index (the first column classified with that role) and every index
 * is within the header width the map was built for.
 */
public final class ColumnMap {

    private final EnumMap<ColumnRole, Integer> indices;
    private final int width;

    private ColumnMap(EnumMap<ColumnRole, Integer> indices, int width) {
        this.indices = indices;
        this.width = width;
    }

    /**
     * Starts a map for a header with {@code width} columns.
     *
     * @param width number of header columns
     * @return empty builder
     */
    public static Builder builder(int width) {
        return new Builder(width);
    }

    /**
     * @return map without any role, used for rows whose header is unknown
     */
    public static ColumnMap empty() {
        return new ColumnMap(new EnumMap<>(ColumnRole.class), 0);
    }

    public OptionalInt indexOf(ColumnRole role) {
        Integer index = indices.get(role);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    /**
     * Resolves the index for a role, using {@code fallbackIndex} when the role was never detected.
     *
     * @param role          role to look up
     * @param fallbackIndex positional default
     * @return mapped index or the fallback
     */
    public int indexOrDefault(ColumnRole role, int fallbackIndex) {
        Integer index = indices.get(role);
        return index == null ? fallbackIndex : index;
    }

    public boolean contains(ColumnRole role) {
        return indices.containsKey(role);
    }

    public int width() {
        return width;
    }

    public Map<ColumnRole, Integer> asMap() {
        return Collections.unmodifiableMap(indices);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ColumnMap that)) {
            return false;
        }
        return width == that.width && indices.equals(that.indices);
    }

    @Override
    public int hashCode() {
        return 31 * indices.hashCode() + width;
    }

    @Override
    public String toString() {
        return indices.toString();
    }

    /**
     * Collects role assignments; later assignments of an already mapped role are ignored.
     */
    public static final class Builder {
        private final EnumMap<ColumnRole, Integer> indices = new EnumMap<>(ColumnRole.class);
        private final int width;

        private Builder(int width) {
            if (width < 0) {
                throw new IllegalArgumentException("Header width must not be negative: " + width);
            }
            this.width = width;
        }

        /**
         * Records {@code index} for {@code role} unless the role is unknown or already mapped.
         *
         * @param role  detected role
         * @param index column index
         * @return this builder
         */
        public Builder map(ColumnRole role, int index) {
            if (index < 0 || index >= width) {
                throw new IndexOutOfBoundsException("Column " + index + " outside header of width " + width);
            }
            if (role != null && role.isKnown()) {
                indices.putIfAbsent(role, index);
            }
            return this;
        }

        public ColumnMap build() {
            return new ColumnMap(new EnumMap<>(indices), width);
        }
    }
}

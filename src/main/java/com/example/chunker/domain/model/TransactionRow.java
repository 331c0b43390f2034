package com.example.chunker.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable ordered cells of one statement row.
 * Cells may be {@code null}; callers look values up by {@link ColumnRole} through a {@link ColumnMap}
 * so no component depends on another component's column positions.
 */
public final class TransactionRow {

    private final List<String> cells;

    private TransactionRow(List<String> cells) {
        this.cells = cells;
    }

    /**
     * Copies the given cells (nulls allowed) into a new row.
     *
     * @param cells raw cell values
     * @return immutable row
     */
    public static TransactionRow of(List<String> cells) {
        return new TransactionRow(Collections.unmodifiableList(new ArrayList<>(cells)));
    }

    public static TransactionRow of(String... cells) {
        List<String> values = new ArrayList<>(cells.length);
        Collections.addAll(values, cells);
        return new TransactionRow(Collections.unmodifiableList(values));
    }

    public List<String> cells() {
        return cells;
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    /**
     * @param index column index
     * @return cell value or {@code null} when the cell is missing or out of range
     */
    public String get(int index) {
        if (index < 0 || index >= cells.size()) {
            return null;
        }
        return cells.get(index);
    }

    /**
     * Reads the cell that belongs to {@code role}.
     *
     * @param role      column role
     * @param columnMap role lookup of the table
     * @return cell value, or {@code null} when the role is unmapped or the cell missing
     */
    public String valueOf(ColumnRole role, ColumnMap columnMap) {
        return columnMap.indexOf(role).stream()
                .mapToObj(this::get)
                .findFirst()
                .orElse(null);
    }

    /**
     * @param index column index
     * @param value replacement value
     * @return copy of this row with one cell replaced
     */
    public TransactionRow with(int index, String value) {
        List<String> copy = new ArrayList<>(cells);
        copy.set(index, value);
        return new TransactionRow(Collections.unmodifiableList(copy));
    }

    /**
     * Pads with {@code null} or truncates to exactly {@code width} cells.
     *
     * @param width target width
     * @return row with {@code width} cells
     */
    public TransactionRow resize(int width) {
        if (cells.size() == width) {
            return this;
        }
        List<String> copy = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            copy.add(get(i));
        }
        return new TransactionRow(Collections.unmodifiableList(copy));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof TransactionRow that && cells.equals(that.cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}

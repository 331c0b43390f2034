package com.example.chunker.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw cell grid produced by an extraction collaborator for a single table or page.
 * Rows may have different lengths and cells may be {@code null}.
 */
public record RawGrid(List<List<String>> rows) {

    public RawGrid {
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copy.add(row == null
                    ? Collections.emptyList()
                    : Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    public static RawGrid empty() {
        return new RawGrid(List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public List<String> row(int index) {
        return rows.get(index);
    }
}

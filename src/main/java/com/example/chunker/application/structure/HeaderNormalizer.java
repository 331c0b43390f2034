package com.example.chunker.application.structure;

import com.example.chunker.domain.model.ColumnMap;
import com.example.chunker.domain.model.ColumnRole;
import com.example.chunker.domain.model.HeaderSchema;
import com.example.chunker.domain.model.HeaderVariant;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renames recognised columns to canonical labels and builds the role lookup for a header.
 */
public final class HeaderNormalizer {

    private HeaderNormalizer() {
    }

    /**
     * Normalizes a raw header.
     * Only the first column of each role is mapped; later columns with the same role keep their
     * canonical label (and get a numeric suffix) but stay unmapped.
     *
     * @param headers raw header cells
     * @param variant label table to use
     * @return canonical, unique headers with their column map
     */
    public static HeaderSchema normalize(List<String> headers, HeaderVariant variant) {
        List<String> normalized = new ArrayList<>(headers.size());
        ColumnMap.Builder columnMap = ColumnMap.builder(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            ColumnRole role = ColumnClassifier.classify(header);
            if (role.isKnown()) {
                columnMap.map(role, i);
                normalized.add(variant.labelFor(role));
            } else {
                normalized.add(header == null ? "" : header.trim());
            }
        }
        return new HeaderSchema(makeUnique(normalized), columnMap.build());
    }

    /**
     * Appends {@code _1}, {@code _2}, ... to repeated names in order of appearance.
     *
     * @param headers header names, possibly repeated
     * @return pairwise distinct names
     */
    public static List<String> makeUnique(List<String> headers) {
        Map<String, Integer> seen = new HashMap<>();
        Set<String> taken = new HashSet<>(headers);
        Set<String> emitted = new HashSet<>();
        List<String> unique = new ArrayList<>(headers.size());
        for (String header : headers) {
            if (emitted.add(header)) {
                unique.add(header);
                continue;
            }
            int suffix = seen.getOrDefault(header, 0);
            String candidate;
            do {
                suffix++;
                candidate = header + "_" + suffix;
            } while (taken.contains(candidate) || emitted.contains(candidate));
            seen.put(header, suffix);
            emitted.add(candidate);
            unique.add(candidate);
        }
        return unique;
    }
}

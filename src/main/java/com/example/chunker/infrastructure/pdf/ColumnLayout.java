package com.example.chunker.infrastructure.pdf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Column split points derived from the label positions of a table header line.
 * A token belongs to the column whose range contains its horizontal center; centers left of the
 * first split land in column 0 and centers right of the last split land in the last column.
 */
final class ColumnLayout {
    private final float[] splits;
    private final int columnCount;

    private ColumnLayout(float[] splits) {
        this.splits = splits;
        this.columnCount = splits.length + 1;
    }

    /**
     * Builds a layout whose boundaries sit halfway between neighbouring header labels.
     *
     * @param labels merged header labels, left to right
     * @return layout with one column per label
     */
    static ColumnLayout fromLabels(List<PositionedToken> labels) {
        float[] splits = new float[Math.max(labels.size() - 1, 0)];
        for (int i = 0; i < splits.length; i++) {
            splits[i] = midpoint(labels.get(i).center(), labels.get(i + 1).center());
        }
        return new ColumnLayout(splits);
    }

    int columnCount() {
        return columnCount;
    }

    /**
     * Distributes the tokens of a line over the columns. Tokens in the same column are joined with
     * a single space; columns without tokens yield an empty string.
     *
     * @param line positioned line
     * @return one value per column
     */
    List<String> extractColumns(TextLine line) {
        List<StringBuilder> builders = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            builders.add(new StringBuilder());
        }
        for (PositionedToken token : line.tokens()) {
            String raw = token.text().strip();
            if (raw.isEmpty()) {
                continue;
            }
            StringBuilder builder = builders.get(locateColumn(token.center()));
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(raw);
        }
        List<String> values = new ArrayList<>(columnCount);
        for (StringBuilder builder : builders) {
            values.add(builder.toString());
        }
        return values;
    }

    int locateColumn(float center) {
        for (int i = 0; i < splits.length; i++) {
            if (center < splits[i]) {
                return i;
            }
        }
        return columnCount - 1;
    }

    @Override
    public String toString() {
        return "ColumnLayout" + Arrays.toString(splits);
    }

    private static float midpoint(float left, float right) {
        return left + ((right - left) / 2f);
    }
}

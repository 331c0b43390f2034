package com.example.chunker.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Half-open row window {@code [start, end)} over the combined transaction table.
 */
public record ChunkWindow(int start, int end) {

    public ChunkWindow {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid window [" + start + ", " + end + ")");
        }
    }

    /**
     * @return inclusive index of the last row in the window
     */
    public int lastIndex() {
        return end - 1;
    }

    public int size() {
        return end - start;
    }

    /**
     * Computes the windows for the structured chunk layout.
     * The next window starts {@code overlap} rows before the previous end; iteration stops as soon
     * as a window reaches {@code rowCount}, so the final partial window is emitted once.
     *
     * @param rowCount  number of rows in the table
     * @param chunkSize maximum rows per window
     * @param overlap   rows shared by consecutive windows
     * @return ordered windows
     */
    public static List<ChunkWindow> overlapping(int rowCount, int chunkSize, int overlap) {
        if (chunkSize < 1 || overlap < 0 || (overlap > 0 && overlap >= chunkSize)) {
            throw new IllegalArgumentException("Windows need chunkSize >= 1 and 0 <= overlap < chunkSize, got "
                    + chunkSize + "/" + overlap);
        }
        List<ChunkWindow> windows = new ArrayList<>();
        int start = 0;
        while (start < rowCount) {
            int end = Math.min(start + chunkSize, rowCount);
            windows.add(new ChunkWindow(start, end));
            if (end >= rowCount) {
                break;
            }
            start = overlap > 0 ? end - overlap : end;
        }
        return windows;
    }

    /**
     * Computes back-to-back windows that never share rows.
     *
     * @param rowCount  number of rows in the table
     * @param chunkSize maximum rows per window
     * @return ordered windows
     */
    public static List<ChunkWindow> contiguous(int rowCount, int chunkSize) {
        return overlapping(rowCount, chunkSize, 0);
    }
}

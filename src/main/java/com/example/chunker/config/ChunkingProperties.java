package com.example.chunker.config;

import com.example.chunker.domain.model.ChunkingOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chunker")
public class ChunkingProperties {

    /**
     * Maximum number of transaction rows per chunk.
     */
    private int chunkSize = ChunkingOptions.DEFAULT_CHUNK_SIZE;

    /**
     * Rows repeated between consecutive structured chunks. Ignored in fallback mode.
     */
    private int overlap = ChunkingOptions.DEFAULT_OVERLAP;

    /**
     * Character windows used when a PDF yields no table and its raw text is chunked instead.
     */
    private TextFallback textFallback = new TextFallback();

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }

    public void setOverlap(int overlap) {
        this.overlap = overlap;
    }

    public TextFallback getTextFallback() {
        return textFallback;
    }

    public void setTextFallback(TextFallback textFallback) {
        this.textFallback = textFallback;
    }

    public ChunkingOptions toOptions() {
        return new ChunkingOptions(chunkSize, overlap);
    }

    public static class TextFallback {

        /**
         * Characters per text piece.
         */
        private int window = 1000;

        /**
         * Characters shared by consecutive text pieces.
         */
        private int overlap = 200;

        public int getWindow() {
            return window;
        }

        public void setWindow(int window) {
            this.window = window;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }
}

package com.example.chunker.config;

import com.example.chunker.domain.model.ChunkingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ChunkingProperties.class)
public class ChunkingConfig {

    private static final Logger log = LoggerFactory.getLogger(ChunkingConfig.class);

    /**
     * Default window settings, validated at startup so a bad {@code chunker.*} value fails fast.
     */
    @Bean
    public ChunkingOptions defaultChunkingOptions(ChunkingProperties properties) {
        ChunkingOptions options = properties.toOptions();
        ChunkingProperties.TextFallback textFallback = properties.getTextFallback();
        if (textFallback.getWindow() < 1 || textFallback.getOverlap() < 0
                || textFallback.getOverlap() >= textFallback.getWindow()) {
            throw new IllegalStateException("chunker.text-fallback requires window >= 1 and 0 <= overlap < window");
        }
        log.info("Chunking defaults: chunkSize={}, overlap={}, text fallback window={} overlap={}",
                options.chunkSize(), options.overlap(), textFallback.getWindow(), textFallback.getOverlap());
        return options;
    }
}

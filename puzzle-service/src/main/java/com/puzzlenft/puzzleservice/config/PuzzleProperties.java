package com.puzzlenft.puzzleservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;

/**
 * Settings under {@code puzzle.*}
 */
@Data
@ConfigurationProperties(prefix = "puzzle")
public class PuzzleProperties {

    /**
     * Identifier of this program/network; the authority identity is derived from it.
     */
    private String programId = "puzzle-nft";

    private Authority authority = new Authority();
    private Generator generator = new Generator();
    private Entropy entropy = new Entropy();
    private Mint mint = new Mint();
    private Collection collection = new Collection();

    @Data
    public static class Authority {
        private String seed = "authority";
        /**
         * Explicit authority identity (64 hex chars). Overrides the derived one when set.
         */
        private String identity;
    }

    @Data
    public static class Generator {
        private GeneratorVariant variant = GeneratorVariant.ITERATED_HASH;
    }

    @Data
    public static class Entropy {
        private Instant genesis = Instant.parse("2024-01-01T00:00:00Z");
        private Duration slotDuration = Duration.ofMillis(400);
    }

    @Data
    public static class Mint {
        private boolean hiddenTrait = true;
    }

    @Data
    public static class Collection {
        private String defaultName = "Puzzle NFT Collection";
        private String defaultUri = "https://example.com/collection-metadata.json";
    }

    public enum GeneratorVariant {
        ITERATED_HASH,
        SEED_COMMITMENT
    }
}

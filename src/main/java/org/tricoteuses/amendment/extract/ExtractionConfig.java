package org.tricoteuses.amendment.extract;

/**
 * Batch extraction options.
 *
 * @param parallelism worker threads parsing blocks; 1 parses on the caller thread
 */
public record ExtractionConfig(int parallelism) {
    public static final ExtractionConfig DEFAULT = new ExtractionConfig(
        Math.max(1, Runtime.getRuntime().availableProcessors())
    );

    public static final ExtractionConfig SEQUENTIAL = new ExtractionConfig(1);

    public ExtractionConfig {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
    }
}

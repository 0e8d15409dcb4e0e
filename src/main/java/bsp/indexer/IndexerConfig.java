package bsp.indexer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import bsp.indexer.model.Values;

/**
 * Tunables for one indexing run. Defaults match the server-side indexer; {@link Main}
 * overrides them from command-line flags.
 */
public record IndexerConfig(
        int batchSize,
        int workers,
        int symbolValueLimit,
        int propertyValueLimit,
        List<String> excludePatterns
) {

    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final int DEFAULT_WORKERS = 8;

    public static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of(
            "*/tmp/work/*",
            "*/.git/*",
            "*/sstate-cache/*",
            "*/downloads/*"
    );

    public IndexerConfig {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1: " + batchSize);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1: " + workers);
        }
        if (symbolValueLimit < 0 || propertyValueLimit < 0) {
            throw new IllegalArgumentException("value limits must be >= 0");
        }
        excludePatterns = List.copyOf(Objects.requireNonNull(excludePatterns, "excludePatterns"));
    }

    public static IndexerConfig defaults() {
        return new IndexerConfig(
                DEFAULT_BATCH_SIZE,
                DEFAULT_WORKERS,
                Values.SYMBOL_VALUE_LIMIT,
                Values.PROPERTY_VALUE_LIMIT,
                DEFAULT_EXCLUDE_PATTERNS);
    }

    public IndexerConfig withBatchSize(int size) {
        return new IndexerConfig(size, workers, symbolValueLimit, propertyValueLimit, excludePatterns);
    }

    public IndexerConfig withWorkers(int count) {
        return new IndexerConfig(batchSize, count, symbolValueLimit, propertyValueLimit, excludePatterns);
    }

    public IndexerConfig withAdditionalExcludes(Collection<String> patterns) {
        final List<String> merged = new ArrayList<>(excludePatterns);
        for (String p : patterns) {
            if (!merged.contains(p)) {
                merged.add(p);
            }
        }
        return new IndexerConfig(batchSize, workers, symbolValueLimit, propertyValueLimit, merged);
    }
}

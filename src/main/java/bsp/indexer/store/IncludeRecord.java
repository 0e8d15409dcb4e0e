package bsp.indexer.store;

/**
 * A stored include edge; {@code toPath} is unresolved, exactly as written in source.
 */
public record IncludeRecord(
        String fromPath,
        String toPath,
        String kind,
        int line
) {
}

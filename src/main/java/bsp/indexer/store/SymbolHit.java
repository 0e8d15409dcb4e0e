package bsp.indexer.store;

/**
 * A stored symbol joined with the path of its file.
 */
public record SymbolHit(
        long id,
        String name,
        String value,
        String kind,
        String filePath,
        int line
) {
}

package bsp.indexer.model;

/**
 * Row counts for one committed batch, or the sum over a whole run.
 */
public record IndexCounters(
        long files,
        long symbols,
        long includes,
        long treeNodes,
        long treeProperties,
        long skipped
) {
    public static final IndexCounters ZERO = new IndexCounters(0, 0, 0, 0, 0, 0);

    public IndexCounters plus(IndexCounters other) {
        return new IndexCounters(
                files + other.files,
                symbols + other.symbols,
                includes + other.includes,
                treeNodes + other.treeNodes,
                treeProperties + other.treeProperties,
                skipped + other.skipped);
    }

    public IndexCounters plusSkipped(long count) {
        return new IndexCounters(files, symbols, includes, treeNodes, treeProperties, skipped + count);
    }
}

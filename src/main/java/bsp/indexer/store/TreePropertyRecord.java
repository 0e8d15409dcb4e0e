package bsp.indexer.store;

public record TreePropertyRecord(
        long nodeId,
        String name,
        String value,
        int line
) {
}

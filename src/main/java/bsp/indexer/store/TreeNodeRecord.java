package bsp.indexer.store;

/**
 * A stored device-tree node joined with the path of its file.
 */
public record TreeNodeRecord(
        long id,
        String filePath,
        String path,
        String name,
        String label,
        String address,
        Long parentId,
        int startLine,
        int endLine
) {
}

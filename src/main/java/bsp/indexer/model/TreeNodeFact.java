package bsp.indexer.model;

import java.util.Objects;

/**
 * A device-tree node with its computed hierarchical path.
 * <p>
 * {@code parentPath} is the path of the scope that was open when the node was opened,
 * or {@code null} for top-level nodes.
 */
public record TreeNodeFact(
        String path,
        String name,
        String label,       // nullable
        String address,     // nullable, hex digits after '@'
        String parentPath,  // nullable
        int startLine,
        int endLine
) {
    public TreeNodeFact {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(name, "name");
    }
}

package bsp.indexer.model;

/**
 * A property line attributed to the node open at {@code nodePath}.
 */
public record TreePropertyFact(
        String nodePath,
        String name,
        String value,   // "" for boolean properties, already truncated
        int line
) {
}

package bsp.indexer.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything extracted from one file, ready for the store writer.
 */
public record FileFacts(
        FileRecord file,
        List<SymbolFact> symbols,
        List<IncludeFact> includes,
        List<TreeNodeFact> treeNodes,
        List<TreePropertyFact> treeProperties
) {
    public FileFacts {
        Objects.requireNonNull(file, "file");
        symbols = List.copyOf(symbols);
        includes = List.copyOf(includes);
        treeNodes = List.copyOf(treeNodes);
        treeProperties = List.copyOf(treeProperties);
    }
}

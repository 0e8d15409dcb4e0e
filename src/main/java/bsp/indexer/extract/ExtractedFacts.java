package bsp.indexer.extract;

import java.util.List;

import bsp.indexer.model.IncludeFact;
import bsp.indexer.model.SymbolFact;
import bsp.indexer.model.TreeNodeFact;
import bsp.indexer.model.TreePropertyFact;

/**
 * Facts of one file in emission order.
 */
public record ExtractedFacts(
        List<SymbolFact> symbols,
        List<IncludeFact> includes,
        List<TreeNodeFact> treeNodes,
        List<TreePropertyFact> treeProperties
) {
    public ExtractedFacts {
        symbols = List.copyOf(symbols);
        includes = List.copyOf(includes);
        treeNodes = List.copyOf(treeNodes);
        treeProperties = List.copyOf(treeProperties);
    }
}

package bsp.indexer.model;

/**
 * Kind tag stored in {@code symbols.type}.
 */
public enum SymbolKind {
    VARIABLE("variable"),
    LABEL("label"),
    LABEL_REFERENCE("label-reference"),
    DEFINE("define");

    private final String id;

    SymbolKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}

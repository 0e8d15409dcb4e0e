package bsp.indexer.model;

/**
 * How a file referenced another path; stored in {@code includes.type}.
 */
public enum IncludeKind {
    REQUIRE("require"),
    INCLUDE("include"),
    INHERIT("inherit"),
    PREPROCESSOR_INCLUDE("preprocessor-include");

    private final String id;

    IncludeKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}

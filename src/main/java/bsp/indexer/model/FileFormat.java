package bsp.indexer.model;

import java.util.Locale;

/**
 * Format family of an indexed file, selected by extension.
 */
public enum FileFormat {
    RECIPE("recipe"),
    CONFIG("config"),
    HEADER("header"),
    TREE_SOURCE("tree-source");

    private final String id;

    FileFormat(String id) {
        this.id = id;
    }

    /** Value stored in {@code files.type}. */
    public String id() {
        return id;
    }

    public static FileFormat fromId(String id) {
        for (FileFormat f : values()) {
            if (f.id.equals(id)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unknown file format: " + id);
    }

    /**
     * Classifies a file name by the text after its last dot.
     *
     * @return the format, or {@code null} if the extension is not indexed
     */
    public static FileFormat forFileName(String fileName) {
        if (fileName == null) {
            return null;
        }
        final int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return null;
        }
        return switch (fileName.substring(dot).toLowerCase(Locale.ROOT)) {
            case ".bb", ".bbappend", ".inc" -> RECIPE;
            case ".conf" -> CONFIG;
            case ".h" -> HEADER;
            case ".dts", ".dtsi" -> TREE_SOURCE;
            default -> null;
        };
    }
}

package bsp.indexer.scan;

import java.nio.file.Path;

import bsp.indexer.model.FileFormat;

/**
 * A crawled file that has an indexed extension.
 */
public record SourceFile(
        Path absolutePath,
        String relativePath,
        String name,
        FileFormat format
) {
}

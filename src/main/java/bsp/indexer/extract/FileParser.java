package bsp.indexer.extract;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import bsp.indexer.IndexerConfig;
import bsp.indexer.model.FileFacts;
import bsp.indexer.model.FileFormat;
import bsp.indexer.model.FileRecord;
import bsp.indexer.scan.SourceFile;

/**
 * Reads one crawled file and runs the extractor for its format.
 * Recipes and configuration files share the BitBake extractor.
 * <p>
 * Never throws: any failure becomes a {@link ParseOutcome#skipped} result.
 */
public final class FileParser {

    private final FactExtractor recipes;
    private final FactExtractor deviceTrees;
    private final FactExtractor headers;

    public FileParser(IndexerConfig config) {
        Objects.requireNonNull(config, "config");
        this.recipes = new RecipeExtractor(config.symbolValueLimit());
        this.deviceTrees = new DeviceTreeExtractor(config.symbolValueLimit(), config.propertyValueLimit());
        this.headers = new HeaderExtractor(config.symbolValueLimit());
    }

    public ParseOutcome parse(SourceFile file) {
        Objects.requireNonNull(file, "file");
        try {
            final BasicFileAttributes attrs = Files.readAttributes(file.absolutePath(), BasicFileAttributes.class);
            final String content = decode(Files.readAllBytes(file.absolutePath()));

            final FileRecord record = new FileRecord(
                    file.relativePath(),
                    file.name(),
                    file.format(),
                    attrs.size(),
                    attrs.lastModifiedTime().to(TimeUnit.SECONDS));

            final ExtractedFacts facts = extractorFor(file.format()).extract(content);
            return ParseOutcome.parsed(file, new FileFacts(
                    record,
                    facts.symbols(),
                    facts.includes(),
                    facts.treeNodes(),
                    facts.treeProperties()));

        } catch (Exception ex) {
            return ParseOutcome.skipped(file, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }

    FactExtractor extractorFor(FileFormat format) {
        return switch (format) {
            case RECIPE, CONFIG -> recipes;
            case TREE_SOURCE -> deviceTrees;
            case HEADER -> headers;
        };
    }

    // Undecodable bytes are dropped, the rest of the file is still indexed.
    private static String decode(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }
}

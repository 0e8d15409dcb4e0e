package bsp.indexer.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import bsp.indexer.model.IndexCounters;

/**
 * Writes {@code meta.json} next to the index file once a run has completed.
 * Its presence marks the snapshot in the same directory as complete.
 */
public final class SummaryWriter {

    public static final String FILE_NAME = "meta.json";

    private final Path outDir;
    private final ObjectMapper jsonMapper;

    public SummaryWriter(Path outDir) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path summaryFile() {
        return outDir.resolve(FILE_NAME);
    }

    /**
     * Removes a summary left by an earlier run, so a failed run cannot be mistaken for a complete one.
     */
    public void deleteStale() throws IOException {
        Files.deleteIfExists(summaryFile());
    }

    public Path write(Summary summary) throws IOException {
        Objects.requireNonNull(summary, "summary");
        Files.createDirectories(outDir);
        final Path file = summaryFile();
        jsonMapper.writeValue(file.toFile(), summary);
        return file;
    }

    public Summary read() throws IOException {
        return jsonMapper.readValue(summaryFile().toFile(), Summary.class);
    }

    public static Summary summaryOf(String lastSaved, String savedBy, String indexerVersion,
                                    double elapsedSeconds, IndexCounters counters) {
        return new Summary(
                lastSaved,
                savedBy,
                indexerVersion,
                Math.round(elapsedSeconds * 10.0) / 10.0,
                new Stats(counters.files(), counters.symbols(), counters.includes(),
                        counters.treeNodes(), counters.skipped()));
    }

    // --- meta.json records ---

    public record Summary(
            String lastSaved,       // ISO-8601
            String savedBy,
            String indexerVersion,
            double elapsed,         // seconds
            Stats stats
    ) {
    }

    public record Stats(
            long files,
            long symbols,
            long includes,
            long dtNodes,
            long skipped
    ) {
    }
}

package bsp.indexer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import bsp.indexer.extract.FileParser;
import bsp.indexer.index.IndexingException;
import bsp.indexer.index.ParseCoordinator;
import bsp.indexer.index.ProgressListener;
import bsp.indexer.io.SummaryWriter;
import bsp.indexer.model.IndexCounters;
import bsp.indexer.scan.ExclusionRules;
import bsp.indexer.scan.ProjectCrawler;
import bsp.indexer.scan.SourceFile;
import bsp.indexer.store.IndexStore;
import bsp.indexer.store.StoreWriter;

/**
 * One full indexing run: fresh store, crawl, parallel parse with batched commits,
 * metadata, then {@code meta.json}.
 * No incremental logic: every run replaces the previous snapshot.
 */
public final class BspIndexer {

    private static final Logger log = LoggerFactory.getLogger(BspIndexer.class);

    public static final String DEFAULT_INDEX_DIR = ".bsp-index";
    public static final String DEFAULT_INDEX_FILE = "index.bspidx";

    private final Path projectRoot;
    private final Path output;
    private final IndexerConfig config;

    public BspIndexer(Path projectRoot, Path output, IndexerConfig config) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        this.output = output != null
                ? output.toAbsolutePath().normalize()
                : defaultOutput(this.projectRoot);
        this.config = Objects.requireNonNull(config, "config");
    }

    public static Path defaultOutput(Path projectRoot) {
        return projectRoot.resolve(DEFAULT_INDEX_DIR).resolve(DEFAULT_INDEX_FILE);
    }

    public Path output() {
        return output;
    }

    /**
     * @throws IOException       if the project root is missing or the store cannot be created or finalized
     * @throws IndexingException if a batch cannot be committed; no metadata and no summary are written
     */
    public RunResult run(ProgressListener progress) throws IOException, IndexingException {
        Objects.requireNonNull(progress, "progress");
        if (!Files.isDirectory(projectRoot)) {
            throw new IOException("Project directory not found: " + projectRoot);
        }

        final Instant start = Instant.now();
        final Path outDir = output.getParent();
        Files.createDirectories(outDir);

        final SummaryWriter summaryWriter = new SummaryWriter(outDir);
        summaryWriter.deleteStale();

        final IndexCounters counters;
        try (IndexStore store = IndexStore.create(output);
             ParseCoordinator coordinator = new ParseCoordinator(
                     config, new FileParser(config), new StoreWriter(store)::writeBatch)) {

            final ProjectCrawler crawler = new ProjectCrawler(projectRoot, new ExclusionRules(config.excludePatterns()));
            final List<SourceFile> files = crawler.crawl();
            log.info("Found {} files to index under {}", files.size(), projectRoot);

            counters = coordinator.run(files, progress);
            store.writeMetadata(metadata(Instant.now()));
        } catch (SQLException ex) {
            throw new IOException("Index store failure at " + output + ": " + ex.getMessage(), ex);
        }

        final double elapsed = Duration.between(start, Instant.now()).toMillis() / 1000.0;
        summaryWriter.write(SummaryWriter.summaryOf(
                Instant.now().toString(), invokingUser(), IndexStore.INDEXER_VERSION, elapsed, counters));

        log.info("Indexed {} files ({} symbols, {} includes, {} tree nodes, {} skipped) in {}s",
                counters.files(), counters.symbols(), counters.includes(), counters.treeNodes(),
                counters.skipped(), elapsed);
        return new RunResult(output, counters, elapsed);
    }

    private Map<String, String> metadata(Instant now) {
        final Map<String, String> md = new LinkedHashMap<>();
        md.put("last_index_time", Long.toString(now.toEpochMilli()));
        md.put("project_path", projectRoot.toString());
        md.put("indexer_version", IndexStore.INDEXER_VERSION);
        return md;
    }

    static String invokingUser() {
        final String user = System.getenv("USER");
        if (user != null && !user.isBlank()) {
            return user;
        }
        final String username = System.getenv("USERNAME");
        if (username != null && !username.isBlank()) {
            return username;
        }
        return "unknown";
    }

    public record RunResult(
            Path output,
            IndexCounters counters,
            double elapsedSeconds
    ) {
    }
}

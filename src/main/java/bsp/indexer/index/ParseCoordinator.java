package bsp.indexer.index;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import bsp.indexer.IndexerConfig;
import bsp.indexer.extract.FileParser;
import bsp.indexer.extract.ParseOutcome;
import bsp.indexer.model.FileFacts;
import bsp.indexer.model.IndexCounters;
import bsp.indexer.model.Values;
import bsp.indexer.scan.SourceFile;

/**
 * Parses crawled files on a fixed worker pool, one batch at a time, and hands each
 * finished batch to a {@link BatchSink} on the calling thread.
 * <p>
 * The next batch is not dispatched before the sink returns, so at most one batch of
 * results is held in memory and only the calling thread touches the store.
 */
public final class ParseCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParseCoordinator.class);

    private final FileParser parser;
    private final BatchSink sink;
    private final int batchSize;
    private final ExecutorService pool;

    public ParseCoordinator(IndexerConfig config, FileParser parser, BatchSink sink) {
        Objects.requireNonNull(config, "config");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.batchSize = config.batchSize();
        this.pool = Executors.newFixedThreadPool(config.workers(), new ParseThreadFactory());
    }

    /**
     * @return counters summed over all committed batches, plus the number of skipped files
     * @throws IndexingException if a batch cannot be persisted; earlier batches stay committed
     */
    public IndexCounters run(List<SourceFile> files, ProgressListener progress) throws IndexingException {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(progress, "progress");

        final int total = files.size();
        IndexCounters totals = IndexCounters.ZERO;
        int processed = 0;
        int batchNumber = 0;

        for (int start = 0; start < total; start += batchSize) {
            batchNumber++;
            final List<SourceFile> batch = files.subList(start, Math.min(start + batchSize, total));

            final List<FileFacts> parsed = new ArrayList<>(batch.size());
            final long skipped = parseBatch(batch, batchNumber, parsed);

            try {
                totals = totals.plus(sink.write(parsed)).plusSkipped(skipped);
            } catch (SQLException | RuntimeException ex) {
                throw new IndexingException("Failed to commit batch " + batchNumber
                        + " (starting at " + batch.get(0).relativePath() + "): "
                        + Values.safeMsg(ex.getMessage()), batchNumber, ex);
            }

            processed += batch.size();
            progress.onProgress(processed, total);
        }

        log.debug("Indexed {} files in {} batches, {} skipped", totals.files(), batchNumber, totals.skipped());
        return totals;
    }

    private long parseBatch(List<SourceFile> batch, int batchNumber, List<FileFacts> out) throws IndexingException {
        final List<Callable<ParseOutcome>> tasks = new ArrayList<>(batch.size());
        for (SourceFile file : batch) {
            tasks.add(() -> parser.parse(file));
        }

        final List<Future<ParseOutcome>> futures;
        try {
            futures = pool.invokeAll(tasks);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IndexingException("Interrupted while parsing batch " + batchNumber, batchNumber, ex);
        }

        long skipped = 0;
        for (int i = 0; i < futures.size(); i++) {
            final ParseOutcome outcome = outcomeOf(futures.get(i), batch.get(i));
            if (outcome.isParsed()) {
                out.add(outcome.facts());
            } else {
                skipped++;
                log.warn("Skipping {}: {}", outcome.source().relativePath(), Values.safeMsg(outcome.skipReason()));
            }
        }
        return skipped;
    }

    private static ParseOutcome outcomeOf(Future<ParseOutcome> future, SourceFile file) {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            final Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            return ParseOutcome.skipped(file, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException ex) {
            // invokeAll already waited for completion; get() cannot block here
            Thread.currentThread().interrupt();
            return ParseOutcome.skipped(file, "interrupted");
        }
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    private static final class ParseThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            final Thread t = new Thread(r, "bsp-parse-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}

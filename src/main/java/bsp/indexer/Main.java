package bsp.indexer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import bsp.indexer.index.IndexingException;
import bsp.indexer.model.IndexCounters;
import bsp.indexer.model.Values;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path projectRoot = null;
        Path output = null;
        IndexerConfig config = IndexerConfig.defaults();
        final Set<String> excludes = new LinkedHashSet<>();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--output=")) {
                    output = Paths.get(arg.substring("--output=".length()));
                    continue;
                }
                if (arg.startsWith("--batchSize=")) {
                    config = config.withBatchSize(Integer.parseInt(arg.substring("--batchSize=".length()).trim()));
                    continue;
                }
                if (arg.startsWith("--workers=")) {
                    config = config.withWorkers(Integer.parseInt(arg.substring("--workers=".length()).trim()));
                    continue;
                }
                if (arg.startsWith("--exclude=")) {
                    Arrays.stream(arg.substring("--exclude=".length()).split(","))
                            .map(String::trim)
                            .filter(s -> !s.isEmpty())
                            .forEach(excludes::add);
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (projectRoot == null) {
                    projectRoot = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }
        } catch (IllegalArgumentException ex) {
            // NumberFormatException included
            System.err.println("ERROR: invalid option value: " + Values.safeMsg(ex.getMessage()));
            printUsage();
            return 2;
        }

        if (projectRoot == null) {
            System.err.println("ERROR: project path is required");
            printUsage();
            return 2;
        }
        if (!excludes.isEmpty()) {
            config = config.withAdditionalExcludes(excludes);
        }

        try {
            final BspIndexer indexer = new BspIndexer(projectRoot, output, config);
            System.out.println("[BSP Indexer] Project: " + projectRoot.toAbsolutePath().normalize());
            System.out.println("[BSP Indexer] Output: " + indexer.output());

            final var result = indexer.run(Main::printProgress);
            System.out.println();

            final IndexCounters c = result.counters();
            System.out.printf(Locale.ROOT, "[BSP Indexer] Completed in %.1fs%n", result.elapsedSeconds());
            System.out.println("  Files: " + c.files());
            System.out.println("  Symbols: " + c.symbols());
            System.out.println("  Includes: " + c.includes());
            System.out.println("  DT Nodes: " + c.treeNodes());
            if (c.skipped() > 0) {
                System.err.println("WARN: skipped files: " + c.skipped());
            }
            System.out.println("Index saved: " + result.output());
            return 0;
        } catch (IndexingException ex) {
            System.out.println();
            System.err.println("ERROR: indexing failed, snapshot is incomplete: " + safeCause(ex));
            return 1;
        } catch (java.io.IOException ex) {
            System.err.println("ERROR: IO failure: " + safeCause(ex));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to build index: " + safeCause(ex));
            return 1;
        }
    }

    private static void printProgress(int processed, int total) {
        final double pct = total == 0 ? 100.0 : processed * 100.0 / total;
        System.out.printf(Locale.ROOT, "\r[BSP Indexer] Progress: %d/%d (%.1f%%)", processed, total, pct);
        System.out.flush();
    }

    private static void printUsage() {
        System.out.println("Usage: bsp-indexer <projectPath> [options]");
        System.out.println("Options:");
        System.out.println("  --output=<file>         Index file (default: <projectPath>/.bsp-index/index.bspidx)");
        System.out.println("  --batchSize=<n>         Files per committed batch (default: " + IndexerConfig.DEFAULT_BATCH_SIZE + ")");
        System.out.println("  --workers=<n>           Parallel parse workers (default: " + IndexerConfig.DEFAULT_WORKERS + ")");
        System.out.println("  --exclude=<g1,g2>       Extra directory globs to skip, e.g. */build/*");
        System.out.println("  --help, -h              Show this help");
    }

    private static String safeCause(Exception ex) {
        return ex.getClass().getSimpleName() + ": " + Values.safeMsg(ex.getMessage());
    }
}

package bsp.indexer.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import bsp.indexer.model.FileFormat;
import bsp.indexer.model.Values;

/**
 * Walks a project tree and collects every file with an indexed extension:
 * - recipes: .bb, .bbappend, .inc
 * - configs: .conf
 * - headers: .h
 * - device trees: .dts, .dtsi
 * <p>
 * Excluded directories are pruned with their whole subtree. Unreadable entries are skipped.
 */
public final class ProjectCrawler {

    private static final Logger log = LoggerFactory.getLogger(ProjectCrawler.class);

    private final Path projectRoot;
    private final ExclusionRules exclusions;

    public ProjectCrawler(Path projectRoot, ExclusionRules exclusions) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        this.exclusions = Objects.requireNonNull(exclusions, "exclusions");
    }

    public List<SourceFile> crawl() throws IOException {
        if (!Files.isDirectory(projectRoot)) {
            throw new IOException("Project root is not a directory: " + projectRoot);
        }

        final List<SourceFile> out = new ArrayList<>();
        Files.walkFileTree(projectRoot, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                final String rel = Values.relativePath(projectRoot, dir);
                if (exclusions.isExcludedDirectory(rel)) {
                    log.debug("Pruning excluded directory {}", rel);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                final String name = file.getFileName() != null ? file.getFileName().toString() : "";
                final FileFormat format = FileFormat.forFileName(name);
                if (format != null) {
                    out.add(new SourceFile(file, Values.relativePath(projectRoot, file), name, format));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                // unreadable directory or broken entry: not fatal for a crawl
                log.debug("Skipping unreadable path {}: {}", file, Values.safeMsg(exc.getMessage()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                if (exc != null) {
                    log.debug("Listing of {} ended early: {}", dir, Values.safeMsg(exc.getMessage()));
                }
                return FileVisitResult.CONTINUE;
            }
        });

        log.debug("Crawl of {} found {} candidate files", projectRoot, out.size());
        return out;
    }

    public Path projectRoot() {
        return projectRoot;
    }
}

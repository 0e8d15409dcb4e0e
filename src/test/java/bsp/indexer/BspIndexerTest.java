package bsp.indexer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import bsp.indexer.index.ProgressListener;
import bsp.indexer.io.SummaryWriter;
import bsp.indexer.store.IndexReader;
import bsp.indexer.store.IndexStore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BspIndexerTest {

    @TempDir
    Path root;

    @Test
    void indexesProjectAndWritesSummary() throws Exception {
        layout();
        final BspIndexer indexer = new BspIndexer(root, null, IndexerConfig.defaults().withBatchSize(2));

        final BspIndexer.RunResult result = indexer.run(ProgressListener.NONE);

        assertThat(result.output()).isEqualTo(root.resolve(".bsp-index/index.bspidx").toAbsolutePath().normalize());
        assertThat(result.output()).isRegularFile();
        assertThat(result.counters().files()).isEqualTo(4);
        assertThat(result.counters().skipped()).isZero();
        assertThat(result.counters().treeNodes()).isEqualTo(2);

        try (IndexStore store = IndexStore.open(result.output())) {
            final IndexReader reader = new IndexReader(store);
            assertThat(reader.findFile("build/tmp/work/armv8a/foo/foo.bb")).isEmpty();
            assertThat(reader.findFile(".git/config.conf")).isEmpty();
            assertThat(reader.findSymbol("MACHINE")).isPresent();
            assertThat(reader.findSymbol("WORK_ONLY")).isEmpty();
            assertThat(reader.counts().symbols()).isEqualTo(result.counters().symbols());
        }

        final SummaryWriter.Summary summary = new SummaryWriter(result.output().getParent()).read();
        assertThat(summary.indexerVersion()).isEqualTo(IndexStore.INDEXER_VERSION);
        assertThat(summary.stats().files()).isEqualTo(4);
        assertThat(summary.stats().dtNodes()).isEqualTo(2);
        assertThat(summary.savedBy()).isNotBlank();
        assertThat(summary.elapsed()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    void rerunProducesTheSameSnapshot() throws Exception {
        layout();
        final Path output = root.resolve("out/custom.bspidx");
        final BspIndexer indexer = new BspIndexer(root, output, IndexerConfig.defaults().withWorkers(3));

        indexer.run(ProgressListener.NONE);
        final Set<String> first = snapshot(output);
        indexer.run(ProgressListener.NONE);
        final Set<String> second = snapshot(output);

        assertThat(first).isNotEmpty();
        assertThat(second).isEqualTo(first);
        assertThat(output.resolveSibling("meta.json")).isRegularFile();
    }

    @Test
    void additionalExcludesAreHonoured() throws Exception {
        layout();
        final IndexerConfig config = IndexerConfig.defaults().withAdditionalExcludes(Set.of("*/dts/*"));

        final BspIndexer.RunResult result = new BspIndexer(root, null, config).run(ProgressListener.NONE);

        assertThat(result.counters().files()).isEqualTo(3);
        assertThat(result.counters().treeNodes()).isZero();
    }

    @Test
    void missingProjectRootFailsWithoutOutput() {
        final Path missing = root.resolve("no-such-project");

        assertThatThrownBy(() -> new BspIndexer(missing, null, IndexerConfig.defaults()).run(ProgressListener.NONE))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
        assertThat(missing.resolve(".bsp-index")).doesNotExist();
    }

    private void layout() throws IOException {
        write("meta-board/conf/machine/board.conf", "MACHINE = \"board\"\nrequire conf/machine/include/arm.inc\n");
        write("meta-board/recipes-kernel/linux/linux-board.bb", "inherit kernel\nKERNEL_DEVICETREE = \"board.dtb\"\n");
        write("meta-board/include/board.h", "#define BOARD_ID 7\n");
        write("meta-board/dts/board.dts", "/ {\n\tuart0: serial@1000 {\n\t\tstatus = \"okay\";\n\t};\n};\n");
        write("build/tmp/work/armv8a/foo/foo.bb", "WORK_ONLY = \"1\"\n");
        write(".git/config.conf", "GIT_ONLY = \"1\"\n");
    }

    private void write(String rel, String content) throws IOException {
        final Path file = root.resolve(rel);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static Set<String> snapshot(Path output) throws Exception {
        final Set<String> rows = new HashSet<>();
        try (IndexStore store = IndexStore.open(output);
             Statement st = store.connection().createStatement()) {
            try (ResultSet rs = st.executeQuery(
                    "SELECT s.name, s.value, s.type, f.path, s.line FROM symbols s JOIN files f ON s.file_id = f.id")) {
                while (rs.next()) {
                    rows.add("S|" + rs.getString(1) + "|" + rs.getString(2) + "|" + rs.getString(3)
                            + "|" + rs.getString(4) + "|" + rs.getInt(5));
                }
            }
            try (ResultSet rs = st.executeQuery(
                    "SELECT f.path, i.to_path, i.type, i.line FROM includes i JOIN files f ON i.from_file_id = f.id")) {
                while (rs.next()) {
                    rows.add("I|" + rs.getString(1) + "|" + rs.getString(2) + "|" + rs.getString(3) + "|" + rs.getInt(4));
                }
            }
            try (ResultSet rs = st.executeQuery(
                    "SELECT f.path, n.path, n.label, n.address, n.start_line, n.end_line"
                            + " FROM dt_nodes n JOIN files f ON n.file_id = f.id")) {
                while (rs.next()) {
                    rows.add("N|" + rs.getString(1) + "|" + rs.getString(2) + "|" + rs.getString(3)
                            + "|" + rs.getString(4) + "|" + rs.getInt(5) + "|" + rs.getInt(6));
                }
            }
        }
        return rows;
    }
}

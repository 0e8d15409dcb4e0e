package bsp.indexer.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import bsp.indexer.BspIndexer;
import bsp.indexer.IndexerConfig;
import bsp.indexer.index.ProgressListener;
import bsp.indexer.model.FileFormat;
import bsp.indexer.model.FileRecord;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class IndexReaderTest {

    private static final String RECIPE = """
            require recipes-bsp/u-boot/u-boot-common.inc
            inherit deploy
            UBOOT_MACHINE = "board_defconfig"
            SRC_URI += "file://0001-fix.patch"
            """;

    private static final String BOARD_DTS = """
            /dts-v1/;
            #include "board.h"
            / {
            \tmodel = "Board";
            \tsoc {
            \t\tuart1: serial@30860000 {
            \t\t\tcompatible = "fsl,imx-uart";
            \t\t\tstatus = "disabled";
            \t\t};
            \t};
            \tchosen {
            \t\tstdout-path = &uart1;
            \t};
            };
            &uart1 {
            \tstatus = "okay";
            };
            &uart10 {
            \tstatus = "okay";
            };
            aliases {
            \tserial1 = &uart10;
            };
            """;

    @TempDir
    Path root;

    private IndexStore store;
    private IndexReader reader;

    @BeforeEach
    void buildIndex() throws Exception {
        write("meta-board/recipes-bsp/u-boot/u-boot-board_2023.04.bb", RECIPE);
        write("meta-board/recipes-bsp/u-boot/u-boot-common.inc", "LICENSE = \"GPLv2+\"\n");
        write("meta-board/include/board.h", "#include \"pinmux.h\"\n#define BOARD_UART 1\n");
        write("meta-board/include/pinmux.h", "#define PINMUX_UART 3\n");
        write("meta-board/dts/board.dts", BOARD_DTS);

        final BspIndexer indexer = new BspIndexer(root, null, IndexerConfig.defaults().withWorkers(2));
        indexer.run(ProgressListener.NONE);
        store = IndexStore.open(indexer.output());
        reader = new IndexReader(store);
    }

    @AfterEach
    void closeStore() throws Exception {
        store.close();
    }

    @Test
    void searchesSymbolsByPrefix() throws Exception {
        assertThat(reader.searchSymbols("UBOOT", 10))
                .extracting(SymbolHit::name)
                .contains("UBOOT_MACHINE");
        assertThat(reader.searchSymbols("  ", 10)).isEmpty();
    }

    @Test
    void punctuatedQueriesFallBackToSubstringMatch() throws Exception {
        assertThat(reader.searchSymbols("0001-fix", 10))
                .singleElement()
                .satisfies(hit -> {
                    assertThat(hit.name()).isEqualTo("SRC_URI");
                    assertThat(hit.kind()).isEqualTo("variable");
                    assertThat(hit.line()).isEqualTo(4);
                });
    }

    @Test
    void findsSymbolWithItsFile() throws Exception {
        assertThat(reader.findSymbol("BOARD_UART")).hasValueSatisfying(hit -> {
            assertThat(hit.kind()).isEqualTo("define");
            assertThat(hit.value()).isEqualTo("1");
            assertThat(hit.filePath()).isEqualTo("meta-board/include/board.h");
            assertThat(hit.line()).isEqualTo(2);
        });
        assertThat(reader.findSymbol("NOPE")).isEmpty();
    }

    @Test
    void searchesAndFindsFiles() throws Exception {
        final List<FileRecord> files = reader.searchFiles("board.h", 10);
        assertThat(files).extracting(FileRecord::path).containsExactly("meta-board/include/board.h");

        assertThat(reader.findFile("meta-board/dts/board.dts"))
                .hasValueSatisfying(f -> assertThat(f.format()).isEqualTo(FileFormat.TREE_SOURCE));
    }

    @Test
    void followsIncludeEdgesInBothDirections() throws Exception {
        assertThat(reader.includesOf("meta-board/recipes-bsp/u-boot/u-boot-board_2023.04.bb"))
                .extracting(IncludeRecord::toPath, IncludeRecord::kind, IncludeRecord::line)
                .containsExactly(
                        tuple("recipes-bsp/u-boot/u-boot-common.inc", "require", 1),
                        tuple("classes/deploy.bbclass", "inherit", 2));

        assertThat(reader.filesIncluding("meta-board/recipes-bsp/u-boot/u-boot-common.inc"))
                .containsExactly("meta-board/recipes-bsp/u-boot/u-boot-board_2023.04.bb");
        assertThat(reader.filesIncluding("meta-board/include/board.h"))
                .containsExactly("meta-board/dts/board.dts");
        assertThat(reader.filesIncluding("meta-board/include/pinmux.h"))
                .containsExactly("meta-board/include/board.h");
    }

    @Test
    void navigatesTheDeviceTree() throws Exception {
        final TreeNodeRecord serial = reader.findTreeNodeByLabel("uart1").orElseThrow();
        assertThat(serial.path()).isEqualTo("/soc/serial");
        assertThat(serial.startLine()).isEqualTo(6);
        assertThat(serial.endLine()).isEqualTo(9);
        assertThat(reader.propertiesOf(serial.id()))
                .extracting(TreePropertyRecord::name, TreePropertyRecord::value)
                .containsExactly(
                        tuple("compatible", "\"fsl,imx-uart\""),
                        tuple("status", "\"disabled\""));

        final TreeNodeRecord rootNode = reader.findTreeNodesByPath("/").get(0);
        assertThat(rootNode.parentId()).isNull();
        assertThat(reader.childrenOf(rootNode.id()))
                .extracting(TreeNodeRecord::path)
                .containsExactly("/soc", "/chosen");
    }

    @Test
    void labelReferencesListDefinitionFirst() throws Exception {
        final List<TreeNodeRecord> refs = reader.findLabelReferences("uart1", 10);

        assertThat(refs).extracting(TreeNodeRecord::path, TreeNodeRecord::startLine)
                .containsExactly(
                        tuple("/soc/serial", 6),
                        tuple("/chosen", 11));
        assertThat(reader.findLabelReferences("uart1", 1)).hasSize(1);
    }

    @Test
    void labelReferencesMatchTheWholeLabelOnly() throws Exception {
        assertThat(reader.findLabelReferences("uart1", 10))
                .extracting(TreeNodeRecord::path)
                .doesNotContain("/aliases");
        assertThat(reader.findLabelReferences("uart10", 10))
                .extracting(TreeNodeRecord::path, TreeNodeRecord::startLine)
                .containsExactly(tuple("/aliases", 21));
    }

    @Test
    void findsDefinitionAndEveryReferenceOfALabel() throws Exception {
        assertThat(reader.findAllReferences("uart1", 10))
                .extracting(SymbolHit::name, SymbolHit::kind, SymbolHit::line)
                .containsExactly(
                        tuple("uart1", "label", 6),
                        tuple("&uart1", "label-reference", 12));
        assertThat(reader.findAllReferences("&uart10", 10))
                .extracting(SymbolHit::name, SymbolHit::line)
                .containsExactly(tuple("&uart10", 22));
        assertThat(reader.findAllReferences(" ", 10)).isEmpty();
    }

    @Test
    void searchesLabelledNodesByPrefix() throws Exception {
        assertThat(reader.searchDtNodes("uart", 10))
                .extracting(TreeNodeRecord::path, TreeNodeRecord::label)
                .containsExactly(tuple("/soc/serial", "uart1"));
        assertThat(reader.searchDtNodes("ser", 10))
                .extracting(TreeNodeRecord::label)
                .containsExactly("uart1");
        // unlabelled nodes are not offered
        assertThat(reader.searchDtNodes("chos", 10)).isEmpty();
    }

    @Test
    void likeWildcardsInQueriesAreLiteral() throws Exception {
        assertThat(reader.searchDtNodes("u_rt", 10)).isEmpty();
        assertThat(reader.searchFiles("board_h", 10)).isEmpty();
        assertThat(reader.searchSymbols("%-fix", 10)).isEmpty();
        assertThat(IndexReader.escapeLike("a%b_c\\d")).isEqualTo("a\\%b\\_c\\\\d");
    }

    @Test
    void exposesRunMetadataAndCounts() throws Exception {
        assertThat(reader.metadata("indexer_version")).contains(IndexStore.INDEXER_VERSION);
        assertThat(reader.metadata("project_path")).contains(root.toAbsolutePath().normalize().toString());
        assertThat(reader.metadata("last_index_time")).hasValueSatisfying(v -> assertThat(Long.parseLong(v)).isPositive());

        assertThat(reader.counts().files()).isEqualTo(5);
        assertThat(reader.counts().treeNodes()).isEqualTo(7);
    }

    @Test
    void openRejectsMissingStore() {
        assertThatThrownBy(() -> IndexStore.open(root.resolve("missing.bspidx")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }

    private void write(String rel, String content) throws IOException {
        final Path file = root.resolve(rel);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}

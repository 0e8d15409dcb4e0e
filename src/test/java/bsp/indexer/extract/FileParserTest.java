package bsp.indexer.extract;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import bsp.indexer.IndexerConfig;
import bsp.indexer.model.FileFormat;
import bsp.indexer.model.SymbolKind;
import bsp.indexer.scan.SourceFile;

import static org.assertj.core.api.Assertions.assertThat;

class FileParserTest {

    private final FileParser parser = new FileParser(IndexerConfig.defaults());

    @Test
    void parsesRecipeWithFileMetadata(@TempDir Path tmp) throws Exception {
        final Path file = tmp.resolve("foo_1.0.bb");
        Files.writeString(file, "LICENSE = \"MIT\"\ninherit autotools\n");

        final ParseOutcome outcome = parser.parse(new SourceFile(file, "recipes/foo_1.0.bb", "foo_1.0.bb", FileFormat.RECIPE));

        assertThat(outcome.isParsed()).isTrue();
        assertThat(outcome.skipReason()).isNull();
        final var facts = outcome.facts();
        assertThat(facts.file().path()).isEqualTo("recipes/foo_1.0.bb");
        assertThat(facts.file().name()).isEqualTo("foo_1.0.bb");
        assertThat(facts.file().format()).isEqualTo(FileFormat.RECIPE);
        assertThat(facts.file().size()).isEqualTo(Files.size(file));
        assertThat(facts.file().mtime()).isGreaterThan(0);
        assertThat(facts.symbols()).hasSize(1);
        assertThat(facts.includes()).hasSize(1);
    }

    @Test
    void configFilesUseTheRecipeExtractor(@TempDir Path tmp) throws Exception {
        final Path file = tmp.resolve("local.conf");
        Files.writeString(file, "MACHINE ??= \"imx8mm-evk\"\n");

        final ParseOutcome outcome = parser.parse(new SourceFile(file, "conf/local.conf", "local.conf", FileFormat.CONFIG));

        assertThat(outcome.facts().symbols()).singleElement().satisfies(s -> {
            assertThat(s.name()).isEqualTo("MACHINE");
            assertThat(s.value()).isEqualTo("imx8mm-evk");
            assertThat(s.kind()).isEqualTo(SymbolKind.VARIABLE);
        });
        assertThat(outcome.facts().file().format()).isEqualTo(FileFormat.CONFIG);
    }

    @Test
    void dropsUndecodableBytesInsteadOfFailing(@TempDir Path tmp) throws Exception {
        final Path file = tmp.resolve("board.h");
        final byte[] prefix = "#define A 1\n#define B ".getBytes(StandardCharsets.UTF_8);
        final byte[] bad = {(byte) 0xC3, (byte) 0x28};
        final byte[] suffix = "2\n".getBytes(StandardCharsets.UTF_8);
        final byte[] content = new byte[prefix.length + bad.length + suffix.length];
        System.arraycopy(prefix, 0, content, 0, prefix.length);
        System.arraycopy(bad, 0, content, prefix.length, bad.length);
        System.arraycopy(suffix, 0, content, prefix.length + bad.length, suffix.length);
        Files.write(file, content);

        final ParseOutcome outcome = parser.parse(new SourceFile(file, "board.h", "board.h", FileFormat.HEADER));

        assertThat(outcome.isParsed()).isTrue();
        assertThat(outcome.facts().symbols()).extracting(s -> s.name()).containsExactly("A", "B");
    }

    @Test
    void missingFileBecomesASkipWithReason(@TempDir Path tmp) {
        final Path missing = tmp.resolve("gone.dts");

        final ParseOutcome outcome = parser.parse(new SourceFile(missing, "gone.dts", "gone.dts", FileFormat.TREE_SOURCE));

        assertThat(outcome.isParsed()).isFalse();
        assertThat(outcome.facts()).isNull();
        assertThat(outcome.skipReason()).contains("NoSuchFileException");
    }
}

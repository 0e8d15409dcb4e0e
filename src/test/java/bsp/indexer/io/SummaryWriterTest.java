package bsp.indexer.io;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import bsp.indexer.model.IndexCounters;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryWriterTest {

    @TempDir
    Path outDir;

    @Test
    void writesSummaryWithExpectedFieldNames() throws Exception {
        final SummaryWriter writer = new SummaryWriter(outDir);
        final SummaryWriter.Summary summary = SummaryWriter.summaryOf(
                "2026-10-16T08:00:00Z", "builder", "2.0-server", 12.345,
                new IndexCounters(10, 200, 30, 40, 50, 2));

        final Path file = writer.write(summary);

        assertThat(file).isEqualTo(outDir.resolve("meta.json"));
        final JsonNode json = new ObjectMapper().readTree(file.toFile());
        assertThat(json.path("lastSaved").asText()).isEqualTo("2026-10-16T08:00:00Z");
        assertThat(json.path("savedBy").asText()).isEqualTo("builder");
        assertThat(json.path("indexerVersion").asText()).isEqualTo("2.0-server");
        assertThat(json.path("elapsed").asDouble()).isEqualTo(12.3);
        final JsonNode stats = json.path("stats");
        assertThat(stats.path("files").asLong()).isEqualTo(10);
        assertThat(stats.path("symbols").asLong()).isEqualTo(200);
        assertThat(stats.path("includes").asLong()).isEqualTo(30);
        assertThat(stats.path("dtNodes").asLong()).isEqualTo(40);
        assertThat(stats.path("skipped").asLong()).isEqualTo(2);
        assertThat(stats.has("treeProperties")).isFalse();

        assertThat(writer.read()).isEqualTo(summary);
    }

    @Test
    void deleteStaleRemovesPreviousSummary() throws Exception {
        final SummaryWriter writer = new SummaryWriter(outDir);
        Files.writeString(writer.summaryFile(), "{}");

        writer.deleteStale();
        assertThat(writer.summaryFile()).doesNotExist();

        // no file is fine too
        writer.deleteStale();
    }
}

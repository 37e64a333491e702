package org.scholargraph.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.scholargraph.config.LoggingConfigurator;
import org.scholargraph.junit.extensions.logging.LogWatchExtension;
import org.scholargraph.testutils.CorpusFixture;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Year;

import static org.assertj.core.api.Assertions.*;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path configFile;
    private StringWriter out;
    private StringWriter err;
    private String previousFormat;
    private Level previousRootLevel;

    @BeforeEach
    void setUp() throws Exception {
        LoggingConfigurator.reset();
        previousFormat = System.getProperty(LoggingConfigurator.FORMAT_PROPERTY);
        // Keep the test logback configuration in place.
        System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, "STDOUT_PLAIN");
        previousRootLevel = rootLogger().getLevel();

        int thisYear = Year.now().getValue();
        CorpusFixture.create()
            .matchingPaper("P1", thisYear - 1, 12)
            .matchingPaper("P2", thisYear - 2, 3)
            .matchingPaper("ANCIENT", thisYear - 30, 100)
            .authorship("P1", "A_P2", CorpusFixture.INSTITUTION, "middle")
            .reference("P1", "P2")
            .patentLink("P2", "US7")
            .writeTo(tempDir.resolve("data"));

        String root = tempDir.toAbsolutePath().toString().replace("\\", "/");
        configFile = tempDir.resolve("scholargraph.conf");
        Files.writeString(configFile, """
            scholargraph {
              dataRoot = "%s"
              store.memoryLimit = "512MB"
              query.store.memoryLimit = "512MB"
            }
            """.formatted(root), StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        if (previousFormat == null) {
            System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        } else {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, previousFormat);
        }
        rootLogger().setLevel(previousRootLevel);
    }

    private static Logger rootLogger() {
        return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = configFile.toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return commandLine.execute(withConfig);
    }

    private JsonNode output() throws Exception {
        return MAPPER.readTree(out.toString());
    }

    @Test
    void testCommandName() {
        assertThat(new CommandLine(new CommandLineInterface()).getCommandName()).isEqualTo("scholargraph");
    }

    @Test
    void testFilter_PrintsSummaryAsJson() throws Exception {
        assertThat(run("filter", "--years", "5", "--ids")).isZero();

        JsonNode summary = output();
        assertThat(summary.get("lookback_years").asInt()).isEqualTo(5);
        assertThat(summary.get("paper_count").asInt()).isEqualTo(2);
        assertThat(summary.get("papers_with_patents").asInt()).isEqualTo(1);
        assertThat(summary.get("signature").asText()).hasSize(16);
        assertThat(summary.get("paper_ids")).extracting(JsonNode::asText).containsExactlyInAnyOrder("P1", "P2");
    }

    @Test
    void testGraph_CollaborationSummary() throws Exception {
        assertThat(run("graph", "--type", "collaboration", "--top", "1")).isZero();

        JsonNode summary = output();
        assertThat(summary.get("type").asText()).isEqualTo("collaboration");
        assertThat(summary.get("nodes").asInt()).isEqualTo(2);
        assertThat(summary.get("edges").asInt()).isEqualTo(1);
        assertThat(summary.get("community_detector").asText()).isEqualTo("louvain");
        assertThat(summary.get("top_nodes")).hasSize(1);
        assertThat(summary.get("top_nodes").get(0).has("paper_count")).isTrue();
    }

    @Test
    void testExportSampleThenQuery() throws Exception {
        assertThat(run("export-sample", "-y", "5")).isZero();
        assertThat(output().get("files").get("sample_papers.parquet").asLong()).isEqualTo(2);

        assertThat(run("query", "explore_available_years")).isZero();
        JsonNode response = output();
        assertThat(response.get("operation").asText()).isEqualTo("explore_available_years");
        assertThat(response.get("row_count").asInt()).isEqualTo(2);

        assertThat(run("query", "PAPERS_BY_CITATIONS", "-p", "{\"limit\": 1}")).isZero();
        assertThat(output().get("rows").get(0).get("paperid").asText()).isEqualTo("P1");
    }

    @Test
    void testQuery_InvalidInputExitsWithUsageError() {
        assertThat(run("query", "drop_tables")).isEqualTo(2);
        assertThat(err.toString()).contains("Unknown query operation");

        assertThat(run("query", "query_papers", "-p", "{not json")).isEqualTo(2);
        assertThat(err.toString()).contains("Invalid query");
    }
}

package org.scholargraph.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.scholargraph.junit.extensions.logging.LogWatchExtension;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String OVERRIDE_KEY = "scholargraph.graph.maxCoauthorsPerPaper";

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty(OVERRIDE_KEY);
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws Exception {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }

    @Test
    void testLoad_FileOverridesDefaults() throws Exception {
        String root = tempDir.toAbsolutePath().toString().replace("\\", "/");
        File file = writeConfig("scholargraph {\n  dataRoot = \"" + root + "\"\n  filter.defaultLookbackYears = 3\n}\n");

        Config config = ConfigLoader.load(file);

        assertThat(config.getInt("scholargraph.filter.defaultLookbackYears")).isEqualTo(3);
        assertThat(config.getInt("scholargraph.graph.maxCoauthorsPerPaper")).isEqualTo(50);
        assertThat(config.getString("scholargraph.store.dataDirectory")).isEqualTo(root + "/data");
        assertThat(config.getString("logging.format")).isEqualTo("PLAIN");
    }

    @Test
    void testLoad_SystemPropertiesOverrideFile() throws Exception {
        File file = writeConfig("scholargraph.graph.maxCoauthorsPerPaper = 20\n");
        System.setProperty(OVERRIDE_KEY, "7");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file);

        assertThat(config.getInt(OVERRIDE_KEY)).isEqualTo(7);
    }

    @Test
    void testLoad_WithoutFileUsesDefaults() {
        Config config = ConfigLoader.load();

        assertThat(config.getString("scholargraph.analytics.communityDetector.className"))
            .isEqualTo("org.scholargraph.analytics.community.LouvainCommunityDetector");
        assertThat(config.getString("scholargraph.query.store.tables.papers")).isEqualTo("sample_papers.parquet");
    }

    @Test
    void testLoad_MissingExplicitFileIsRejected() {
        File missing = tempDir.resolve("absent.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("absent.conf");
    }
}

package io.surfworks.convfuse.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import io.surfworks.convfuse.ir.MemoryFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FusionConfigLoader")
class FusionConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("a missing file yields the defaults")
    void missingFile() {
        assertEquals(FusionConfig.defaults(), FusionConfigLoader.load(tempDir.resolve("absent.json")));
    }

    @Test
    @DisplayName("options absent from the file keep their defaults")
    void partialFile() throws IOException {
        Path file = tempDir.resolve("fusion.json");
        Files.writeString(file, """
            {
              "preferredMemoryFormat": "contiguous",
              "traceGraphs": false
            }
            """);

        FusionConfig config = FusionConfigLoader.load(file);

        assertEquals(MemoryFormat.CONTIGUOUS, config.preferredMemoryFormat());
        assertFalse(config.traceGraphs());
        assertTrue(config.leaveDepthwiseToVectorizedPath());
        assertTrue(config.recordJfrEvents());
    }

    @Test
    void emptyFile() throws IOException {
        Path file = tempDir.resolve("fusion.json");
        Files.writeString(file, "");

        assertEquals(FusionConfig.defaults(), FusionConfigLoader.load(file));
    }

    @Test
    void saveThenLoad() throws IOException {
        Path file = tempDir.resolve("nested").resolve("fusion.json");
        FusionConfig config = FusionConfig.defaults()
                .withPreferredMemoryFormat(MemoryFormat.CONTIGUOUS)
                .withLeaveDepthwiseToVectorizedPath(false)
                .withRecordJfrEvents(false);

        FusionConfigLoader.save(config, file);

        assertTrue(Files.readString(file).contains("\"contiguous\""));
        assertEquals(config, FusionConfigLoader.load(file));
    }

    @Test
    void malformedJson() throws IOException {
        Path file = tempDir.resolve("fusion.json");
        Files.writeString(file, "{ \"traceGraphs\": ");

        FusionConfigException e = assertThrows(FusionConfigException.class, () -> FusionConfigLoader.load(file));
        assertEquals(file, e.getFile());
        assertTrue(e.getMessage().startsWith(file.toString()));
    }

    @Test
    void unknownMemoryFormat() throws IOException {
        Path file = tempDir.resolve("fusion.json");
        Files.writeString(file, "{ \"preferredMemoryFormat\": \"nhwc8\" }");

        FusionConfigException e = assertThrows(FusionConfigException.class, () -> FusionConfigLoader.load(file));
        assertTrue(e.getMessage().contains("nhwc8"));
    }

    @Test
    @DisplayName("the default location is under the user's config directory")
    void defaultLocation() {
        assertEquals(FusionConfig.CONFIG_DIR.resolve(FusionConfig.CONFIG_FILE), FusionConfig.configFile());
    }
}

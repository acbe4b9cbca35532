package io.surfworks.convfuse.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Logger;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import io.surfworks.convfuse.ir.MemoryFormat;

/**
 * Loads and saves {@link FusionConfig}.
 *
 * <p>The file ({@code ~/.config/convfuse/fusion.json} by default) may set any
 * subset of the options; missing options keep their defaults:
 * <pre>{@code
 * {
 *   "preferredMemoryFormat": "channels_last",
 *   "leaveDepthwiseToVectorizedPath": true,
 *   "traceGraphs": false,
 *   "recordJfrEvents": true
 * }
 * }</pre>
 */
public final class FusionConfigLoader {

    private static final Logger LOG = Logger.getLogger(FusionConfigLoader.class.getName());

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private FusionConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     */
    public static FusionConfig load() {
        return load(FusionConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration, or defaults if the file doesn't exist
     * @throws FusionConfigException if the file can't be read or is malformed
     */
    public static FusionConfig load(Path configFile) {
        FusionConfig config = FusionConfig.defaults();
        if (!Files.exists(configFile)) {
            LOG.fine("No fusion config at " + configFile + ", using defaults");
            return config;
        }

        StoredConfig stored;
        try {
            stored = GSON.fromJson(Files.readString(configFile), StoredConfig.class);
        } catch (IOException e) {
            throw new FusionConfigException(configFile, "cannot read config: " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new FusionConfigException(configFile, "malformed config: " + e.getMessage(), e);
        }
        if (stored == null) {
            return config;
        }

        if (stored.preferredMemoryFormat != null) {
            config = config.withPreferredMemoryFormat(parseMemoryFormat(configFile, stored.preferredMemoryFormat));
        }
        if (stored.leaveDepthwiseToVectorizedPath != null) {
            config = config.withLeaveDepthwiseToVectorizedPath(stored.leaveDepthwiseToVectorizedPath);
        }
        if (stored.traceGraphs != null) {
            config = config.withTraceGraphs(stored.traceGraphs);
        }
        if (stored.recordJfrEvents != null) {
            config = config.withRecordJfrEvents(stored.recordJfrEvents);
        }
        return config;
    }

    /**
     * Saves configuration to a specific file.
     *
     * @throws IOException if saving fails
     */
    public static void save(FusionConfig config, Path configFile) throws IOException {
        if (configFile.getParent() != null) {
            Files.createDirectories(configFile.getParent());
        }
        StoredConfig stored = new StoredConfig();
        stored.preferredMemoryFormat = config.preferredMemoryFormat().name().toLowerCase(Locale.ROOT);
        stored.leaveDepthwiseToVectorizedPath = config.leaveDepthwiseToVectorizedPath();
        stored.traceGraphs = config.traceGraphs();
        stored.recordJfrEvents = config.recordJfrEvents();
        Files.writeString(configFile, GSON.toJson(stored));
    }

    private static MemoryFormat parseMemoryFormat(Path configFile, String value) {
        try {
            return MemoryFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new FusionConfigException(configFile, "unknown memory format '" + value + "'", e);
        }
    }

    /**
     * JSON shape of the config file. Boxed fields so absent options stay null.
     */
    private static class StoredConfig {
        String preferredMemoryFormat;
        Boolean leaveDepthwiseToVectorizedPath;
        Boolean traceGraphs;
        Boolean recordJfrEvents;
    }
}

package io.surfworks.convfuse.config;

import java.nio.file.Path;
import java.util.Objects;

import io.surfworks.convfuse.ir.MemoryFormat;

/**
 * Options for the convolution fusion pipeline.
 *
 * @param preferredMemoryFormat          layout activation and weight must be contiguous in
 * @param leaveDepthwiseToVectorizedPath whether convolutions claimed by the vectorized
 *                                       depthwise path are left alone
 * @param traceGraphs                    log the graph at FINE after every pipeline step
 * @param recordJfrEvents                emit a JFR event for every pipeline step
 */
public record FusionConfig(
        MemoryFormat preferredMemoryFormat,
        boolean leaveDepthwiseToVectorizedPath,
        boolean traceGraphs,
        boolean recordJfrEvents
) {
    public static final Path CONFIG_DIR = Path.of(System.getProperty("user.home"), ".config", "convfuse");
    public static final String CONFIG_FILE = "fusion.json";

    public FusionConfig {
        Objects.requireNonNull(preferredMemoryFormat, "preferredMemoryFormat cannot be null");
    }

    public static FusionConfig defaults() {
        return new FusionConfig(MemoryFormat.CHANNELS_LAST, true, true, true);
    }

    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public FusionConfig withPreferredMemoryFormat(MemoryFormat format) {
        return new FusionConfig(format, leaveDepthwiseToVectorizedPath, traceGraphs, recordJfrEvents);
    }

    public FusionConfig withLeaveDepthwiseToVectorizedPath(boolean leave) {
        return new FusionConfig(preferredMemoryFormat, leave, traceGraphs, recordJfrEvents);
    }

    public FusionConfig withTraceGraphs(boolean trace) {
        return new FusionConfig(preferredMemoryFormat, leaveDepthwiseToVectorizedPath, trace, recordJfrEvents);
    }

    public FusionConfig withRecordJfrEvents(boolean record) {
        return new FusionConfig(preferredMemoryFormat, leaveDepthwiseToVectorizedPath, traceGraphs, record);
    }
}

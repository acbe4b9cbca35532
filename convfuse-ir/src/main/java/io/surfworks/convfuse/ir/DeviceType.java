package io.surfworks.convfuse.ir;

import java.util.Locale;

/**
 * Kinds of devices a tensor value can live on.
 */
public enum DeviceType {
    CPU,
    CUDA,
    XPU,
    META;

    public String irName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DeviceType fromIrName(String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}

package io.surfworks.convfuse.ir;

import java.util.Objects;

/**
 * A device placement such as {@code cpu} or {@code cuda:0}.
 *
 * @param type  the device kind
 * @param index the device ordinal, or -1 when unspecified
 */
public record Device(DeviceType type, int index) {

    private static final Device CPU = new Device(DeviceType.CPU, -1);

    public Device {
        Objects.requireNonNull(type, "type cannot be null");
        if (index < -1) {
            throw new IllegalArgumentException("Invalid device index: " + index);
        }
    }

    public static Device cpu() {
        return CPU;
    }

    public static Device cuda(int index) {
        return new Device(DeviceType.CUDA, index);
    }

    /**
     * Parses {@code cpu}, {@code cuda}, {@code cuda:1}, ...
     */
    public static Device parse(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            return new Device(DeviceType.fromIrName(text), -1);
        }
        return new Device(
                DeviceType.fromIrName(text.substring(0, colon)),
                Integer.parseInt(text.substring(colon + 1)));
    }

    public boolean isCpu() {
        return type == DeviceType.CPU;
    }

    public String toIrString() {
        return index < 0 ? type.irName() : type.irName() + ":" + index;
    }

    @Override
    public String toString() {
        return toIrString();
    }
}

package io.surfworks.convfuse.ir.rewrite;

import io.surfworks.convfuse.ir.Types.Type;

/**
 * A named value of a {@link PatternGraph}: either a free parameter or the
 * output of a {@link PatternNode}.
 */
public final class PatternValue {

    private final String name;
    private final Type type;
    private final PatternNode producer;

    PatternValue(String name, Type type, PatternNode producer) {
        this.name = name;
        this.type = type;
        this.producer = producer;
    }

    public String name() {
        return name;
    }

    /**
     * Returns the declared type, or null if the pattern doesn't constrain it.
     */
    public Type type() {
        return type;
    }

    /**
     * Returns the producing pattern node, or null for a parameter.
     */
    public PatternNode producer() {
        return producer;
    }

    public boolean isParameter() {
        return producer == null;
    }

    @Override
    public String toString() {
        return "%" + name;
    }
}

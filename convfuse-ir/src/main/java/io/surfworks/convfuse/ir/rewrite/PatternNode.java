package io.surfworks.convfuse.ir.rewrite;

import java.util.List;

import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Symbol;
import io.surfworks.convfuse.ir.Symbols;
import io.surfworks.convfuse.ir.Types.Type;

/**
 * A single-output operation of a {@link PatternGraph}.
 */
public final class PatternNode {

    private final Symbol kind;
    private final List<PatternValue> inputs;
    private final Literal literal;
    private final PatternValue output;

    PatternNode(Symbol kind, List<PatternValue> inputs, Literal literal, String outputName, Type outputType) {
        this.kind = kind;
        this.inputs = List.copyOf(inputs);
        this.literal = literal;
        this.output = new PatternValue(outputName, outputType, this);
    }

    public Symbol kind() {
        return kind;
    }

    public List<PatternValue> inputs() {
        return inputs;
    }

    /**
     * Returns the literal of a {@code prim::Constant} pattern node, null otherwise.
     */
    public Literal literal() {
        return literal;
    }

    public PatternValue output() {
        return output;
    }

    public boolean isConstant() {
        return kind.equals(Symbols.CONSTANT);
    }
}

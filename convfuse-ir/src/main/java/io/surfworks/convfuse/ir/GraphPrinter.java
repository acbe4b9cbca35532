package io.surfworks.convfuse.ir;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.surfworks.convfuse.ir.Literals.Literal;

/**
 * Renders graphs in the IR text form understood by
 * {@link io.surfworks.convfuse.ir.parser.IrParser}.
 *
 * <p>Example:
 * <pre>
 * graph(%x : Float(1, 3, 8, 8, strides=[192, 1, 24, 3], device=cpu)):
 *   %1 : int[] = prim::Constant[value=[1, 1]]()
 *   %y : Tensor = aten::relu(%x)
 *   return (%y)
 * </pre>
 *
 * <p>{@link #canonical(Graph)} renumbers every value in definition order, so
 * two structurally identical graphs print identically regardless of how their
 * values were named or created.
 */
public final class GraphPrinter {

    private final boolean canonical;
    private final Map<Value, String> names = new HashMap<>();
    private final Set<String> taken = new HashSet<>();
    private int counter;

    private GraphPrinter(boolean canonical) {
        this.canonical = canonical;
    }

    public static String print(Graph graph) {
        return new GraphPrinter(false).printGraph(graph);
    }

    public static String canonical(Graph graph) {
        return new GraphPrinter(true).printGraph(graph);
    }

    /**
     * Prints a single node on one line, without nested blocks.
     */
    public static String printNode(Node node) {
        GraphPrinter printer = new GraphPrinter(false);
        StringBuilder sb = new StringBuilder();
        printer.appendNodeHead(sb, node);
        return sb.toString();
    }

    private String printGraph(Graph graph) {
        StringBuilder sb = new StringBuilder("graph(");
        List<Value> inputs = graph.inputs();
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) sb.append(",\n      ");
            sb.append(declare(inputs.get(i)));
        }
        sb.append("):\n");
        appendBody(sb, graph.block(), "  ");
        sb.append("  return (");
        appendValueList(sb, graph.outputs());
        sb.append(")\n");
        return sb.toString();
    }

    private void appendBody(StringBuilder sb, Block block, String indent) {
        for (Node node : block.nodes()) {
            sb.append(indent);
            appendNodeHead(sb, node);
            sb.append("\n");
            for (int b = 0; b < node.blocks().size(); b++) {
                Block nested = node.blocks().get(b);
                sb.append(indent).append("  block").append(b).append("(");
                List<Value> params = nested.inputs();
                for (int i = 0; i < params.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(declare(params.get(i)));
                }
                sb.append("):\n");
                appendBody(sb, nested, indent + "    ");
                sb.append(indent).append("    -> (");
                appendValueList(sb, nested.outputs());
                sb.append(")\n");
            }
        }
    }

    private void appendNodeHead(StringBuilder sb, Node node) {
        List<Value> outs = node.outputs();
        for (int i = 0; i < outs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(declare(outs.get(i)));
        }
        if (!outs.isEmpty()) {
            sb.append(" = ");
        }
        sb.append(node.kind().toQualString());
        if (node.isConstant()) {
            Literal literal = node.literal();
            if (literal != null && !literal.isNone()) {
                sb.append("[value=").append(literal.toIrString()).append("]");
            }
        }
        sb.append("(");
        appendValueList(sb, node.inputs());
        sb.append(")");
    }

    private void appendValueList(StringBuilder sb, List<Value> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append("%").append(nameOf(values.get(i)));
        }
    }

    private String declare(Value v) {
        return "%" + nameOf(v) + " : " + v.type().toIrString();
    }

    private String nameOf(Value v) {
        String existing = names.get(v);
        if (existing != null) {
            return existing;
        }
        String name;
        if (canonical) {
            name = String.valueOf(counter++);
        } else {
            name = v.debugName() != null ? v.debugName() : String.valueOf(v.id());
            if (taken.contains(name)) {
                int suffix = 1;
                while (taken.contains(name + "." + suffix)) {
                    suffix++;
                }
                name = name + "." + suffix;
            }
        }
        taken.add(name);
        names.put(v, name);
        return name;
    }
}

package io.surfworks.convfuse.ir;

import java.util.List;

import io.surfworks.convfuse.ir.Types.TensorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph")
class GraphTest {

    private static Graph reluGraph() {
        Graph graph = new Graph();
        Value x = graph.addInput("x", TensorType.of(ScalarType.FLOAT, 1, 4));
        Value y = graph.insert(Symbols.RELU, List.of(x)).setDebugName("y");
        graph.registerOutput(y);
        return graph;
    }

    @Nested
    @DisplayName("Use lists")
    class UseLists {

        @Test
        @DisplayName("inputs are recorded as uses of the consumed value")
        void inputsRecordUses() {
            Graph graph = reluGraph();
            Value x = graph.inputs().get(0);
            Node relu = graph.findAll(Symbols.RELU).get(0);

            assertEquals(1, x.uses().size());
            assertSame(relu, x.uses().get(0).user());
            assertEquals(0, x.uses().get(0).offset());
        }

        @Test
        @DisplayName("replaceAllUsesWith moves every use, the graph output included")
        void replaceAllUses() {
            Graph graph = reluGraph();
            Value x = graph.inputs().get(0);
            Value y = graph.outputs().get(0);

            y.replaceAllUsesWith(x);

            assertFalse(y.hasUses());
            assertSame(x, graph.outputs().get(0));
            graph.lint();
        }
    }

    @Nested
    @DisplayName("Node destruction")
    class Destruction {

        @Test
        @DisplayName("destroying a node whose output is still used fails")
        void destroyWithLiveUses() {
            Graph graph = reluGraph();
            Node relu = graph.findAll(Symbols.RELU).get(0);

            IllegalStateException e = assertThrows(IllegalStateException.class, relu::destroy);
            assertTrue(e.getMessage().contains("use"));
        }

        @Test
        @DisplayName("destroying a node with attached inputs fails")
        void destroyWithAttachedInputs() {
            Graph graph = reluGraph();
            Node relu = graph.findAll(Symbols.RELU).get(0);
            relu.output().replaceAllUsesWith(graph.inputs().get(0));

            assertThrows(IllegalStateException.class, relu::destroy);
        }

        @Test
        @DisplayName("removing inputs first allows destruction")
        void twoPhaseDestruction() {
            Graph graph = reluGraph();
            Value x = graph.inputs().get(0);
            Node relu = graph.findAll(Symbols.RELU).get(0);
            relu.output().replaceAllUsesWith(x);

            relu.removeAllInputs();
            relu.destroy();

            assertTrue(relu.isDestroyed());
            assertTrue(graph.allNodes().isEmpty());
            assertEquals(1, x.uses().size());
            graph.lint();
        }
    }

    @Nested
    @DisplayName("Insert points")
    class InsertPoints {

        @Test
        @DisplayName("nodes go before the anchor while the guard is open")
        void insertBefore() {
            Graph graph = reluGraph();
            Node relu = graph.findAll(Symbols.RELU).get(0);

            Value c;
            try (InsertPoint ignored = graph.insertPointBefore(relu)) {
                c = graph.insertConstant(Literals.of(3L));
            }
            Value tail = graph.insertConstant(Literals.of(4L));

            List<Node> nodes = graph.block().nodes();
            assertSame(c.node(), nodes.get(0));
            assertSame(relu, nodes.get(1));
            assertSame(tail.node(), nodes.get(2));
            assertTrue(c.node().isBefore(relu));
        }

        @Test
        @DisplayName("constants are typed after their literal")
        void constantType() {
            Graph graph = new Graph();
            Value c = graph.insertConstant(Literals.intList(1, 2));

            assertEquals(Types.listOf(Types.INT), c.type());
            assertEquals(Literals.intList(1, 2), c.node().literal());
        }
    }

    @Nested
    @DisplayName("Lint")
    class Lint {

        @Test
        @DisplayName("a use before definition is reported")
        void useBeforeDefinition() {
            Graph graph = new Graph();
            Value x = graph.addInput("x", TensorType.unknown());
            Node first = graph.insertNode(graph.create(Symbols.RELU, List.of(x), 1));
            Node second = graph.insertNode(graph.create(Symbols.SIGMOID, List.of(x), 1));
            first.replaceInput(0, second.output());

            assertThrows(IllegalStateException.class, graph::lint);
        }
    }

    @Nested
    @DisplayName("Printing")
    class Printing {

        @Test
        @DisplayName("the canonical print ignores value ids and debug names")
        void canonicalIgnoresNames() {
            Graph a = reluGraph();
            Graph b = reluGraph();
            b.outputs().get(0).setDebugName("something_else");

            assertEquals(GraphPrinter.canonical(a), GraphPrinter.canonical(b));
            assertNotEquals(GraphPrinter.print(a), GraphPrinter.print(b));
        }

        @Test
        @DisplayName("nested blocks are printed under their owner")
        void nestedBlocks() {
            Graph graph = new Graph();
            Value cond = graph.addInput("cond", Types.BOOL);
            Node ifNode = graph.insertNode(graph.create(Symbols.IF, List.of(cond), 1));
            ifNode.output().setType(Types.INT);
            for (long v : new long[] {1, 2}) {
                Block block = ifNode.addBlock();
                try (InsertPoint ignored = graph.insertPointAtEnd(block)) {
                    block.registerOutput(graph.insertConstant(Literals.of(v)));
                }
            }
            graph.registerOutput(ifNode.output());

            String printed = GraphPrinter.print(graph);
            assertTrue(printed.contains("block0():"), printed);
            assertTrue(printed.contains("block1():"), printed);
            // the If and one constant per branch
            assertEquals(3, graph.allNodes().size());
            graph.lint();
        }
    }
}

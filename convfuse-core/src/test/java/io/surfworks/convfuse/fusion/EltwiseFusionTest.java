package io.surfworks.convfuse.fusion;

import java.util.List;

import io.surfworks.convfuse.config.FusionConfig;
import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.GraphPrinter;
import io.surfworks.convfuse.ir.Literals;
import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Symbols;
import io.surfworks.convfuse.ir.runtime.Tensor;
import io.surfworks.convfuse.packed.PostOps;
import io.surfworks.convfuse.packed.PrepackedOps;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static io.surfworks.convfuse.fusion.FusionGraphs.INPUT;
import static io.surfworks.convfuse.fusion.FusionGraphs.WEIGHT;
import static io.surfworks.convfuse.fusion.FusionGraphs.WEIGHT_INPUT_CONV;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EltwiseFusion")
class EltwiseFusionTest {

    private static final EltwiseFusion FUSION = new EltwiseFusion(PostOpRuleTable.DEFAULT);

    /** Parses the graph and splits its convolution into a prepack/run pair. */
    private static Graph packed(String tail) {
        Graph graph = FusionGraphs.parse(WEIGHT_INPUT_CONV, tail);
        new PrepackConvInserter(ConvEligibility.forConfig(FusionConfig.defaults())).run(graph);
        return graph;
    }

    private static Node prepack(Graph graph) {
        List<Node> prepacks = graph.findAll(PrepackedOps.CONV2D_PREPACK);
        assertEquals(1, prepacks.size());
        return prepacks.get(0);
    }

    private static String attribute(Graph graph) {
        return prepack(graph).input(7).node().literal().toStr();
    }

    private static Node scalarList(Graph graph) {
        return prepack(graph).input(8).node();
    }

    private static void assertFusedEquivalent(String tail) {
        Graph original = FusionGraphs.parse(WEIGHT_INPUT_CONV, tail);
        Graph graph = packed(tail);
        assertEquals(1, FUSION.run(graph));
        graph.lint();

        Tensor want = FusionGraphs.interpreter().runTensors(original, INPUT, WEIGHT).get(0);
        Tensor got = FusionGraphs.interpreter().runTensors(graph, INPUT, WEIGHT).get(0);
        assertTrue(want.allClose(got, 1e-5f, 1e-5f), "fused " + attribute(graph) + " computes different values");
    }

    @Nested
    @DisplayName("Operators without scalars")
    class PlainOperators {

        @ParameterizedTest
        @ValueSource(strings = {"relu", "sigmoid", "tanh"})
        void fused(String op) {
            Graph graph = packed("""
                  %y : $OUT = aten::OP(%conv)
                  return (%y)
                """.replace("OP", op));

            assertEquals(1, FUSION.run(graph));

            assertEquals(op, attribute(graph));
            assertEquals(Symbols.LIST_CONSTRUCT, scalarList(graph).kind());
            assertTrue(scalarList(graph).inputs().isEmpty());
            assertTrue(prepack(graph).input(9).node().literal().isNone());
            Node run = graph.findAll(PrepackedOps.CONV2D_RUN).get(0);
            assertSame(run.output(), graph.outputs().get(0));
            assertEquals(FusionGraphs.OUT, run.output().type().toIrString());
            graph.lint();
        }

        @Test
        void reluNumericallyEquivalent() {
            assertFusedEquivalent("""
                  %y : $OUT = aten::relu(%conv)
                  return (%y)
                """);
        }
    }

    @Nested
    @DisplayName("Operators with scalars")
    class ScalarOperators {

        private static final String HARDTANH = """
              %min : float = prim::Constant[value=-0.5]()
              %max : float = prim::Constant[value=0.5]()
              %y : $OUT = aten::hardtanh(%conv, %min, %max)
              return (%y)
            """;

        private static final String LEAKY_RELU = """
              %slope : float = prim::Constant[value=0.1]()
              %y : $OUT = aten::leaky_relu(%conv, %slope)
              return (%y)
            """;

        @Test
        @DisplayName("hardtanh bounds become the scalar list, in order")
        void hardtanh() {
            Graph graph = packed(HARDTANH);

            assertEquals(1, FUSION.run(graph));

            assertEquals(PostOps.HARDTANH, attribute(graph));
            Node scalars = scalarList(graph);
            assertEquals(2, scalars.inputs().size());
            assertEquals("min", scalars.input(0).debugName());
            assertEquals("max", scalars.input(1).debugName());
            assertTrue(graph.findAll(Symbols.HARDTANH).isEmpty());
        }

        @Test
        void hardtanhNumericallyEquivalent() {
            assertFusedEquivalent(HARDTANH);
        }

        @Test
        void leakyRelu() {
            Graph graph = packed(LEAKY_RELU);

            assertEquals(1, FUSION.run(graph));

            assertEquals(PostOps.LEAKY_RELU, attribute(graph));
            assertEquals(List.of("slope"), scalarList(graph).inputs().stream().map(v -> v.debugName()).toList());
        }

        @Test
        void leakyReluNumericallyEquivalent() {
            assertFusedEquivalent(LEAKY_RELU);
        }
    }

    @Nested
    @DisplayName("gelu")
    class Gelu {

        private static String tail(String approximate) {
            return """
                  %approximate : str = prim::Constant[value="APPROX"]()
                  %y : $OUT = aten::gelu(%conv, %approximate)
                  return (%y)
                """.replace("APPROX", approximate);
        }

        @ParameterizedTest
        @ValueSource(strings = {"none", "tanh"})
        @DisplayName("supported approximations become the algorithm operand")
        void supportedApproximation(String approximate) {
            Graph graph = packed(tail(approximate));

            assertEquals(1, FUSION.run(graph));

            assertEquals(PostOps.GELU, attribute(graph));
            Literal algorithm = prepack(graph).input(9).node().literal();
            assertEquals(Literals.of(approximate), algorithm);
            assertTrue(scalarList(graph).inputs().isEmpty());
        }

        @Test
        @DisplayName("an unsupported approximation is not fused")
        void unsupportedApproximation() {
            Graph graph = packed(tail("erf"));
            String before = GraphPrinter.canonical(graph);

            assertEquals(0, FUSION.run(graph));
            assertEquals(before, GraphPrinter.canonical(graph));
        }

        @Test
        void numericallyEquivalent() {
            assertFusedEquivalent(tail("tanh"));
        }
    }

    @Nested
    @DisplayName("Near matches")
    class NearMatches {

        @Test
        @DisplayName("an operator on a plain conv2d is not fused")
        void unpackedConvolution() {
            Graph graph = FusionGraphs.parse(WEIGHT_INPUT_CONV, FusionGraphs.X_CONTIGUOUS,
                    FusionGraphs.W_CHANNELS_LAST, """
                  %y : $OUT = aten::relu(%conv)
                  return (%y)
                """);
            new PrepackConvInserter(ConvEligibility.forConfig(FusionConfig.defaults())).run(graph);

            assertEquals(0, FUSION.run(graph));
            assertEquals(1, graph.findAll(Symbols.RELU).size());
        }

        @Test
        @DisplayName("a run whose result is also used elsewhere is not fused")
        void escapingRunResult() {
            Graph graph = packed("""
                  %y : $OUT = aten::relu(%conv)
                  return (%y, %conv)
                """);

            assertEquals(0, FUSION.run(graph));
            assertEquals(PostOps.NONE, attribute(graph));
        }

        @Test
        @DisplayName("only the first of two chained operators is fused")
        void alreadyFused() {
            Graph graph = packed("""
                  %r : $OUT = aten::relu(%conv)
                  %y : $OUT = aten::sigmoid(%r)
                  return (%y)
                """);

            assertEquals(1, FUSION.run(graph));
            assertEquals(PostOps.RELU, attribute(graph));
            assertEquals(1, graph.findAll(Symbols.SIGMOID).size());

            assertEquals(0, FUSION.run(graph));
        }
    }
}

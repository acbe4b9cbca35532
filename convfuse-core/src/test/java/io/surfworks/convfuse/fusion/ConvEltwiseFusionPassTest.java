package io.surfworks.convfuse.fusion;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import io.surfworks.convfuse.config.FusionConfig;
import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.GraphPrinter;
import io.surfworks.convfuse.ir.Literals;
import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Symbols;
import io.surfworks.convfuse.ir.runtime.Tensor;
import io.surfworks.convfuse.packed.FrozenConvOpContext;
import io.surfworks.convfuse.packed.PostOps;
import io.surfworks.convfuse.packed.PrepackedOperators;
import io.surfworks.convfuse.packed.PrepackedOps;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static io.surfworks.convfuse.fusion.FusionGraphs.ACCUMULATOR;
import static io.surfworks.convfuse.fusion.FusionGraphs.ACCUMULATOR_CONV;
import static io.surfworks.convfuse.fusion.FusionGraphs.CONSTANT_CONV;
import static io.surfworks.convfuse.fusion.FusionGraphs.INPUT;
import static io.surfworks.convfuse.fusion.FusionGraphs.WEIGHT;
import static io.surfworks.convfuse.fusion.FusionGraphs.WEIGHT_INPUT_CONV;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConvEltwiseFusionPass")
class ConvEltwiseFusionPassTest {

    private static final String RELU_TAIL = """
          %y : $OUT = aten::relu(%conv)
          return (%y)
        """;

    private static final String SUM_TAIL = """
          %alpha : float = prim::Constant[value=2.0]()
          %y : $OUT = aten::add(%conv, %acc, %alpha)
          return (%y)
        """;

    private static ConvEltwiseFusionPass pass() {
        return ConvEltwiseFusionPass.withDefaults();
    }

    private static Literal constantInput(Node node, int i) {
        Node producer = node.input(i).node();
        assertTrue(producer.isConstant(), "input " + i + " of " + node.kind() + " should be a constant");
        return producer.literal();
    }

    private static void assertSameResult(Graph expected, Graph actual, Tensor... inputs) {
        Tensor want = FusionGraphs.interpreter().runTensors(expected, inputs).get(0);
        Tensor got = FusionGraphs.interpreter().runTensors(actual, inputs).get(0);
        assertTrue(want.allClose(got, 1e-5f, 1e-5f), "fused graph computes different values");
    }

    @Nested
    @DisplayName("Concrete scenarios")
    class Scenarios {

        @Test
        @DisplayName("conv2d followed by relu becomes one prepack with attribute relu and one run")
        void convRelu() {
            Graph graph = FusionGraphs.parse(WEIGHT_INPUT_CONV, RELU_TAIL);
            Graph original = FusionGraphs.parse(WEIGHT_INPUT_CONV, RELU_TAIL);

            FusionReport report = pass().apply(graph);

            assertTrue(graph.findAll(Symbols.CONV2D).isEmpty());
            assertTrue(graph.findAll(Symbols.RELU).isEmpty());
            List<Node> prepacks = graph.findAll(PrepackedOps.CONV2D_PREPACK);
            List<Node> runs = graph.findAll(PrepackedOps.CONV2D_RUN);
            assertEquals(1, prepacks.size());
            assertEquals(1, runs.size());

            Node prepack = prepacks.get(0);
            assertEquals(Literals.of(PostOps.RELU), constantInput(prepack, 7));
            assertTrue(constantInput(prepack, 8).toList().isEmpty());
            assertTrue(constantInput(prepack, 9).isNone());

            Node run = runs.get(0);
            assertSame(prepack.output(), run.input(1));
            assertSame(run.output(), graph.outputs().get(0));
            assertEquals(1, report.count("PrepackConvInserter"));
            assertEquals(1, report.count("EltwiseFusion"));
            assertEquals(0, report.count("PrepackFolder"));
            graph.lint();

            assertSameResult(original, graph, INPUT, WEIGHT);
        }

        @Test
        @DisplayName("conv2d plus a scaled accumulator becomes a sum run that is not folded")
        void convPlusScaledAccumulator() {
            Graph graph = FusionGraphs.parse(ACCUMULATOR_CONV, SUM_TAIL);
            Graph original = FusionGraphs.parse(ACCUMULATOR_CONV, SUM_TAIL);

            pass().apply(graph);

            assertTrue(graph.findAll(Symbols.ADD).isEmpty());
            assertTrue(graph.findAll(PrepackedOps.CONV2D_RUN).isEmpty());
            List<Node> sumRuns = graph.findAll(PrepackedOps.CONV2D_SUM_RUN);
            assertEquals(1, sumRuns.size());

            Node sumRun = sumRuns.get(0);
            assertSame(graph.inputs().get(2), sumRun.input(1));
            Node prepack = sumRun.input(2).node();
            assertEquals(PrepackedOps.CONV2D_PREPACK, prepack.kind(), "prepack must survive");
            assertEquals(Literals.of(PostOps.SUM), constantInput(prepack, 7));
            assertEquals(List.of(Literals.of(2.0)), constantInput(prepack, 8).toList());
            graph.lint();

            assertSameResult(original, graph, INPUT, WEIGHT, ACCUMULATOR);
        }

        @Test
        @DisplayName("with constant parameters the prepack is replaced by a packed constant")
        void constantParametersAreFolded() {
            Graph graph = FusionGraphs.parse(CONSTANT_CONV, RELU_TAIL);
            Graph original = FusionGraphs.parse(CONSTANT_CONV, RELU_TAIL);

            FusionReport report = pass().apply(graph);

            assertTrue(graph.findAll(PrepackedOps.CONV2D_PREPACK).isEmpty());
            Node run = graph.findAll(PrepackedOps.CONV2D_RUN).get(0);
            Literal packed = constantInput(run, 1);
            FrozenConvOpContext context = assertInstanceOf(FrozenConvOpContext.class, packed.toObject());
            assertTrue(context.isWeakReference());
            assertEquals(PostOps.RELU, context.payload().attr());
            assertEquals(PrepackedOps.CONV_OP_CONTEXT_TYPE, run.input(1).type());
            assertEquals(2, graph.allNodes().size(), GraphPrinter.print(graph));
            assertEquals(1, report.count("PrepackFolder"));
            graph.lint();

            assertSameResult(original, graph, INPUT);
        }
    }

    @Nested
    @DisplayName("Idempotence")
    class Idempotence {

        private void assertIdempotent(Graph graph) {
            pass().apply(graph);
            String once = GraphPrinter.canonical(graph);
            FusionReport second = pass().apply(graph);
            assertEquals(once, GraphPrinter.canonical(graph));
            assertEquals(0, second.totalRewrites(), second.toString());
        }

        @Test
        void convRelu() {
            assertIdempotent(FusionGraphs.parse(WEIGHT_INPUT_CONV, RELU_TAIL));
        }

        @Test
        void convSum() {
            assertIdempotent(FusionGraphs.parse(ACCUMULATOR_CONV, SUM_TAIL));
        }

        @Test
        void folded() {
            assertIdempotent(FusionGraphs.parse(CONSTANT_CONV, RELU_TAIL));
        }

        @Test
        @DisplayName("a second relu is never fused into a prepack that already has one")
        void doubleRelu() {
            Graph graph = FusionGraphs.parse(WEIGHT_INPUT_CONV, """
                  %r1 : $OUT = aten::relu(%conv)
                  %r2 : $OUT = aten::relu(%r1)
                  return (%r2)
                """);
            assertIdempotent(graph);
            assertEquals(1, graph.findAll(Symbols.RELU).size());
        }
    }

    @Nested
    @DisplayName("Gating")
    class Gating {

        @Test
        @DisplayName("an ineligible convolution leaves the graph unchanged")
        void ineligibleUnchanged() {
            Graph graph = FusionGraphs.parse(WEIGHT_INPUT_CONV, FusionGraphs.X_CONTIGUOUS,
                    FusionGraphs.W_CHANNELS_LAST, RELU_TAIL);
            String before = GraphPrinter.canonical(graph);

            FusionReport report = pass().apply(graph);

            assertEquals(before, GraphPrinter.canonical(graph));
            assertEquals(0, report.totalRewrites());
        }

        @Test
        @DisplayName("the preferred layout comes from the config")
        void configuredLayout() {
            FusionConfig config = FusionConfig.defaults()
                    .withPreferredMemoryFormat(io.surfworks.convfuse.ir.MemoryFormat.CONTIGUOUS)
                    .withRecordJfrEvents(false);
            ConvEltwiseFusionPass contiguous = new ConvEltwiseFusionPass(config, PrepackedOperators.registry(),
                    PostOpRuleTable.DEFAULT);
            Graph graph = FusionGraphs.parse(WEIGHT_INPUT_CONV, FusionGraphs.X_CONTIGUOUS,
                    FusionGraphs.W_CONTIGUOUS, RELU_TAIL);

            contiguous.apply(graph);

            assertEquals(1, graph.findAll(PrepackedOps.CONV2D_RUN).size());
        }

        @Test
        @DisplayName("a pass built from a config file honours its preferred layout")
        void layoutFromConfigFile(@TempDir Path tempDir) throws IOException {
            Path file = tempDir.resolve("fusion.json");
            Files.writeString(file, """
                {
                  "preferredMemoryFormat": "contiguous",
                  "recordJfrEvents": false
                }
                """);
            Graph graph = FusionGraphs.parse(WEIGHT_INPUT_CONV, FusionGraphs.X_CONTIGUOUS,
                    FusionGraphs.W_CONTIGUOUS, RELU_TAIL);

            ConvEltwiseFusionPass.fromConfigFile(file).apply(graph);

            assertEquals(1, graph.findAll(PrepackedOps.CONV2D_RUN).size());
        }

        @Test
        @DisplayName("without a config file the pass keeps the default layout")
        void missingConfigFile(@TempDir Path tempDir) {
            Graph graph = FusionGraphs.parse(WEIGHT_INPUT_CONV, FusionGraphs.X_CONTIGUOUS,
                    FusionGraphs.W_CONTIGUOUS, RELU_TAIL);

            ConvEltwiseFusionPass.fromConfigFile(tempDir.resolve("absent.json")).apply(graph);

            assertTrue(graph.findAll(PrepackedOps.CONV2D_RUN).isEmpty());
        }
    }

    @Test
    @DisplayName("steps run in a fixed order and are all reported")
    void stepOrder() {
        ConvEltwiseFusionPass pass = pass();
        List<String> names = pass.steps().stream().map(s -> s.name()).toList();
        assertEquals(List.of("ConvolutionNormalizer", "PrepackConvInserter", "EltwiseFusion", "SumFusion",
                "ConstantPropagation", "PrepackFolder"), names);

        FusionReport report = pass.apply(FusionGraphs.parse(WEIGHT_INPUT_CONV, RELU_TAIL));
        assertEquals(names, List.copyOf(report.steps().keySet()));
        assertEquals(report.totalRewrites(), pass.run(FusionGraphs.parse(WEIGHT_INPUT_CONV, RELU_TAIL)));
    }
}

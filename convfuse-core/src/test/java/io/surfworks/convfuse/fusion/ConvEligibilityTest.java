package io.surfworks.convfuse.fusion;

import io.surfworks.convfuse.config.FusionConfig;
import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.MemoryFormat;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Symbols;
import io.surfworks.convfuse.ir.parser.IrParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static io.surfworks.convfuse.fusion.FusionGraphs.WEIGHT_INPUT_CONV;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConvEligibility")
class ConvEligibilityTest {

    private static final String TAIL = "  return (%conv)\n";

    private static final ConvEligibility CHANNELS_LAST = ConvEligibility.forConfig(FusionConfig.defaults());

    private static Node conv(String xType, String wType) {
        Graph graph = FusionGraphs.parse(WEIGHT_INPUT_CONV, xType, wType, TAIL);
        return graph.findAll(Symbols.CONV2D).get(0);
    }

    private static Node depthwise(String stride, String padding) {
        Graph graph = IrParser.parse("""
            graph(%x : Float(1, 4, 8, 8, strides=[256, 1, 32, 4], device=cpu),
                  %w : Float(4, 1, 3, 3, strides=[9, 1, 3, 1], device=cpu)):
              %b : NoneType = prim::Constant()
              %stride : int[] = prim::Constant[value=STRIDE]()
              %padding : int[] = prim::Constant[value=PADDING]()
              %dilation : int[] = prim::Constant[value=[1, 1]]()
              %groups : int = prim::Constant[value=4]()
              %conv : Tensor = aten::conv2d(%x, %w, %b, %stride, %padding, %dilation, %groups)
              return (%conv)
            """.replace("STRIDE", stride).replace("PADDING", padding));
        return graph.findAll(Symbols.CONV2D).get(0);
    }

    @Test
    @DisplayName("channels-last CPU convolution is eligible")
    void eligible() {
        Node node = conv(FusionGraphs.X_CHANNELS_LAST, FusionGraphs.W_CHANNELS_LAST);
        assertTrue(CHANNELS_LAST.isEligible(node));
        assertTrue(CHANNELS_LAST.rejectionReason(node).isEmpty());
    }

    @Nested
    @DisplayName("Layout")
    class Layout {

        @Test
        void contiguousActivationRejected() {
            Node node = conv(FusionGraphs.X_CONTIGUOUS, FusionGraphs.W_CHANNELS_LAST);
            assertTrue(CHANNELS_LAST.rejectionReason(node).orElseThrow().startsWith("activation"));
        }

        @Test
        void contiguousWeightRejected() {
            Node node = conv(FusionGraphs.X_CHANNELS_LAST, FusionGraphs.W_CONTIGUOUS);
            assertTrue(CHANNELS_LAST.rejectionReason(node).orElseThrow().startsWith("weight"));
        }

        @Test
        @DisplayName("missing strides make the layout unknown")
        void unknownLayoutRejected() {
            Node node = conv(FusionGraphs.X_UNKNOWN_SIZE, FusionGraphs.W_CHANNELS_LAST);
            assertFalse(CHANNELS_LAST.isEligible(node));
        }

        @Test
        @DisplayName("a contiguous preference accepts contiguous operands only")
        void contiguousPreference() {
            ConvEligibility contiguous = new ConvEligibility(MemoryFormat.CONTIGUOUS, VectorizedConvSupport.NONE);
            assertTrue(contiguous.isEligible(conv(FusionGraphs.X_CONTIGUOUS, FusionGraphs.W_CONTIGUOUS)));
            assertFalse(contiguous.isEligible(conv(FusionGraphs.X_CHANNELS_LAST, FusionGraphs.W_CHANNELS_LAST)));
        }
    }

    @Nested
    @DisplayName("Device")
    class DevicePlacement {

        @Test
        void cudaRejected() {
            Node node = conv(FusionGraphs.X_CUDA, FusionGraphs.W_CHANNELS_LAST);
            assertTrue(CHANNELS_LAST.rejectionReason(node).orElseThrow().contains("cuda:0"));
        }

        @Test
        void unknownDeviceRejected() {
            Node node = conv(FusionGraphs.X_NO_DEVICE, FusionGraphs.W_CHANNELS_LAST);
            assertTrue(CHANNELS_LAST.rejectionReason(node).orElseThrow().contains("no known device"));
        }
    }

    @Nested
    @DisplayName("Depthwise")
    class Depthwise {

        @Test
        @DisplayName("3x3 depthwise with stride 1 or 2 is left to the vectorized path")
        void claimedByVectorizedPath() {
            assertTrue(new DepthwiseConvSupport().claims(depthwise("[1, 1]", "[1, 1]")));
            assertTrue(new DepthwiseConvSupport().claims(depthwise("[2, 2]", "[1, 1]")));
            assertTrue(CHANNELS_LAST.rejectionReason(depthwise("[1, 1]", "[1, 1]"))
                    .orElseThrow().contains("depthwise"));
        }

        @Test
        void unsupportedHyperparametersNotClaimed() {
            DepthwiseConvSupport support = new DepthwiseConvSupport();
            assertFalse(support.claims(depthwise("[1, 2]", "[1, 1]")));
            assertFalse(support.claims(depthwise("[1, 1]", "[0, 0]")));
            assertTrue(CHANNELS_LAST.isEligible(depthwise("[1, 1]", "[0, 0]")));
        }

        @Test
        @DisplayName("a regular convolution is never claimed")
        void regularConvNotClaimed() {
            assertFalse(new DepthwiseConvSupport().claims(
                    conv(FusionGraphs.X_CHANNELS_LAST, FusionGraphs.W_CHANNELS_LAST)));
        }

        @Test
        @DisplayName("the config can hand depthwise convolutions to the prepacked path")
        void disabledByConfig() {
            ConvEligibility eligibility = ConvEligibility.forConfig(
                    FusionConfig.defaults().withLeaveDepthwiseToVectorizedPath(false));
            assertTrue(eligibility.isEligible(depthwise("[1, 1]", "[1, 1]")));
        }
    }
}

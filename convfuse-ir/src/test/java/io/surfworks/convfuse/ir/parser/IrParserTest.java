package io.surfworks.convfuse.ir.parser;

import java.util.List;
import java.util.Map;

import io.surfworks.convfuse.ir.Device;
import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.GraphPrinter;
import io.surfworks.convfuse.ir.Literals;
import io.surfworks.convfuse.ir.Literals.ListLiteral;
import io.surfworks.convfuse.ir.MemoryFormat;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.ScalarType;
import io.surfworks.convfuse.ir.Symbols;
import io.surfworks.convfuse.ir.Types;
import io.surfworks.convfuse.ir.Types.TensorType;
import io.surfworks.convfuse.ir.runtime.Tensor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IrParser")
class IrParserTest {

    @Nested
    @DisplayName("Graphs")
    class Graphs {

        @Test
        @DisplayName("parses inputs, nodes and the return list")
        void parseSimpleGraph() {
            Graph graph = IrParser.parse("""
                graph(%x : Float(1, 3, 8, 8, strides=[192, 1, 24, 3], device=cpu)):
                  %y : Tensor = aten::relu(%x)
                  return (%y)
                """);

            assertEquals(1, graph.inputs().size());
            assertEquals(1, graph.outputs().size());
            Node relu = graph.outputs().get(0).node();
            assertEquals(Symbols.RELU, relu.kind());
            assertSame(graph.inputs().get(0), relu.input(0));
            graph.lint();
        }

        @Test
        @DisplayName("printing and re-parsing gives the same canonical form")
        void printParseAgrees() {
            Graph graph = IrParser.parse("""
                graph(%x : Float(1, 4, device=cpu),
                      %cond : bool):
                  %one : int = prim::Constant[value=1]()
                  %r : Tensor = prim::If(%cond)
                    block0():
                      %a : Tensor = aten::relu(%x)
                      -> (%a)
                    block1():
                      %b : Tensor = aten::add(%x, %x, %one)
                      -> (%b)
                  return (%r)
                """);

            String canonical = GraphPrinter.canonical(graph);
            assertEquals(canonical, GraphPrinter.canonical(IrParser.parse(canonical)));
            assertEquals(2, graph.findAll(Symbols.IF).get(0).blocks().size());
        }

        @Test
        @DisplayName("comments are ignored")
        void comments() {
            Graph graph = IrParser.parse("""
                # a graph that does nothing
                graph(%x : Tensor):
                  return (%x)  # identity
                """);
            assertSame(graph.inputs().get(0), graph.outputs().get(0));
        }
    }

    @Nested
    @DisplayName("Constants")
    class Constants {

        @Test
        @DisplayName("literal forms")
        void literalForms() {
            Graph graph = IrParser.parse("""
                graph():
                  %i : int = prim::Constant[value=-2]()
                  %f : float = prim::Constant[value=2]()
                  %s : str = prim::Constant[value="none"]()
                  %b : bool = prim::Constant[value=false]()
                  %l : int[] = prim::Constant[value=[1, 1]]()
                  %n : NoneType = prim::Constant()
                  return (%i, %f, %s, %b, %l, %n)
                """);

            List<Node> nodes = graph.block().nodes();
            assertEquals(Literals.of(-2L), nodes.get(0).literal());
            assertEquals(Literals.of(2.0), nodes.get(1).literal());
            assertEquals(Literals.of("none"), nodes.get(2).literal());
            assertEquals(Literals.of(false), nodes.get(3).literal());
            assertEquals(Literals.intList(1, 1), nodes.get(4).literal());
            assertTrue(nodes.get(5).literal().isNone());
        }

        @Test
        @DisplayName("list element types follow the declared list type")
        void declaredListType() {
            Graph graph = IrParser.parse("""
                graph():
                  %l : Scalar?[] = prim::Constant[value=[2.0]]()
                  %e : Scalar?[] = prim::Constant[value=[]]()
                  return (%l, %e)
                """);

            ListLiteral list = (ListLiteral) graph.block().nodes().get(0).literal();
            assertEquals(Types.optionalOf(Types.NUMBER), list.elementType());
            assertEquals(List.of(Literals.of(2.0)), list.values());
            assertEquals(Types.listOf(Types.optionalOf(Types.NUMBER)), graph.outputs().get(1).type());
        }

        @Test
        @DisplayName("@name resolves against the supplied literals")
        void externals() {
            Tensor w = Tensor.zeros(4, 3, 3, 3);
            Graph graph = IrParser.parse("""
                graph():
                  %w : Float(4, 3, 3, 3, device=cpu) = prim::Constant[value=@w]()
                  return (%w)
                """, Map.of("w", Literals.of(w)));

            assertSame(w, graph.outputs().get(0).node().literal().toTensor());
        }

        @Test
        @DisplayName("an unknown @name is an error")
        void unknownExternal() {
            assertThrows(IrParseException.class, () -> IrParser.parse("""
                graph():
                  %w : Tensor = prim::Constant[value=@missing]()
                  return (%w)
                """));
        }
    }

    @Nested
    @DisplayName("Types")
    class TypeParsing {

        @Test
        @DisplayName("tensor sizes, strides and device")
        void tensorType() {
            TensorType t = (TensorType) IrParser.parseType("Float(1, 3, 8, 8, strides=[192, 1, 24, 3], device=cpu)");

            assertEquals(ScalarType.FLOAT, t.dtype());
            assertEquals(List.of(1L, 3L, 8L, 8L), t.sizes());
            assertEquals(Device.cpu(), t.device());
            assertTrue(t.isContiguous(MemoryFormat.CHANNELS_LAST));
            assertFalse(t.isContiguous(MemoryFormat.CONTIGUOUS));
        }

        @Test
        @DisplayName("unknown dimensions and devices")
        void partialTensorType() {
            TensorType t = (TensorType) IrParser.parseType("Float(1, 3, *, *, device=cuda:0)");

            assertTrue(t.concreteSizes().isEmpty());
            assertEquals(Device.cuda(0), t.device());
            assertNull(((TensorType) IrParser.parseType("Tensor")).sizes());
        }

        @Test
        @DisplayName("list, optional and class types")
        void compositeTypes() {
            assertEquals(Types.listOf(Types.INT), IrParser.parseType("int[]"));
            assertEquals(Types.optionalOf(Types.STRING), IrParser.parseType("str?"));
            assertEquals(Types.classType("mkldnn.ConvOpContext"),
                    IrParser.parseType("__torch__.torch.classes.mkldnn.ConvOpContext"));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("an undefined value reports its position")
        void undefinedValue() {
            IrParseException e = assertThrows(IrParseException.class, () -> IrParser.parse("""
                graph(%x : Tensor):
                  %y : Tensor = aten::relu(%z)
                  return (%y)
                """));
            assertEquals(2, e.getLine());
        }

        @Test
        @DisplayName("a value defined twice is rejected")
        void duplicateDefinition() {
            assertThrows(IrParseException.class, () -> IrParser.parse("""
                graph(%x : Tensor):
                  %x : Tensor = aten::relu(%x)
                  return (%x)
                """));
        }

        @Test
        @DisplayName("operator names must be qualified")
        void unqualifiedKind() {
            assertThrows(IrParseException.class, () -> IrParser.parse("""
                graph(%x : Tensor):
                  %y : Tensor = relu(%x)
                  return (%y)
                """));
        }
    }
}

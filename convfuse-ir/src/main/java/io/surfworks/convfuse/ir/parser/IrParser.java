package io.surfworks.convfuse.ir.parser;

import io.surfworks.convfuse.ir.Block;
import io.surfworks.convfuse.ir.Device;
import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.InsertPoint;
import io.surfworks.convfuse.ir.Literals;
import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.ScalarType;
import io.surfworks.convfuse.ir.Symbol;
import io.surfworks.convfuse.ir.Symbols;
import io.surfworks.convfuse.ir.Types;
import io.surfworks.convfuse.ir.Types.ListType;
import io.surfworks.convfuse.ir.Types.OptionalType;
import io.surfworks.convfuse.ir.Types.TensorType;
import io.surfworks.convfuse.ir.Types.Type;
import io.surfworks.convfuse.ir.Value;
import io.surfworks.convfuse.ir.parser.IrTokenizer.Token;
import io.surfworks.convfuse.ir.parser.IrTokenizer.TokenType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for the graph IR text format printed by {@link io.surfworks.convfuse.ir.GraphPrinter}.
 *
 * Implements a top-down recursive descent parser that builds a {@link Graph}
 * directly. Constants that have no textual form (tensors, packed objects) are
 * written as {@code @name} and resolved against a caller-supplied map:
 * <pre>
 * graph(%x : Float(1, 3, 8, 8, device=cpu)):
 *   %w : Float(4, 3, 3, 3, device=cpu) = prim::Constant[value=@weight]()
 *   %y : Tensor = aten::conv2d(%x, %w, ...)
 *   return (%y)
 * </pre>
 */
public final class IrParser {

    private final List<Token> tokens;
    private final Map<String, Literal> externals;
    private final Map<String, Value> valueMap = new HashMap<>();
    private int pos;
    private Graph graph;

    public IrParser(List<Token> tokens, Map<String, Literal> externals) {
        this.tokens = tokens;
        this.externals = externals;
        this.pos = 0;
    }

    public static Graph parse(String input) {
        return parse(input, Map.of());
    }

    public static Graph parse(String input, Map<String, Literal> externals) {
        IrTokenizer tokenizer = new IrTokenizer(input);
        IrParser parser = new IrParser(tokenizer.tokenize(), externals);
        return parser.parseGraph();
    }

    /**
     * Parses a standalone type such as {@code Float(1, 3, *, *)} or {@code int[]}.
     */
    public static Type parseType(String input) {
        IrParser parser = new IrParser(new IrTokenizer(input).tokenize(), Map.of());
        Type type = parser.parseType();
        parser.expect(TokenType.EOF);
        return type;
    }

    // ==================== Graph Parsing ====================

    public Graph parseGraph() {
        // graph(%x : T, ...): body return (%y, ...)
        graph = new Graph();
        valueMap.clear();

        expect(TokenType.IDENTIFIER, "graph");
        expect(TokenType.LPAREN);
        while (!check(TokenType.RPAREN)) {
            if (!graph.inputs().isEmpty()) {
                expect(TokenType.COMMA);
            }
            String name = parsePercentId();
            expect(TokenType.COLON);
            define(name, graph.addInput(name, parseType()));
        }
        expect(TokenType.RPAREN);
        expect(TokenType.COLON);

        parseBody();

        expect(TokenType.IDENTIFIER, "return");
        for (Value v : parseValueList()) {
            graph.registerOutput(v);
        }
        expect(TokenType.EOF);
        return graph;
    }

    private void parseBody() {
        while (!checkIdentifier("return") && !check(TokenType.ARROW)) {
            if (check(TokenType.EOF)) {
                throw error("Unexpected end of input, missing 'return'");
            }
            parseStatement();
        }
    }

    // ==================== Statement Parsing ====================

    private record OutputDecl(String name, Type type) {}

    private void parseStatement() {
        // %a : T, %b = ns::kind[value=...](%x, %y)   or   ns::kind(%x)
        List<OutputDecl> decls = new ArrayList<>();
        if (check(TokenType.PERCENT_ID)) {
            do {
                if (!decls.isEmpty()) {
                    expect(TokenType.COMMA);
                }
                String name = parsePercentId();
                Type type = null;
                if (check(TokenType.COLON)) {
                    advance();
                    type = parseType();
                }
                decls.add(new OutputDecl(name, type));
            } while (check(TokenType.COMMA));
            expect(TokenType.EQUALS);
        }

        Token kindToken = expect(TokenType.IDENTIFIER);
        if (!kindToken.value().contains("::")) {
            throw new IrParseException("Expected a qualified operator name, got " + kindToken.value(),
                    kindToken.line(), kindToken.column());
        }
        Symbol kind = Symbol.fromQualString(kindToken.value());

        Node node;
        if (kind.equals(Symbols.CONSTANT)) {
            node = parseConstant(decls);
        } else {
            if (check(TokenType.LBRACKET)) {
                throw error("Only prim::Constant takes attributes");
            }
            List<Value> inputs = parseValueList();
            node = graph.create(kind, inputs, decls.size());
            for (int i = 0; i < decls.size(); i++) {
                Type declared = decls.get(i).type();
                node.output(i).setType(declared != null ? declared : TensorType.unknown());
            }
            graph.insertNode(node);
        }

        for (int i = 0; i < decls.size(); i++) {
            String name = decls.get(i).name();
            define(name, node.output(i).setDebugName(name));
        }

        while (check(TokenType.IDENTIFIER) && peek().value().matches("block\\d+")) {
            parseBlock(node);
        }
    }

    private Node parseConstant(List<OutputDecl> decls) {
        if (decls.size() != 1) {
            throw error("prim::Constant must have exactly one output");
        }
        Type declared = decls.get(0).type();

        Literal literal = Literals.NONE;
        if (check(TokenType.LBRACKET)) {
            advance();
            expect(TokenType.IDENTIFIER, "value");
            expect(TokenType.EQUALS);
            literal = parseLiteral(declared);
            expect(TokenType.RBRACKET);
        }
        expect(TokenType.LPAREN);
        expect(TokenType.RPAREN);

        Node node = graph.createConstant(literal);
        if (declared != null) {
            node.output().setType(declared);
        }
        return graph.insertNode(node);
    }

    private void parseBlock(Node owner) {
        // block0(%p : T): body -> (%v)
        advance();
        Block block = owner.addBlock();
        expect(TokenType.LPAREN);
        while (!check(TokenType.RPAREN)) {
            if (!block.inputs().isEmpty()) {
                expect(TokenType.COMMA);
            }
            String name = parsePercentId();
            expect(TokenType.COLON);
            define(name, block.addInput(name, parseType()));
        }
        expect(TokenType.RPAREN);
        expect(TokenType.COLON);

        try (InsertPoint ignored = graph.insertPointAtEnd(block)) {
            parseBody();
        }
        expect(TokenType.ARROW);
        for (Value v : parseValueList()) {
            block.registerOutput(v);
        }
    }

    private List<Value> parseValueList() {
        expect(TokenType.LPAREN);
        List<Value> values = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            if (!values.isEmpty()) {
                expect(TokenType.COMMA);
            }
            values.add(lookupValue(parsePercentId()));
        }
        expect(TokenType.RPAREN);
        return values;
    }

    // ==================== Literal Parsing ====================

    private Literal parseLiteral(Type declared) {
        Token t = peek();
        switch (t.type()) {
            case INTEGER -> {
                advance();
                long value = Long.parseLong(t.value());
                return declared instanceof Types.FloatType ? Literals.of((double) value) : Literals.of(value);
            }
            case FLOAT -> {
                advance();
                return Literals.of(Double.parseDouble(t.value()));
            }
            case STRING -> {
                advance();
                return Literals.of(t.value());
            }
            case AT_ID -> {
                String name = parseAtId();
                Literal external = externals.get(name);
                if (external == null) {
                    throw new IrParseException("Unknown literal: @" + name, t.line(), t.column());
                }
                return external;
            }
            case LBRACKET -> {
                return parseListLiteral(declared);
            }
            case IDENTIFIER -> {
                advance();
                return switch (t.value()) {
                    case "true", "True" -> Literals.of(true);
                    case "false", "False" -> Literals.of(false);
                    case "None" -> Literals.NONE;
                    default -> throw new IrParseException("Unexpected literal: " + t.value(), t.line(), t.column());
                };
            }
            default -> throw error("Expected a literal, got " + t.type() + " (" + t.value() + ")");
        }
    }

    private Literal parseListLiteral(Type declared) {
        Type elementType = null;
        if (declared instanceof ListType list) {
            elementType = list.element();
        }
        Type itemHint = elementType instanceof OptionalType opt ? opt.element() : elementType;

        expect(TokenType.LBRACKET);
        List<Literal> items = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            if (!items.isEmpty()) {
                expect(TokenType.COMMA);
            }
            items.add(parseLiteral(itemHint));
        }
        expect(TokenType.RBRACKET);

        if (elementType == null) {
            elementType = inferElementType(items);
        }
        return new Literals.ListLiteral(items, elementType);
    }

    private static Type inferElementType(List<Literal> items) {
        if (items.isEmpty()) {
            return Types.INT;
        }
        boolean allInts = true;
        boolean allNumbers = true;
        Type first = items.get(0).type();
        boolean uniform = true;
        for (Literal item : items) {
            allInts &= item instanceof Literals.IntLiteral;
            allNumbers &= item instanceof Literals.IntLiteral || item instanceof Literals.FloatLiteral;
            uniform &= item.type().equals(first);
        }
        if (allInts) return Types.INT;
        if (uniform) return first;
        if (allNumbers) return Types.NUMBER;
        throw new IrParseException("Cannot infer the element type of a mixed list literal");
    }

    // ==================== Type Parsing ====================

    private Type parseType() {
        Type type = parseBaseType();
        while (true) {
            if (check(TokenType.LBRACKET) && peekAhead(1).type() == TokenType.RBRACKET) {
                advance();
                advance();
                type = Types.listOf(type);
            } else if (check(TokenType.QUESTION)) {
                advance();
                type = Types.optionalOf(type);
            } else {
                return type;
            }
        }
    }

    private Type parseBaseType() {
        Token t = expect(TokenType.IDENTIFIER);
        String name = t.value();
        switch (name) {
            case "int": return Types.INT;
            case "float": return Types.FLOAT;
            case "bool": return Types.BOOL;
            case "str": return Types.STRING;
            case "NoneType": return Types.NONE;
            case "Scalar": return Types.NUMBER;
            case "Tensor": return parseTensorArgs(null);
            default: break;
        }
        if (name.startsWith(Types.CLASS_PREFIX)) {
            return Types.classType(name.substring(Types.CLASS_PREFIX.length()));
        }
        ScalarType dtype = ScalarType.fromIrName(name);
        if (dtype == null) {
            throw new IrParseException("Unknown type: " + name, t.line(), t.column());
        }
        return parseTensorArgs(dtype);
    }

    private TensorType parseTensorArgs(ScalarType dtype) {
        // Float(1, 3, *, *, strides=[...], device=cpu)
        if (!check(TokenType.LPAREN)) {
            return new TensorType(dtype, null, null, null);
        }
        advance();

        List<Long> sizes = new ArrayList<>();
        List<Long> strides = null;
        Device device = null;
        boolean first = true;
        while (!check(TokenType.RPAREN)) {
            if (!first) {
                expect(TokenType.COMMA);
            }
            first = false;

            if (check(TokenType.INTEGER)) {
                sizes.add(Long.parseLong(advance().value()));
            } else if (check(TokenType.STAR)) {
                advance();
                sizes.add(null);
            } else if (checkIdentifier("strides")) {
                advance();
                expect(TokenType.EQUALS);
                strides = parseIntegerList();
            } else if (checkIdentifier("device")) {
                advance();
                expect(TokenType.EQUALS);
                device = parseDevice();
            } else {
                throw error("Unexpected tensor type argument: " + peek().value());
            }
        }
        expect(TokenType.RPAREN);

        if (sizes.isEmpty() && strides == null) {
            sizes = null;
        }
        try {
            return new TensorType(dtype, sizes, strides, device);
        } catch (IllegalArgumentException e) {
            throw error(e.getMessage());
        }
    }

    private Device parseDevice() {
        Token t = expect(TokenType.IDENTIFIER);
        String text = t.value();
        if (check(TokenType.COLON)) {
            advance();
            text = text + ":" + expect(TokenType.INTEGER).value();
        }
        try {
            return Device.parse(text);
        } catch (IllegalArgumentException e) {
            throw new IrParseException("Unknown device: " + text, t.line(), t.column());
        }
    }

    private List<Long> parseIntegerList() {
        expect(TokenType.LBRACKET);
        List<Long> values = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            if (!values.isEmpty()) {
                expect(TokenType.COMMA);
            }
            values.add(Long.parseLong(expect(TokenType.INTEGER).value()));
        }
        expect(TokenType.RBRACKET);
        return values;
    }

    // ==================== Helpers ====================

    private void define(String name, Value value) {
        if (valueMap.putIfAbsent(name, value) != null) {
            throw error("Value %" + name + " is defined twice");
        }
    }

    private String parsePercentId() {
        Token t = expect(TokenType.PERCENT_ID);
        return t.value().substring(1); // Remove leading %
    }

    private String parseAtId() {
        Token t = expect(TokenType.AT_ID);
        return t.value().substring(1); // Remove leading @
    }

    private Value lookupValue(String name) {
        Value v = valueMap.get(name);
        if (v == null) {
            throw error("Undefined value: %" + name);
        }
        return v;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token advance() {
        return tokens.get(pos++);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkIdentifier(String value) {
        Token t = peek();
        return t.type() == TokenType.IDENTIFIER && t.value().equals(value);
    }

    private Token expect(TokenType type) {
        Token t = peek();
        if (t.type() != type) {
            throw error("Expected " + type + ", got " + t.type() + " (" + t.value() + ")");
        }
        return advance();
    }

    private Token expect(TokenType type, String value) {
        Token t = peek();
        if (t.type() != type || !t.value().equals(value)) {
            throw error("Expected " + type + "(" + value + "), got " + t.type() + "(" + t.value() + ")");
        }
        return advance();
    }

    private IrParseException error(String message) {
        Token t = peek();
        return new IrParseException(message, t.line(), t.column());
    }
}

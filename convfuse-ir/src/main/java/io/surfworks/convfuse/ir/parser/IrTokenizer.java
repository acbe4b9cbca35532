package io.surfworks.convfuse.ir.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the graph IR text format.
 *
 * Recognizes:
 * - Identifiers, including qualified operator names (aten::conv2d) and
 *   dotted class names (__torch__.torch.classes.mkldnn.ConvOpContext)
 * - Sigils: % for values, @ for caller-supplied literals
 * - Punctuation: ( ) [ ] : , = -> ? *
 * - Numeric literals: integers and floats
 * - String literals: "..."
 * - Line comments starting with #
 */
public final class IrTokenizer {

    public enum TokenType {
        IDENTIFIER,      // graph, aten::conv2d, Float, int, block0
        PERCENT_ID,      // %x, %3, %conv_out
        AT_ID,           // @weight

        INTEGER,         // 0, 1, -3
        FLOAT,           // 0.5, 1e-3
        STRING,          // "relu"

        LPAREN,          // (
        RPAREN,          // )
        LBRACKET,        // [
        RBRACKET,        // ]
        COLON,           // :
        COMMA,           // ,
        EQUALS,          // =
        ARROW,           // ->
        QUESTION,        // ?
        STAR,            // *

        EOF
    }

    public record Token(TokenType type, String value, int line, int column) {
        @Override
        public String toString() {
            return String.format("%s(%s)@%d:%d", type, value, line, column);
        }
    }

    private final String input;
    private int pos;
    private int line;
    private int column;

    public IrTokenizer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (pos < input.length()) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) break;
            tokens.add(nextToken());
        }

        tokens.add(new Token(TokenType.EOF, "", line, column));
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);

            if (c == ' ' || c == '\t' || c == '\r') {
                pos++;
                column++;
            } else if (c == '\n') {
                pos++;
                line++;
                column = 1;
            } else if (c == '#') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    private Token nextToken() {
        int startLine = line;
        int startCol = column;
        char c = input.charAt(pos);

        if (c == '-' && pos + 1 < input.length() && input.charAt(pos + 1) == '>') {
            pos += 2;
            column += 2;
            return new Token(TokenType.ARROW, "->", startLine, startCol);
        }

        TokenType punct = switch (c) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case ':' -> TokenType.COLON;
            case ',' -> TokenType.COMMA;
            case '=' -> TokenType.EQUALS;
            case '?' -> TokenType.QUESTION;
            case '*' -> TokenType.STAR;
            default -> null;
        };

        if (punct != null) {
            pos++;
            column++;
            return new Token(punct, String.valueOf(c), startLine, startCol);
        }

        if (c == '%' || c == '@') {
            return scanSigilId(c == '%' ? TokenType.PERCENT_ID : TokenType.AT_ID, startLine, startCol);
        }

        if (c == '"') {
            return scanString(startLine, startCol);
        }

        if (Character.isDigit(c) || (c == '-' && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1)))) {
            return scanNumber(startLine, startCol);
        }

        if (Character.isLetter(c) || c == '_') {
            return scanIdentifier(startLine, startCol);
        }

        throw new IrParseException(String.format("Unexpected character '%c'", c), startLine, startCol);
    }

    private Token scanSigilId(TokenType type, int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        sb.append(input.charAt(pos++));
        column++;

        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                sb.append(c);
                pos++;
                column++;
            } else {
                break;
            }
        }

        if (sb.length() == 1) {
            throw new IrParseException("Empty name after '" + sb + "'", startLine, startCol);
        }
        return new Token(type, sb.toString(), startLine, startCol);
    }

    private Token scanString(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        pos++; // opening "
        column++;

        while (true) {
            if (pos >= input.length()) {
                throw new IrParseException("Unterminated string literal", startLine, startCol);
            }
            char c = input.charAt(pos++);
            column++;
            if (c == '"') {
                break;
            }
            if (c == '\\' && pos < input.length()) {
                sb.append(input.charAt(pos++));
                column++;
            } else {
                sb.append(c);
            }
        }

        return new Token(TokenType.STRING, sb.toString(), startLine, startCol);
    }

    private Token scanNumber(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        boolean hasDecimal = false;

        if (input.charAt(pos) == '-') {
            sb.append('-');
            pos++;
            column++;
        }

        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isDigit(c)) {
                sb.append(c);
                pos++;
                column++;
            } else if (c == '.' && !hasDecimal) {
                hasDecimal = true;
                sb.append(c);
                pos++;
                column++;
            } else if (c == 'e' || c == 'E') {
                hasDecimal = true;
                sb.append(c);
                pos++;
                column++;
                if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) {
                    sb.append(input.charAt(pos++));
                    column++;
                }
            } else {
                break;
            }
        }

        TokenType type = hasDecimal ? TokenType.FLOAT : TokenType.INTEGER;
        return new Token(type, sb.toString(), startLine, startCol);
    }

    private Token scanIdentifier(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();

        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                sb.append(c);
                pos++;
                column++;
            } else if (c == ':' && pos + 2 < input.length() && input.charAt(pos + 1) == ':'
                    && (Character.isLetter(input.charAt(pos + 2)) || input.charAt(pos + 2) == '_')) {
                // Qualified operator name such as aten::conv2d
                sb.append("::");
                pos += 2;
                column += 2;
            } else {
                break;
            }
        }

        return new Token(TokenType.IDENTIFIER, sb.toString(), startLine, startCol);
    }
}

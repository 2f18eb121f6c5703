package com.pyflow.python;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tokenizer for Python source. Emits INDENT / DEDENT from leading whitespace, suppresses newlines
 * inside brackets and after a backslash continuation, and decodes string and number literals.
 * Blank and comment-only lines produce no tokens.
 */
public final class PythonLexer {

    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...", "!=", "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">", "(", ")", "[", "]", "{", "}",
            ",", ":", ".", ";", "="
    };

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private static final int TAB_SIZE = 8;

    private record Bracket(char open, int line, int column) {
    }

    private final String src;
    private int pos;
    private int line = 1;
    private int lineStart;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Bracket> brackets = new ArrayDeque<>();

    private PythonLexer(String source) {
        this.src = source.startsWith("\uFEFF") ? source.substring(1) : source;
        indents.push(0);
    }

    /**
     * Tokenizes the whole source.
     *
     * @throws SourceSyntaxException on an invalid character, unterminated string, unmatched or
     *                               unclosed bracket, or inconsistent dedent
     */
    public static List<Token> tokenize(String source) {
        PythonLexer lexer = new PythonLexer(source != null ? source : "");
        lexer.run();
        return lexer.tokens;
    }

    private void run() {
        boolean atLineStart = true;
        while (true) {
            if (atLineStart && brackets.isEmpty()) {
                if (!readIndentation()) break;
                atLineStart = false;
            }
            if (pos >= src.length()) break;
            char c = src.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                continuation();
            } else if (c == '\n' || c == '\r') {
                newline();
                if (brackets.isEmpty()) {
                    if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE) {
                        tokens.add(new Token(TokenType.NEWLINE, "\n", null, line - 1, 0, line - 1));
                    }
                    atLineStart = true;
                }
            } else if (isIdentifierStart(c)) {
                identifierOrString();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1)))) {
                number();
            } else if (c == '"' || c == '\'') {
                string(pos, "");
            } else {
                operator();
            }
        }
        if (!brackets.isEmpty()) {
            Bracket open = brackets.peek();
            throw new SourceSyntaxException("'" + open.open() + "' was never closed", open.line(), open.column());
        }
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE) {
            tokens.add(new Token(TokenType.NEWLINE, "", null, line, column(), line));
        }
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", null, line, 1, line));
        }
        tokens.add(new Token(TokenType.ENDMARKER, "", null, line, column(), line));
    }

    /**
     * Measures indentation of the next logical line, skipping blank and comment-only lines.
     *
     * @return false at end of input
     */
    private boolean readIndentation() {
        while (pos < src.length()) {
            int width = 0;
            int p = pos;
            while (p < src.length()) {
                char c = src.charAt(p);
                if (c == ' ') width++;
                else if (c == '\t') width = (width / TAB_SIZE + 1) * TAB_SIZE;
                else if (c == '\f') width = 0;
                else break;
                p++;
            }
            if (p >= src.length()) {
                pos = p;
                return false;
            }
            char c = src.charAt(p);
            if (c == '#' || c == '\n' || c == '\r' || (c == '\\' && isLineEnd(p + 1))) {
                pos = p;
                if (c == '#') skipComment();
                if (pos < src.length() && src.charAt(pos) == '\\') pos++;
                if (pos < src.length()) newline();
                continue;
            }
            pos = p;
            int current = indents.peek();
            if (width > current) {
                indents.push(width);
                tokens.add(new Token(TokenType.INDENT, "", null, line, 1, line));
            } else if (width < current) {
                while (indents.peek() > width) {
                    indents.pop();
                    tokens.add(new Token(TokenType.DEDENT, "", null, line, 1, line));
                }
                if (indents.peek() != width) {
                    throw new SourceSyntaxException("unindent does not match any outer indentation level", line, width + 1);
                }
            }
            return true;
        }
        return false;
    }

    private boolean isLineEnd(int p) {
        return p >= src.length() || src.charAt(p) == '\n' || src.charAt(p) == '\r';
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n' && src.charAt(pos) != '\r') pos++;
    }

    private void continuation() {
        int startCol = column();
        pos++;
        if (pos < src.length() && (src.charAt(pos) == '\n' || src.charAt(pos) == '\r')) {
            newline();
            return;
        }
        if (pos >= src.length()) throw new SourceSyntaxException("unexpected end of input after line continuation", line, startCol);
        throw new SourceSyntaxException("unexpected character after line continuation character", line, startCol);
    }

    private void newline() {
        if (src.charAt(pos) == '\r' && pos + 1 < src.length() && src.charAt(pos + 1) == '\n') pos++;
        pos++;
        line++;
        lineStart = pos;
    }

    private int column() {
        return pos - lineStart + 1;
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private void identifierOrString() {
        int start = pos;
        while (pos < src.length() && isIdentifierPart(src.charAt(pos))) pos++;
        String text = src.substring(start, pos);
        if (pos < src.length() && (src.charAt(pos) == '"' || src.charAt(pos) == '\'')
                && STRING_PREFIXES.contains(text.toLowerCase(Locale.ROOT))) {
            string(start, text.toLowerCase(Locale.ROOT));
            return;
        }
        tokens.add(new Token(TokenType.NAME, text, null, line, start - lineStart + 1, line));
    }

    private void string(int start, String prefix) {
        int startLine = line;
        int startCol = start - lineStart + 1;
        char quote = src.charAt(pos);
        boolean triple = pos + 2 < src.length() && src.charAt(pos + 1) == quote && src.charAt(pos + 2) == quote;
        int delimiter = triple ? 3 : 1;
        pos += delimiter;
        int bodyStart = pos;
        while (true) {
            if (pos >= src.length()) {
                throw new SourceSyntaxException(triple ? "unterminated triple-quoted string literal"
                        : "unterminated string literal", startLine, startCol);
            }
            char c = src.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos < src.length() && (src.charAt(pos) == '\n' || src.charAt(pos) == '\r')) {
                    newline();
                } else {
                    pos++;
                }
                continue;
            }
            if (c == '\n' || c == '\r') {
                if (!triple) throw new SourceSyntaxException("unterminated string literal", startLine, startCol);
                newline();
                continue;
            }
            if (c == quote && (!triple || (pos + 2 < src.length()
                    && src.charAt(pos + 1) == quote && src.charAt(pos + 2) == quote))) {
                String body = src.substring(bodyStart, pos);
                pos += delimiter;
                boolean raw = prefix.contains("r");
                boolean formatted = prefix.contains("f");
                boolean bytes = prefix.contains("b");
                String value = raw || formatted ? body : decodeEscapes(body);
                tokens.add(new Token(TokenType.STRING, src.substring(start, pos),
                        new StringLiteral(value, bytes, formatted), startLine, startCol, line));
                return;
            }
            pos++;
        }
    }

    static String decodeEscapes(String body) {
        if (body.indexOf('\\') < 0) return body;
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                continue;
            }
            char n = body.charAt(++i);
            switch (n) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '0' -> sb.append('\0');
                case 'a' -> sb.append('\u0007');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'v' -> sb.append('\u000B');
                case '\\', '\'', '"' -> sb.append(n);
                case '\n' -> {
                }
                case '\r' -> {
                    if (i + 1 < body.length() && body.charAt(i + 1) == '\n') i++;
                }
                case 'x' -> i = appendCodePoint(sb, body, i, 2);
                case 'u' -> i = appendCodePoint(sb, body, i, 4);
                case 'U' -> i = appendCodePoint(sb, body, i, 8);
                default -> sb.append('\\').append(n);
            }
        }
        return sb.toString();
    }

    private static int appendCodePoint(StringBuilder sb, String body, int i, int digits) {
        if (i + digits >= body.length()) {
            sb.append('\\').append(body.charAt(i));
            return i;
        }
        String hex = body.substring(i + 1, i + 1 + digits);
        try {
            sb.appendCodePoint(Integer.parseInt(hex, 16));
            return i + digits;
        } catch (IllegalArgumentException e) {
            sb.append('\\').append(body.charAt(i));
            return i;
        }
    }

    private void number() {
        int start = pos;
        int col = column();
        boolean isFloat = false;
        if (src.charAt(pos) == '0' && pos + 1 < src.length() && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
            char radixChar = Character.toLowerCase(src.charAt(pos + 1));
            pos += 2;
            while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
            String text = src.substring(start, pos);
            int radix = radixChar == 'x' ? 16 : radixChar == 'o' ? 8 : 2;
            try {
                BigInteger v = new BigInteger(text.substring(2).replace("_", ""), radix);
                tokens.add(new Token(TokenType.NUMBER, text, narrow(v), line, col, line));
            } catch (NumberFormatException e) {
                throw new SourceSyntaxException("invalid number literal '" + text + "'", line, col);
            }
            return;
        }
        digits();
        if (pos < src.length() && src.charAt(pos) == '.') {
            isFloat = true;
            pos++;
            digits();
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) pos++;
            if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                isFloat = true;
                digits();
            } else {
                pos = save;
            }
        }
        boolean complex = pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J');
        if (complex) pos++;
        if (pos < src.length() && isIdentifierStart(src.charAt(pos))) {
            throw new SourceSyntaxException("invalid decimal literal", line, col);
        }
        String text = src.substring(start, pos);
        String clean = text.replace("_", "");
        Object value;
        if (complex) {
            value = text;
        } else if (isFloat) {
            value = Double.valueOf(clean);
        } else {
            value = narrow(new BigInteger(clean));
        }
        tokens.add(new Token(TokenType.NUMBER, text, value, line, col, line));
    }

    private void digits() {
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
    }

    /** Integer when the value fits, then Long, else the BigInteger itself. */
    private static Object narrow(BigInteger v) {
        if (v.bitLength() < 32) return v.intValue();
        if (v.bitLength() < 64) return v.longValue();
        return v;
    }

    private void operator() {
        int col = column();
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                char c = op.charAt(0);
                if (op.length() == 1 && (c == '(' || c == '[' || c == '{')) {
                    brackets.push(new Bracket(c, line, col));
                } else if (op.length() == 1 && (c == ')' || c == ']' || c == '}')) {
                    closeBracket(c, col);
                }
                pos += op.length();
                tokens.add(new Token(TokenType.OP, op, null, line, col, line));
                return;
            }
        }
        char c = src.charAt(pos);
        if (c == '!') throw new SourceSyntaxException("invalid syntax", line, col);
        throw new SourceSyntaxException("invalid character '" + c + "' (U+"
                + String.format("%04X", (int) c) + ")", line, col);
    }

    private void closeBracket(char close, int col) {
        if (brackets.isEmpty()) throw new SourceSyntaxException("unmatched '" + close + "'", line, col);
        Bracket open = brackets.pop();
        char expected = switch (open.open()) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
        if (expected != close) {
            throw new SourceSyntaxException("closing parenthesis '" + close + "' does not match opening parenthesis '"
                    + open.open() + "' on line " + open.line(), line, col);
        }
    }
}

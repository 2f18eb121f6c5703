package com.pyflow.python;

/**
 * Lexical token. {@code text} is the source text; {@code value} is the decoded literal for
 * {@link TokenType#NUMBER} and {@link TokenType#STRING} tokens and null otherwise.
 *
 * @param line    1-based line of the first character
 * @param column  1-based column of the first character
 * @param endLine line of the last character (differs from {@code line} for triple-quoted strings)
 */
public record Token(TokenType type, String text, Object value, int line, int column, int endLine) {

    public boolean is(TokenType t, String s) {
        return type == t && text.equals(s);
    }

    public boolean isOp(String s) {
        return type == TokenType.OP && text.equals(s);
    }

    public boolean isName(String s) {
        return type == TokenType.NAME && text.equals(s);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NEWLINE -> "NEWLINE";
            case INDENT -> "INDENT";
            case DEDENT -> "DEDENT";
            case ENDMARKER -> "end of input";
            default -> "'" + text + "'";
        };
    }
}

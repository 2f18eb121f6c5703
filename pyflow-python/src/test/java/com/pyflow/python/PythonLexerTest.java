package com.pyflow.python;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PythonLexerTest {

    private static List<TokenType> types(String source) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : PythonLexer.tokenize(source)) out.add(t.type());
        return out;
    }

    @Test
    void indentAndDedentAroundBlock() {
        String source = """
                if x:
                    y = 1
                z = 2
                """;
        assertEquals(List.of(
                TokenType.NAME, TokenType.NAME, TokenType.OP, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.NAME, TokenType.OP, TokenType.NUMBER, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.NAME, TokenType.OP, TokenType.NUMBER, TokenType.NEWLINE,
                TokenType.ENDMARKER), types(source));
    }

    @Test
    void blankAndCommentLinesDoNotAffectIndentation() {
        String source = """
                def f():

                    # comment
                    return 1
                """;
        List<TokenType> types = types(source);
        assertEquals(1, types.stream().filter(t -> t == TokenType.INDENT).count());
        assertEquals(1, types.stream().filter(t -> t == TokenType.DEDENT).count());
    }

    @Test
    void newlinesInsideBracketsAreIgnored() {
        String source = """
                df = pd.read_csv(
                    "in.csv",
                    sep=";",
                )
                """;
        List<TokenType> types = types(source);
        assertEquals(1, types.stream().filter(t -> t == TokenType.NEWLINE).count());
        assertFalse(types.contains(TokenType.INDENT));
    }

    @Test
    void backslashContinuationJoinsLines() {
        List<TokenType> types = types("x = 1 + \\\n    2\n");
        assertEquals(1, types.stream().filter(t -> t == TokenType.NEWLINE).count());
    }

    @Test
    void stringLiteralsAndPrefixes() {
        List<Token> tokens = PythonLexer.tokenize("a = 'x\\ty'\nb = r'\\d+'\nc = f\"{v}\"\nd = '''multi\nline'''\n");
        StringLiteral plain = (StringLiteral) tokens.get(2).value();
        assertEquals("x\ty", plain.value());
        StringLiteral raw = (StringLiteral) tokens.get(6).value();
        assertEquals("\\d+", raw.value());
        StringLiteral formatted = (StringLiteral) tokens.get(10).value();
        assertTrue(formatted.formatted());
        StringLiteral multi = (StringLiteral) tokens.get(14).value();
        assertEquals("multi\nline", multi.value());
    }

    @Test
    void numbersAreNarrowed() {
        List<Token> tokens = PythonLexer.tokenize("1 0x1F 1_000 2.5 1e3 12345678901 99999999999999999999 3j");
        assertEquals(1, tokens.get(0).value());
        assertEquals(31, tokens.get(1).value());
        assertEquals(1000, tokens.get(2).value());
        assertEquals(2.5, tokens.get(3).value());
        assertEquals(1000.0, tokens.get(4).value());
        assertEquals(12345678901L, tokens.get(5).value());
        assertEquals(new BigInteger("99999999999999999999"), tokens.get(6).value());
        assertEquals("3j", tokens.get(7).value());
    }

    @Test
    void operatorsUseLongestMatch() {
        List<Token> tokens = PythonLexer.tokenize("a //= b ** c != d");
        assertEquals("//=", tokens.get(1).text());
        assertEquals("**", tokens.get(3).text());
        assertEquals("!=", tokens.get(5).text());
    }

    @Test
    void unclosedBracketReportsOpeningPosition() {
        SourceSyntaxException e = assertThrows(SourceSyntaxException.class,
                () -> PythonLexer.tokenize("x = 1\ndf = broken(\n"));
        assertEquals(2, e.getLine());
        assertEquals(12, e.getColumn());
    }

    @Test
    void lexicalErrors() {
        assertThrows(SourceSyntaxException.class, () -> PythonLexer.tokenize("x = )"));
        assertThrows(SourceSyntaxException.class, () -> PythonLexer.tokenize("x = 'abc\n"));
        assertThrows(SourceSyntaxException.class, () -> PythonLexer.tokenize("x = (1]"));
        assertThrows(SourceSyntaxException.class, () -> PythonLexer.tokenize("x = 1 $ 2"));
        assertThrows(SourceSyntaxException.class, () -> PythonLexer.tokenize("if x:\n        a\n    b\n"));
    }
}

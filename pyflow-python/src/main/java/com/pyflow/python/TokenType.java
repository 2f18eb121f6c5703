package com.pyflow.python;

/** Token categories produced by {@link PythonLexer}. Keywords are {@link #NAME} tokens. */
public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    ENDMARKER
}

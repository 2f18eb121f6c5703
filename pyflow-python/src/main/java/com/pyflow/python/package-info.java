/**
 * Lexer and recursive-descent parser for the Python subset pandas scripts use; builds the
 * tree in {@link com.pyflow.python.ast}.
 */
package com.pyflow.python;

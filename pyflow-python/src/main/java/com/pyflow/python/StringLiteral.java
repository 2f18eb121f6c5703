package com.pyflow.python;

/**
 * Decoded string literal.
 *
 * @param value    contents with escapes processed (raw and f-strings are kept as written)
 * @param bytes    {@code b''} literal
 * @param formatted {@code f''} literal
 */
public record StringLiteral(String value, boolean bytes, boolean formatted) {
}

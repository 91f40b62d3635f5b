package org.pragmatica.pascal.ast;

/**
 * Declared variable type. Parsed, not checked.
 */
public enum TypeSpec {
    INTEGER,
    REAL
}

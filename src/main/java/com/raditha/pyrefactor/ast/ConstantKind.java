package com.raditha.pyrefactor.ast;

/**
 * Kinds of non-string literal constants.
 */
public enum ConstantKind {
    NUMBER,
    NONE,
    TRUE,
    FALSE,
    ELLIPSIS
}

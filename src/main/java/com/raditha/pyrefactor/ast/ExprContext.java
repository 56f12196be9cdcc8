package com.raditha.pyrefactor.ast;

/**
 * How a name, attribute or subscript is used at its position.
 */
public enum ExprContext {
    LOAD,
    STORE,
    DEL
}

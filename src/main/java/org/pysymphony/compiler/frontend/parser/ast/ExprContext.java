package org.pysymphony.compiler.frontend.parser.ast;

/**
 * How an expression is used: read, bound, or deleted.
 */
public enum ExprContext {
    LOAD,
    STORE,
    DEL
}

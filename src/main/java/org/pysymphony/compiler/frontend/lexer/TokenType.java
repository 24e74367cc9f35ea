package org.pysymphony.compiler.frontend.lexer;

public enum TokenType {
    NAME,
    KEYWORD,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    END_OF_FILE
}

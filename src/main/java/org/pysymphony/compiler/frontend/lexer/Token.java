package org.pysymphony.compiler.frontend.lexer;

/**
 * A lexical token.
 *
 * @param type      The token type.
 * @param text      The exact source text (empty for layout tokens).
 * @param line      1-based line of the first character.
 * @param column    0-based column of the first character.
 * @param offset    Absolute offset of the first character.
 * @param endOffset Absolute offset one past the last character.
 * @param fileName  The source file.
 */
public record Token(TokenType type, String text, int line, int column, int offset, int endOffset, String fileName) {

    public boolean isOp(String op) {
        return type == TokenType.OP && text.equals(op);
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    /**
     * @return true for NEWLINE, INDENT, DEDENT and END_OF_FILE.
     */
    public boolean isLayout() {
        return type == TokenType.NEWLINE || type == TokenType.INDENT
                || type == TokenType.DEDENT || type == TokenType.END_OF_FILE;
    }

    @Override
    public String toString() {
        return type + "('" + text + "') at " + line + ":" + column;
    }
}

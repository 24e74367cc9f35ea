package org.pysymphony.compiler.frontend.lexer;

import org.pysymphony.compiler.api.ParseFailureException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Turns Python source into tokens, including the NEWLINE/INDENT/DEDENT layout tokens.
 * A lexer can also be restricted to a sub-range of a file, which is how replacement
 * fields of f-strings are tokenized with their absolute positions intact.
 */
public class Lexer {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    // Longest first so that the first match is the longest one.
    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "->", ":=", "**", "//", ">>", "<<", "<=", ">=", "==", "!=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "="
    };

    private static final int TAB_SIZE = 8;

    private final String source;
    private final String fileName;
    private final int end;
    private final boolean expressionMode;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();

    private int pos;
    private int line;
    private int lineStart;
    private int bracketDepth;

    /**
     * Creates a lexer for a complete file.
     * @param source The file content.
     * @param fileName The file name used in tokens and errors.
     */
    public Lexer(String source, String fileName) {
        this(source, fileName, 0, source.length(), 1, 0, false);
    }

    private Lexer(String source, String fileName, int start, int end, int line, int lineStart, boolean expressionMode) {
        this.source = source;
        this.fileName = fileName;
        this.pos = start;
        this.end = end;
        this.line = line;
        this.lineStart = lineStart;
        this.expressionMode = expressionMode;
        this.bracketDepth = expressionMode ? 1 : 0;
        this.indents.push(0);
    }

    /**
     * Creates a lexer for an embedded expression, e.g. an f-string replacement field.
     * No layout tokens are produced; positions are absolute within {@code source}.
     * @param source The full file content.
     * @param fileName The file name.
     * @param start The offset of the expression.
     * @param end The offset one past the expression.
     * @param line The line of {@code start}.
     * @param lineStart The offset of the first character of that line.
     * @return The lexer.
     */
    public static Lexer forExpression(String source, String fileName, int start, int end, int line, int lineStart) {
        return new Lexer(source, fileName, start, end, line, lineStart, true);
    }

    /**
     * Scans the whole input.
     * @return The tokens, always terminated by END_OF_FILE.
     * @throws ParseFailureException if the input contains a lexical error.
     */
    public List<Token> scanTokens() throws ParseFailureException {
        boolean atLineStart = !expressionMode;
        while (pos < end) {
            if (atLineStart) {
                atLineStart = false;
                if (!handleIndentation()) {
                    atLineStart = true;
                    continue;
                }
            }
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\' && isLineBreak(pos + 1)) {
                pos++;
                consumeLineBreak();
            } else if (c == '\n' || c == '\r') {
                if (bracketDepth > 0) {
                    consumeLineBreak();
                } else {
                    addToken(TokenType.NEWLINE, pos, pos, line, pos - lineStart);
                    consumeLineBreak();
                    atLineStart = true;
                }
            } else if (isIdentifierStart(c)) {
                scanIdentifierOrPrefixedString();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < end && Character.isDigit(source.charAt(pos + 1)))) {
                scanNumber();
            } else if (c == '"' || c == '\'') {
                scanString(pos);
            } else {
                scanOperator();
            }
        }
        if (!expressionMode) {
            if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE) {
                addToken(TokenType.NEWLINE, end, end, line, end - lineStart);
            }
            while (indents.peek() > 0) {
                indents.pop();
                addToken(TokenType.DEDENT, end, end, line, end - lineStart);
            }
        }
        addToken(TokenType.END_OF_FILE, end, end, line, end - lineStart);
        return tokens;
    }

    /**
     * Measures the indentation of a new logical line and emits INDENT/DEDENT tokens.
     * @return false if the line is blank or a comment and has been skipped.
     */
    private boolean handleIndentation() throws ParseFailureException {
        int width = 0;
        while (pos < end) {
            char c = source.charAt(pos);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            pos++;
        }
        if (pos >= end) {
            return false;
        }
        char c = source.charAt(pos);
        if (c == '#') {
            skipComment();
            if (pos < end) {
                consumeLineBreak();
            }
            return false;
        }
        if (c == '\n' || c == '\r') {
            consumeLineBreak();
            return false;
        }
        if (c == '\\' && isLineBreak(pos + 1)) {
            return true;
        }
        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            addToken(TokenType.INDENT, pos, pos, line, pos - lineStart);
        } else {
            while (width < indents.peek()) {
                indents.pop();
                addToken(TokenType.DEDENT, pos, pos, line, pos - lineStart);
            }
            if (width != indents.peek()) {
                throw error("unindent does not match any outer indentation level", line);
            }
        }
        return true;
    }

    private void scanIdentifierOrPrefixedString() throws ParseFailureException {
        int start = pos;
        while (pos < end && isIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        String text = source.substring(start, pos);
        if (pos < end && (source.charAt(pos) == '"' || source.charAt(pos) == '\'') && isStringPrefix(text)) {
            scanString(start);
            return;
        }
        addToken(KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.NAME, start, pos, line, start - lineStart);
    }

    private void scanNumber() {
        int start = pos;
        if (source.charAt(pos) == '0' && pos + 1 < end && "xXoObB".indexOf(source.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < end && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            skipDigits();
            if (pos < end && source.charAt(pos) == '.') {
                pos++;
                skipDigits();
            }
            if (pos < end && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < end && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < end && Character.isDigit(source.charAt(pos))) {
                    skipDigits();
                } else {
                    pos = mark;
                }
            }
            if (pos < end && (source.charAt(pos) == 'j' || source.charAt(pos) == 'J')) {
                pos++;
            }
        }
        addToken(TokenType.NUMBER, start, pos, line, start - lineStart);
    }

    private void skipDigits() {
        while (pos < end && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
    }

    /**
     * Scans a string literal whose prefix (if any) starts at {@code start} and whose
     * opening quote is at the current position.
     */
    private void scanString(int start) throws ParseFailureException {
        int startLine = line;
        int startColumn = start - lineStart;
        char quote = source.charAt(pos);
        boolean triple = pos + 2 < end && source.charAt(pos + 1) == quote && source.charAt(pos + 2) == quote;
        pos += triple ? 3 : 1;
        while (true) {
            if (pos >= end) {
                throw error("unterminated string literal", startLine);
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos < end && isLineBreak(pos)) {
                    consumeLineBreak();
                } else {
                    pos++;
                }
            } else if (c == '\n' || c == '\r') {
                if (!triple) {
                    throw error("unterminated string literal", startLine);
                }
                consumeLineBreak();
            } else if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (pos + 2 < end && source.charAt(pos + 1) == quote && source.charAt(pos + 2) == quote) {
                    pos += 3;
                    break;
                }
                pos++;
            } else {
                pos++;
            }
        }
        addToken(TokenType.STRING, start, pos, startLine, startColumn);
    }

    private void scanOperator() throws ParseFailureException {
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos) && pos + op.length() <= end) {
                int start = pos;
                pos += op.length();
                switch (op) {
                    case "(", "[", "{" -> bracketDepth++;
                    case ")", "]", "}" -> bracketDepth = Math.max(expressionMode ? 1 : 0, bracketDepth - 1);
                    default -> {
                    }
                }
                addToken(TokenType.OP, start, pos, line, start - lineStart);
                return;
            }
        }
        throw error("invalid character '" + source.charAt(pos) + "'", line);
    }

    private void skipComment() {
        while (pos < end && source.charAt(pos) != '\n' && source.charAt(pos) != '\r') {
            pos++;
        }
    }

    private boolean isLineBreak(int at) {
        return at < end && (source.charAt(at) == '\n' || source.charAt(at) == '\r');
    }

    private void consumeLineBreak() {
        if (source.charAt(pos) == '\r' && pos + 1 < end && source.charAt(pos + 1) == '\n') {
            pos++;
        }
        pos++;
        line++;
        lineStart = pos;
    }

    private void addToken(TokenType type, int start, int stop, int tokenLine, int column) {
        tokens.add(new Token(type, source.substring(start, stop), tokenLine, column, start, stop, fileName));
    }

    private ParseFailureException error(String message, int errorLine) {
        return new ParseFailureException(message, fileName, errorLine);
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private static boolean isStringPrefix(String text) {
        if (text.length() > 2) {
            return false;
        }
        String lower = text.toLowerCase();
        return switch (lower) {
            case "r", "u", "b", "f", "br", "rb", "fr", "rf" -> true;
            default -> false;
        };
    }
}

package org.pysymphony.compiler.frontend.lexer;

import org.pysymphony.compiler.api.ParseFailureException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LexerTest {

    private static List<TokenType> types(String source) throws ParseFailureException {
        return new Lexer(source, "test.py").scanTokens().stream().map(Token::type).toList();
    }

    @Test
    void simpleAssignment_producesNameOpNumberNewline() throws Exception {
        List<Token> tokens = new Lexer("x = 1\n", "test.py").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.NAME, TokenType.OP, TokenType.NUMBER, TokenType.NEWLINE, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).text()).isEqualTo("x");
        assertThat(tokens.get(2).offset()).isEqualTo(4);
    }

    @Test
    void indentedBlock_producesIndentAndDedent() throws Exception {
        assertThat(types("if x:\n    y\n")).containsExactly(
                TokenType.KEYWORD, TokenType.NAME, TokenType.OP, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.NAME, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.END_OF_FILE);
    }

    @Test
    void lineBreakInsideBrackets_isNotANewline() throws Exception {
        assertThat(types("f(1,\n  2)\n")).containsExactly(
                TokenType.NAME, TokenType.OP, TokenType.NUMBER, TokenType.OP, TokenType.NUMBER, TokenType.OP,
                TokenType.NEWLINE, TokenType.END_OF_FILE);
    }

    @Test
    void blankAndCommentLines_produceNoTokens() throws Exception {
        assertThat(types("# header\n\nx\n    # indented comment\ny\n")).containsExactly(
                TokenType.NAME, TokenType.NEWLINE, TokenType.NAME, TokenType.NEWLINE, TokenType.END_OF_FILE);
    }

    @Test
    void missingFinalNewline_isSupplied() throws Exception {
        assertThat(types("x")).containsExactly(TokenType.NAME, TokenType.NEWLINE, TokenType.END_OF_FILE);
    }

    @Test
    void prefixedAndTripleQuotedStrings_areSingleTokens() throws Exception {
        List<Token> tokens = new Lexer("s = f'{a}' + \"\"\"one\ntwo\"\"\"\n", "test.py").scanTokens();

        assertThat(tokens).filteredOn(token -> token.type() == TokenType.STRING)
                .extracting(Token::text)
                .containsExactly("f'{a}'", "\"\"\"one\ntwo\"\"\"");
    }

    @Test
    void keywordsAreDistinguishedFromNames() throws Exception {
        List<Token> tokens = new Lexer("def match(lambda_): pass\n", "test.py").scanTokens();

        assertThat(tokens.get(0).isKeyword("def")).isTrue();
        assertThat(tokens.get(1).type()).isEqualTo(TokenType.NAME);
        assertThat(tokens.get(3).type()).isEqualTo(TokenType.NAME);
    }

    @Test
    void unterminatedString_failsWithLine() {
        assertThatThrownBy(() -> new Lexer("x = 1\ny = 'abc\n", "bad.py").scanTokens())
                .isInstanceOf(ParseFailureException.class)
                .hasMessageContaining("unterminated string literal")
                .hasMessageContaining("bad.py:2");
    }

    @Test
    void inconsistentDedent_fails() {
        assertThatThrownBy(() -> new Lexer("if x:\n        y\n    z\n", "bad.py").scanTokens())
                .isInstanceOf(ParseFailureException.class)
                .hasMessageContaining("unindent does not match");
    }
}

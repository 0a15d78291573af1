package org.tensorscript.compiler.frontend;

import org.tensorscript.compiler.diagnostics.DiagnosticsEngine;
import org.tensorscript.compiler.frontend.lexer.Lexer;
import org.tensorscript.compiler.frontend.lexer.Token;
import org.tensorscript.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that script source is turned into a token stream with the block structure
 * made explicit through INDENT and DEDENT tokens.
 */
public class LexerTest {

    /**
     * Verifies that a small function definition is tokenized with its indentation tokens and that
     * a NEWLINE is added before the trailing DEDENT when the source does not end with a line break.
     */
    @Test
    @Tag("unit")
    void tokenizesFunctionWithIndentation() {
        // Arrange
        String source = String.join("\n",
                "def f(x):",
                "    return x");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.DEF, TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.IDENTIFIER,
                TokenType.RIGHT_PAREN, TokenType.COLON, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.RETURN, TokenType.IDENTIFIER, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.END_OF_FILE);
        assertThat(tokens.get(1).text()).isEqualTo("f");
        assertThat(tokens.get(8).line()).isEqualTo(2);
        assertThat(tokens.get(8).column()).isEqualTo(5);
    }

    /**
     * Verifies that integer literals carry a {@link Long} value and float literals a {@link Double}.
     */
    @Test
    @Tag("unit")
    void numbersCarryTypedValues() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer("x = 42 + 2.5 * 1e3 - 0x10", diagnostics).scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.get(2)).extracting(Token::type, Token::value).containsExactly(TokenType.INTEGER, 42L);
        assertThat(tokens.get(4)).extracting(Token::type, Token::value).containsExactly(TokenType.FLOAT, 2.5);
        assertThat(tokens.get(6)).extracting(Token::type, Token::value).containsExactly(TokenType.FLOAT, 1000.0);
        assertThat(tokens.get(8)).extracting(Token::type, Token::value).containsExactly(TokenType.INTEGER, 16L);
    }

    /**
     * Verifies that two-character operators are recognized as single tokens.
     */
    @Test
    @Tag("unit")
    void recognizesCompoundOperators() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer("a // b ** c == d != e <= f >= g -> h", diagnostics).scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).contains(
                TokenType.DOUBLE_SLASH, TokenType.DOUBLE_STAR, TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
                TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL, TokenType.ARROW);
    }

    /**
     * Verifies that comments and blank lines do not produce tokens or change the block structure.
     */
    @Test
    @Tag("unit")
    void ignoresCommentsAndBlankLines() {
        // Arrange
        String source = String.join("\n",
                "# leading comment",
                "def f(x):",
                "",
                "    # inside",
                "    y = x  # trailing",
                "    return y",
                "");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.INDENT).hasSize(1);
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.DEDENT).hasSize(1);
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.DEF);
    }

    /**
     * Verifies that line breaks inside brackets continue the logical line.
     */
    @Test
    @Tag("unit")
    void bracketsJoinPhysicalLines() {
        // Arrange
        String source = String.join("\n",
                "y = op.Add(a,",
                "           b)");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.NEWLINE).hasSize(1);
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.INDENT).isEmpty();
    }

    /**
     * Verifies that string literals are unquoted and that an unterminated string is reported.
     */
    @Test
    @Tag("unit")
    void scansStringsAndReportsUnterminatedOnes() {
        // Arrange
        DiagnosticsEngine ok = new DiagnosticsEngine();
        DiagnosticsEngine broken = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer("mode = 'constant'", ok).scanTokens();
        new Lexer("mode = 'constant", broken).scanTokens();

        // Assert
        assertThat(ok.hasErrors()).isFalse();
        assertThat(tokens.get(2)).extracting(Token::type, Token::value).containsExactly(TokenType.STRING, "constant");
        assertThat(broken.hasErrors()).isTrue();
        assertThat(broken.summary()).contains("Unterminated string.");
    }
}

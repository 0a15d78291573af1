package org.tensorscript.compiler.frontend.lexer;

import org.tensorscript.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Block structure is expressed by indentation. The lexer tracks the indentation of each
 * logical line and emits {@link TokenType#INDENT} and {@link TokenType#DEDENT} tokens when it
 * changes. Line breaks inside brackets do not end a logical line.
 */
public class Lexer {

    private static final int TAB_WIDTH = 8;

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("def", TokenType.DEF),
            Map.entry("return", TokenType.RETURN),
            Map.entry("if", TokenType.IF),
            Map.entry("elif", TokenType.ELIF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("for", TokenType.FOR),
            Map.entry("in", TokenType.IN),
            Map.entry("while", TokenType.WHILE),
            Map.entry("break", TokenType.BREAK),
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT),
            Map.entry("True", TokenType.TRUE),
            Map.entry("False", TokenType.FALSE),
            Map.entry("None", TokenType.NONE),
            Map.entry("import", TokenType.IMPORT),
            Map.entry("as", TokenType.AS)
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private final Deque<Integer> indentStack = new ArrayDeque<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int bracketDepth = 0;
    private boolean atLineStart = true;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
        this.indentStack.push(0);
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            if (atLineStart && bracketDepth == 0) {
                scanIndentation();
                if (isAtEnd()) break;
                if (atLineStart) continue;
            }
            start = current;
            scanToken();
        }
        start = current;
        if (!tokens.isEmpty() && lastType() != TokenType.NEWLINE && lastType() != TokenType.DEDENT) {
            addToken(TokenType.NEWLINE, null, "");
        }
        while (indentStack.peek() > 0) {
            indentStack.pop();
            addToken(TokenType.DEDENT, null, "");
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current - lineStart + 1, logicalFileName));
        return tokens;
    }

    private void scanIndentation() {
        int width = 0;
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t' || peek() == '\f')) {
            char c = source.charAt(current++);
            width = c == '\t' ? (width / TAB_WIDTH + 1) * TAB_WIDTH : width + 1;
        }
        if (isAtEnd()) return;
        char c = peek();
        if (c == '#') {
            while (peek() != '\n' && !isAtEnd()) current++;
            return;
        }
        if (c == '\r') {
            current++;
            return;
        }
        if (c == '\n') {
            // Blank lines do not affect the block structure.
            current++;
            newLine();
            return;
        }

        start = current;
        atLineStart = false;
        int top = indentStack.peek();
        if (width > top) {
            indentStack.push(width);
            addToken(TokenType.INDENT, null, "");
        } else if (width < top) {
            while (indentStack.peek() > width) {
                indentStack.pop();
                addToken(TokenType.DEDENT, null, "");
            }
            if (indentStack.peek() != width) {
                diagnostics.reportError("Inconsistent dedent: indentation does not match any outer block.", logicalFileName, line);
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': bracketDepth++; addToken(TokenType.LEFT_PAREN); break;
            case ')': bracketDepth = Math.max(0, bracketDepth - 1); addToken(TokenType.RIGHT_PAREN); break;
            case '[': bracketDepth++; addToken(TokenType.LEFT_BRACKET); break;
            case ']': bracketDepth = Math.max(0, bracketDepth - 1); addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '@': addToken(TokenType.AT); break;
            case '&': addToken(TokenType.AMPERSAND); break;
            case '|': addToken(TokenType.PIPE); break;
            case '-': addToken(match('>') ? TokenType.ARROW : TokenType.MINUS); break;
            case '*': addToken(match('*') ? TokenType.DOUBLE_STAR : TokenType.STAR); break;
            case '/': addToken(match('/') ? TokenType.DOUBLE_SLASH : TokenType.SLASH); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '!':
                if (match('=')) {
                    addToken(TokenType.BANG_EQUAL);
                } else {
                    diagnostics.reportError("Unexpected character: !", logicalFileName, line);
                }
                break;
            case '.':
                if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
                break;
            case '#':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '\\':
                match('\r');
                if (match('\n')) {
                    newLine();
                    atLineStart = false;
                } else {
                    diagnostics.reportError("Unexpected character after line continuation.", logicalFileName, line);
                }
                break;
            case '"', '\'':
                string(c);
                break;
            case ' ', '\r', '\t', '\f':
                break;
            case '\n':
                if (bracketDepth == 0) {
                    addToken(TokenType.NEWLINE);
                    newLine();
                } else {
                    newLine();
                    atLineStart = false;
                }
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    diagnostics.reportError("Unexpected character: " + c, logicalFileName, line);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void number() {
        boolean isFloat = source.charAt(start) == '.';
        // Recognize hex/binary/octal prefixes right at the start of a number
        if (previous() == '0' && "xXbBoO".indexOf(peek()) >= 0) {
            advance();
            while (isAlphaNumeric(peek())) advance();
        } else {
            while (isDigit(peek()) || peek() == '_') advance();
            if (!isFloat && peek() == '.' && !isAlpha(peekNext())) {
                isFloat = true;
                advance();
                while (isDigit(peek()) || peek() == '_') advance();
            }
            if (peek() == 'e' || peek() == 'E') {
                char sign = peekNext();
                if (isDigit(sign) || ((sign == '+' || sign == '-') && isDigit(peekAt(current + 2)))) {
                    isFloat = true;
                    advance();
                    if (peek() == '+' || peek() == '-') advance();
                    while (isDigit(peek())) advance();
                }
            }
        }

        String numberString = source.substring(start, current);
        try {
            if (isFloat) {
                addToken(TokenType.FLOAT, Double.parseDouble(numberString.replace("_", "")));
            } else {
                addToken(TokenType.INTEGER, parseInteger(numberString));
            }
        } catch (NumberFormatException e) {
            diagnostics.reportError("Invalid number format: " + numberString, logicalFileName, line);
        }
    }

    private long parseInteger(String token) throws NumberFormatException {
        String s = token.replace("_", "");
        int radix = 10;
        if (s.startsWith("0b") || s.startsWith("0B")) {
            radix = 2;
            s = s.substring(2);
        } else if (s.startsWith("0x") || s.startsWith("0X")) {
            radix = 16;
            s = s.substring(2);
        } else if (s.startsWith("0o") || s.startsWith("0O")) {
            radix = 8;
            s = s.substring(2);
        }

        if (s.isEmpty()) throw new NumberFormatException("Empty numeric literal");
        return Long.parseLong(s, radix);
    }

    private void string(char quote) {
        boolean triple = peek() == quote && peekNext() == quote;
        if (triple) {
            advance();
            advance();
        }
        StringBuilder value = new StringBuilder();
        while (!isAtEnd()) {
            char c = peek();
            if (c == quote && (!triple || (peekNext() == quote && peekAt(current + 2) == quote))) {
                break;
            }
            if (c == '\n') {
                if (!triple) {
                    diagnostics.reportError("Unterminated string.", logicalFileName, line);
                    return;
                }
                advance();
                value.append('\n');
                line++;
                lineStart = current;
                continue;
            }
            advance();
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    case '0' -> value.append('\0');
                    case '\n' -> {
                        line++;
                        lineStart = current;
                    }
                    default -> value.append(escaped);
                }
            } else {
                value.append(c);
            }
        }

        if (isAtEnd()) {
            diagnostics.reportError("Unterminated string.", logicalFileName, line);
            return;
        }

        // The closing quote(s)
        advance();
        if (triple) {
            advance();
            advance();
        }
        addToken(TokenType.STRING, value.toString(), source.substring(start, current));
    }

    private void newLine() {
        line++;
        lineStart = current;
        atLineStart = true;
    }

    private TokenType lastType() {
        return tokens.get(tokens.size() - 1).type();
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        addToken(type, literal, text);
    }

    private void addToken(TokenType type, Object literal, String text) {
        int column = Math.max(1, start - lineStart + 1);
        tokens.add(new Token(type, text, literal, line, column, logicalFileName));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(current);
    }

    private char peekNext() {
        return peekAt(current + 1);
    }

    private char peekAt(int index) {
        if (index >= source.length()) return '\0';
        return source.charAt(index);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}

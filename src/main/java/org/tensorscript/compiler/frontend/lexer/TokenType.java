package org.tensorscript.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,
    /** The '[' character. */
    LEFT_BRACKET,
    /** The ']' character. */
    RIGHT_BRACKET,
    /** The ',' character. */
    COMMA,
    /** The ':' character, used for blocks, slices and annotations. */
    COLON,
    /** The '.' character, used for attribute access. */
    DOT,
    /** The '=' character, used for assignment and keyword arguments. */
    EQUAL,

    // Operators.
    /** The '+' operator. */
    PLUS,
    /** The '-' operator. */
    MINUS,
    /** The '*' operator. */
    STAR,
    /** The '**' operator. */
    DOUBLE_STAR,
    /** The '/' operator. */
    SLASH,
    /** The '//' operator. */
    DOUBLE_SLASH,
    /** The '%' operator. */
    PERCENT,
    /** The '@' operator (matrix product). */
    AT,
    /** The '&amp;' operator. */
    AMPERSAND,
    /** The '|' operator. */
    PIPE,
    /** The '==' operator. */
    EQUAL_EQUAL,
    /** The '!=' operator. */
    BANG_EQUAL,
    /** The '&lt;' operator. */
    LESS,
    /** The '&lt;=' operator. */
    LESS_EQUAL,
    /** The '&gt;' operator. */
    GREATER,
    /** The '&gt;=' operator. */
    GREATER_EQUAL,
    /** The '-&gt;' marker of a return annotation. */
    ARROW,

    // Literals.
    /** An identifier, such as a variable, function or opset name. */
    IDENTIFIER,
    /** An integer literal; the value is a {@link Long}. */
    INTEGER,
    /** A floating-point literal; the value is a {@link Double}. */
    FLOAT,
    /** A string literal; the value is the unquoted content. */
    STRING,

    // Keywords.
    /** The 'def' keyword. */
    DEF,
    /** The 'return' keyword. */
    RETURN,
    /** The 'if' keyword. */
    IF,
    /** The 'elif' keyword. */
    ELIF,
    /** The 'else' keyword. */
    ELSE,
    /** The 'for' keyword. */
    FOR,
    /** The 'in' keyword. */
    IN,
    /** The 'while' keyword. */
    WHILE,
    /** The 'break' keyword. */
    BREAK,
    /** The 'and' keyword. */
    AND,
    /** The 'or' keyword. */
    OR,
    /** The 'not' keyword. */
    NOT,
    /** The 'True' literal. */
    TRUE,
    /** The 'False' literal. */
    FALSE,
    /** The 'None' literal. */
    NONE,
    /** The 'import' keyword. */
    IMPORT,
    /** The 'as' keyword. */
    AS,

    // Layout.
    /** The end of a logical line. */
    NEWLINE,
    /** An increase of the indentation level. */
    INDENT,
    /** A decrease of the indentation level. */
    DEDENT,
    /** Represents the end of the source file. */
    END_OF_FILE
}

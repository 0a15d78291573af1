package org.tensorscript.compiler.ir;

/**
 * The result of lowering one expression: the name of the value holding it and whether
 * the value is a compile-time constant.
 *
 * @param name The value name.
 * @param kind Whether the value is constant.
 */
public record TranslatedExpression(String name, Kind kind) {

    /**
     * The foldability of a translated value.
     */
    public enum Kind {
        /** A constant known at translation time, e.g. a literal or an attribute parameter. */
        CONST,
        /** Any runtime value. */
        ANY
    }

    public static TranslatedExpression constant(String name) {
        return new TranslatedExpression(name, Kind.CONST);
    }

    public static TranslatedExpression any(String name) {
        return new TranslatedExpression(name, Kind.ANY);
    }

    public boolean isConstant() {
        return kind == Kind.CONST;
    }
}

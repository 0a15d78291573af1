package org.tensorscript.compiler.schema;

/**
 * A formal input of an operator.
 *
 * @param name The parameter name.
 * @param typeStr A type-variable symbol such as {@code "T"}, or a concrete type such as {@code "tensor(int64)"}.
 * @param option The multiplicity of the parameter.
 * @param homogeneous For variadic parameters: whether all actual arguments share one type.
 */
public record FormalParameter(String name, String typeStr, Option option, boolean homogeneous) {

    /**
     * The multiplicity of a formal parameter.
     */
    public enum Option {
        SINGLE,
        OPTIONAL,
        VARIADIC
    }

    /**
     * Creates a single, required parameter.
     * @param name The parameter name.
     * @param typeStr The type string.
     * @return The parameter.
     */
    public static FormalParameter single(String name, String typeStr) {
        return new FormalParameter(name, typeStr, Option.SINGLE, true);
    }

    /**
     * @return {@code true} if the type string is a symbolic type variable rather than a concrete type.
     */
    public boolean isTypeVariable() {
        return !typeStr.contains("(");
    }

    public boolean isVariadic() {
        return option == Option.VARIADIC;
    }

    public boolean isOptional() {
        return option == Option.OPTIONAL;
    }
}

package org.tensorscript.compiler.types;

/**
 * The meaning of a parameter annotation.
 */
public sealed interface TypeAnnotation {

    /**
     * A dataflow input of the given tensor type.
     * @param type The declared tensor type.
     */
    record TensorAnnotation(TensorType type) implements TypeAnnotation {}

    /**
     * A compile-time attribute parameter.
     * @param type The attribute type.
     * @param bool {@code true} if the script declared {@code bool}; such attributes are stored as ints.
     */
    record AttributeAnnotation(AttributeType type, boolean bool) implements TypeAnnotation {}

    /**
     * No usable annotation; the parameter is an untyped dataflow input.
     */
    record Untyped() implements TypeAnnotation {}
}

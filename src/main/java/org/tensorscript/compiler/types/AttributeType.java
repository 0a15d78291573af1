package org.tensorscript.compiler.types;

import java.util.Arrays;
import java.util.Optional;

/**
 * The types of compile-time attributes.
 */
public enum AttributeType {
    FLOAT("float", "value_float"),
    INT("int", "value_int"),
    STRING("string", "value_string"),
    TENSOR("tensor", "value"),
    GRAPH("graph", null),
    FLOATS("floats", "value_floats"),
    INTS("ints", "value_ints"),
    STRINGS("strings", "value_strings");

    private final String schemaName;
    private final String constantAttribute;

    AttributeType(String schemaName, String constantAttribute) {
        this.schemaName = schemaName;
        this.constantAttribute = constantAttribute;
    }

    /**
     * @return The spelling used in operator schemas and in the interchange form.
     */
    public String schemaName() {
        return schemaName;
    }

    /**
     * @return The attribute of a {@code Constant} node that holds a value of this type, or {@code null} for graphs.
     */
    public String constantAttribute() {
        return constantAttribute;
    }

    /**
     * @param name The schema spelling, e.g. {@code "ints"}.
     * @return The attribute type, or empty if unknown.
     */
    public static Optional<AttributeType> fromSchemaName(String name) {
        return Arrays.stream(values()).filter(t -> t.schemaName.equals(name)).findFirst();
    }
}

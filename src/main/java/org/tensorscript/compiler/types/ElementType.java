package org.tensorscript.compiler.types;

import java.util.Arrays;
import java.util.Optional;

/**
 * The element types a tensor value can carry, with their interchange-format codes.
 */
public enum ElementType {
    FLOAT(1, "float"),
    UINT8(2, "uint8"),
    INT8(3, "int8"),
    INT16(5, "int16"),
    INT32(6, "int32"),
    INT64(7, "int64"),
    STRING(8, "string"),
    BOOL(9, "bool"),
    FLOAT16(10, "float16"),
    DOUBLE(11, "double");

    private final int code;
    private final String typeName;

    ElementType(int code, String typeName) {
        this.code = code;
        this.typeName = typeName;
    }

    /**
     * @return The numeric code used by the interchange format and by the {@code to} attribute of {@code Cast}.
     */
    public int code() {
        return code;
    }

    /**
     * @return The lower-case type name, e.g. {@code "int64"}.
     */
    public String typeName() {
        return typeName;
    }

    /**
     * @return The schema type string of a tensor of this element type, e.g. {@code "tensor(int64)"}.
     */
    public String tensorTypeString() {
        return "tensor(" + typeName + ")";
    }

    /**
     * @return {@code true} for the floating point types.
     */
    public boolean isFloatingPoint() {
        return this == FLOAT || this == DOUBLE || this == FLOAT16;
    }

    /**
     * Resolves an element type by its annotation spelling, e.g. {@code FLOAT} or {@code INT64}.
     * @param name The annotation name.
     * @return The element type, or empty if the name is not an element type.
     */
    public static Optional<ElementType> fromAnnotationName(String name) {
        return Arrays.stream(values()).filter(t -> t.name().equals(name)).findFirst();
    }

    /**
     * Resolves an element type by its numeric code.
     * @param code The interchange code.
     * @return The element type, or empty if the code is unknown.
     */
    public static Optional<ElementType> fromCode(int code) {
        return Arrays.stream(values()).filter(t -> t.code == code).findFirst();
    }
}

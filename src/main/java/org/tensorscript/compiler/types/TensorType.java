package org.tensorscript.compiler.types;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The static type of a tensor value: its element type and an optional shape.
 *
 * @param elementType The element type.
 * @param shape The dimensions, each a {@code Long} or a symbolic {@code String}; {@code null} if the rank is unknown.
 */
public record TensorType(ElementType elementType, List<Object> shape) {

    public TensorType {
        Objects.requireNonNull(elementType, "elementType");
        shape = shape == null ? null : List.copyOf(shape);
    }

    /**
     * Creates a tensor type of unknown rank.
     * @param elementType The element type.
     * @return The tensor type.
     */
    public static TensorType of(ElementType elementType) {
        return new TensorType(elementType, null);
    }

    /**
     * Creates a rank-0 tensor type.
     * @param elementType The element type.
     * @return The tensor type.
     */
    public static TensorType scalar(ElementType elementType) {
        return new TensorType(elementType, List.of());
    }

    @Override
    public String toString() {
        if (shape == null) return elementType.name();
        return elementType.name() + shape.stream().map(String::valueOf).collect(Collectors.joining(",", "[", "]"));
    }
}

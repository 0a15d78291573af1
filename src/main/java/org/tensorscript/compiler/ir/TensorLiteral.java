package org.tensorscript.compiler.ir;

import org.tensorscript.compiler.types.ElementType;

import java.util.List;
import java.util.Objects;

/**
 * A constant tensor embedded in the graph, e.g. the {@code value} of a {@code Constant} node.
 * Values are stored flat: {@code Boolean} for BOOL, {@code Long} for integer types,
 * {@code Double} for floating point types and {@code String} for STRING.
 *
 * @param elementType The element type.
 * @param dims The dimensions; empty for a rank-0 tensor.
 * @param values The flattened values.
 */
public record TensorLiteral(ElementType elementType, List<Long> dims, List<Object> values) {

    public TensorLiteral {
        Objects.requireNonNull(elementType, "elementType");
        dims = List.copyOf(dims);
        values = List.copyOf(values);
    }

    /**
     * @return The rank of the tensor.
     */
    public int rank() {
        return dims.size();
    }
}

package org.tensorscript.runtime.model;

import org.tensorscript.compiler.ir.TensorLiteral;
import org.tensorscript.compiler.types.ElementType;

import java.util.List;
import java.util.Objects;

/**
 * A minimal typed tensor value of the interpreted path. It carries data only; there are no kernels.
 */
public final class Tensor {

    private final ElementType elementType;
    private final List<Long> dims;
    private final List<Object> values;

    /**
     * Creates a tensor.
     * @param elementType The element type.
     * @param dims The dimensions; empty for a scalar.
     * @param values The flattened values.
     * @throws IllegalArgumentException if the number of values does not match the dimensions.
     */
    public Tensor(ElementType elementType, List<Long> dims, List<Object> values) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        this.dims = List.copyOf(dims);
        this.values = List.copyOf(values);
        long expected = this.dims.stream().reduce(1L, (a, b) -> a * b);
        if (expected != this.values.size()) {
            throw new IllegalArgumentException("Tensor of shape " + this.dims + " needs " + expected
                    + " values but got " + this.values.size());
        }
    }

    /**
     * @param literal A tensor literal.
     * @return A tensor with the same type, shape and values.
     */
    public static Tensor fromLiteral(TensorLiteral literal) {
        return new Tensor(literal.elementType(), literal.dims(), literal.values());
    }

    /**
     * @param elementType The element type.
     * @param value The single value.
     * @return A rank-0 tensor.
     */
    public static Tensor scalar(ElementType elementType, Object value) {
        return new Tensor(elementType, List.of(), List.of(value));
    }

    public ElementType elementType() {
        return elementType;
    }

    public List<Long> dims() {
        return dims;
    }

    public List<Object> values() {
        return values;
    }

    public int rank() {
        return dims.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tensor other)) return false;
        return elementType == other.elementType && dims.equals(other.dims) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementType, dims, values);
    }

    @Override
    public String toString() {
        return "Tensor(" + elementType.typeName() + dims + ", " + values + ")";
    }
}

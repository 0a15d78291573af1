package org.tensorscript.compiler.autocast;

import org.tensorscript.compiler.api.EmptyListException;
import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.api.TypeMismatchException;
import org.tensorscript.compiler.ir.TensorLiteral;
import org.tensorscript.compiler.types.ElementType;

import java.util.ArrayList;
import java.util.List;

/**
 * The literal promotion rule shared by both autocast specializations.
 * <p>
 * Booleans become rank-0 BOOL, integers rank-0 INT64, floats rank-0 FLOAT and strings rank-0 STRING.
 * A list becomes a rank-1 tensor of its first element's promoted type; all elements must share that
 * Java type. Empty lists cannot be promoted.
 */
public final class LiteralPromotion {

    private LiteralPromotion() {}

    /**
     * @param value A value.
     * @return {@code true} if the value is a literal the dynamic specialization turns into a tensor.
     */
    public static boolean isPromotable(Object value) {
        if (value instanceof Boolean || isIntegral(value) || isFloating(value)) return true;
        return value instanceof List<?>;
    }

    /**
     * Returns the element type a literal is promoted to.
     * @param value The literal.
     * @param source The literal's position, for error reporting.
     * @return The promoted element type.
     * @throws EmptyListException for an empty list.
     * @throws TypeMismatchException for a heterogeneous list or a value without a tensor representation.
     */
    public static ElementType promotedType(Object value, SourceInfo source) {
        if (value instanceof List<?> list) {
            if (list.isEmpty()) {
                throw new EmptyListException("Cannot convert an empty list to a tensor.", source);
            }
            Object first = list.get(0);
            if (first instanceof List<?>) {
                throw new TypeMismatchException("Nested lists cannot be converted to a tensor.", source);
            }
            Class<?> kind = javaKind(first);
            for (Object element : list) {
                if (element == null || javaKind(element) != kind) {
                    throw new TypeMismatchException("Cannot convert a list with elements of different types to a tensor.", source);
                }
            }
            return scalarType(first, source);
        }
        return scalarType(value, source);
    }

    /**
     * Promotes a literal to a tensor of its default element type.
     * @param value The literal.
     * @param source The literal's position.
     * @return The tensor.
     */
    public static TensorLiteral promote(Object value, SourceInfo source) {
        return promote(value, null, source);
    }

    /**
     * Promotes a literal to a tensor, converting its values to a bound element type.
     * @param value The literal.
     * @param target The element type to convert to, or {@code null} for the default promotion.
     * @param source The literal's position.
     * @return The tensor.
     * @throws TypeMismatchException if a value cannot be represented in the target type.
     */
    public static TensorLiteral promote(Object value, ElementType target, SourceInfo source) {
        ElementType promoted = promotedType(value, source);
        ElementType elementType = target != null ? target : promoted;
        List<Object> values = new ArrayList<>();
        List<Long> dims;
        if (value instanceof List<?> list) {
            dims = List.of((long) list.size());
            for (Object element : list) {
                values.add(convert(element, elementType, source));
            }
        } else {
            dims = List.of();
            values.add(convert(value, elementType, source));
        }
        return new TensorLiteral(elementType, dims, values);
    }

    private static ElementType scalarType(Object value, SourceInfo source) {
        if (value instanceof Boolean) return ElementType.BOOL;
        if (isIntegral(value)) return ElementType.INT64;
        if (isFloating(value)) return ElementType.FLOAT;
        if (value instanceof String) return ElementType.STRING;
        throw new TypeMismatchException("Value " + value + " cannot be converted to a tensor.", source);
    }

    private static Object convert(Object value, ElementType type, SourceInfo source) {
        if (type == ElementType.STRING) {
            if (value instanceof String) return value;
            throw new TypeMismatchException("Value " + value + " cannot be converted to " + type.typeName() + ".", source);
        }
        if (value instanceof String) {
            throw new TypeMismatchException("String '" + value + "' cannot be converted to " + type.typeName() + ".", source);
        }
        if (type == ElementType.BOOL) {
            if (value instanceof Boolean) return value;
            return ((Number) value).doubleValue() != 0.0;
        }
        double asDouble = value instanceof Boolean b ? (b ? 1 : 0) : ((Number) value).doubleValue();
        if (type.isFloatingPoint()) {
            return asDouble;
        }
        if (value instanceof Boolean b) return b ? 1L : 0L;
        return ((Number) value).longValue();
    }

    private static Class<?> javaKind(Object value) {
        if (isIntegral(value)) return Long.class;
        if (isFloating(value)) return Double.class;
        return value.getClass();
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    private static boolean isFloating(Object value) {
        return value instanceof Double || value instanceof Float;
    }
}

package org.tensorscript.compiler.ir;

import org.tensorscript.compiler.types.AttributeType;

import java.util.ArrayList;
import java.util.List;

/**
 * A named attribute of a graph node.
 */
public sealed interface IrAttribute {

    /**
     * @return The attribute name.
     */
    String name();

    /**
     * @return The attribute type.
     */
    AttributeType type();

    record IntAttr(String name, long value) implements IrAttribute {
        @Override
        public AttributeType type() {
            return AttributeType.INT;
        }
    }

    record FloatAttr(String name, double value) implements IrAttribute {
        @Override
        public AttributeType type() {
            return AttributeType.FLOAT;
        }
    }

    record StringAttr(String name, String value) implements IrAttribute {
        @Override
        public AttributeType type() {
            return AttributeType.STRING;
        }
    }

    record IntsAttr(String name, List<Long> values) implements IrAttribute {
        public IntsAttr {
            values = List.copyOf(values);
        }

        @Override
        public AttributeType type() {
            return AttributeType.INTS;
        }
    }

    record FloatsAttr(String name, List<Double> values) implements IrAttribute {
        public FloatsAttr {
            values = List.copyOf(values);
        }

        @Override
        public AttributeType type() {
            return AttributeType.FLOATS;
        }
    }

    record StringsAttr(String name, List<String> values) implements IrAttribute {
        public StringsAttr {
            values = List.copyOf(values);
        }

        @Override
        public AttributeType type() {
            return AttributeType.STRINGS;
        }
    }

    record TensorAttr(String name, TensorLiteral value) implements IrAttribute {
        @Override
        public AttributeType type() {
            return AttributeType.TENSOR;
        }
    }

    record GraphAttr(String name, IrGraph value) implements IrAttribute {
        @Override
        public AttributeType type() {
            return AttributeType.GRAPH;
        }
    }

    /**
     * A reference to an attribute parameter of the enclosing function.
     *
     * @param name The attribute name on the node.
     * @param refAttrName The name of the referenced attribute parameter.
     * @param type The attribute type.
     */
    record RefAttr(String name, String refAttrName, AttributeType type) implements IrAttribute {}

    /**
     * Creates an attribute from a Java value, inferring its type.
     * @param name The attribute name.
     * @param value The value: a number, boolean, string, list, {@link TensorLiteral} or {@link IrGraph}.
     * @return The attribute.
     * @throws IllegalArgumentException if the value has no attribute representation.
     */
    static IrAttribute of(String name, Object value) {
        return of(name, value, null);
    }

    /**
     * Creates an attribute of the expected type from a Java value.
     * @param name The attribute name.
     * @param value The value.
     * @param expected The expected attribute type, or {@code null} to infer it from the value.
     * @return The attribute.
     * @throws IllegalArgumentException if the value cannot represent an attribute of the expected type.
     */
    static IrAttribute of(String name, Object value, AttributeType expected) {
        AttributeType type = expected != null ? expected : inferType(name, value);
        switch (type) {
            case INT:
                if (value instanceof Boolean b) return new IntAttr(name, b ? 1 : 0);
                if (isIntegral(value)) return new IntAttr(name, ((Number) value).longValue());
                break;
            case FLOAT:
                if (value instanceof Number n && !(value instanceof Boolean)) return new FloatAttr(name, n.doubleValue());
                break;
            case STRING:
                if (value instanceof String s) return new StringAttr(name, s);
                break;
            case INTS:
                if (value instanceof List<?> list && list.stream().allMatch(e -> isIntegral(e) || e instanceof Boolean)) {
                    List<Long> ints = new ArrayList<>();
                    for (Object e : list) ints.add(e instanceof Boolean b ? (b ? 1L : 0L) : ((Number) e).longValue());
                    return new IntsAttr(name, ints);
                }
                break;
            case FLOATS:
                if (value instanceof List<?> list && list.stream().allMatch(e -> e instanceof Number)) {
                    return new FloatsAttr(name, list.stream().map(e -> ((Number) e).doubleValue()).toList());
                }
                break;
            case STRINGS:
                if (value instanceof List<?> list && list.stream().allMatch(e -> e instanceof String)) {
                    return new StringsAttr(name, list.stream().map(String.class::cast).toList());
                }
                break;
            case TENSOR:
                if (value instanceof TensorLiteral t) return new TensorAttr(name, t);
                break;
            case GRAPH:
                if (value instanceof IrGraph g) return new GraphAttr(name, g);
                break;
            default:
                break;
        }
        throw new IllegalArgumentException("Value " + value + " of attribute '" + name + "' is not of type " + type.schemaName() + ".");
    }

    private static AttributeType inferType(String name, Object value) {
        if (value instanceof Boolean || isIntegral(value)) return AttributeType.INT;
        if (value instanceof Number) return AttributeType.FLOAT;
        if (value instanceof String) return AttributeType.STRING;
        if (value instanceof TensorLiteral) return AttributeType.TENSOR;
        if (value instanceof IrGraph) return AttributeType.GRAPH;
        if (value instanceof List<?> list) {
            if (list.isEmpty() || list.stream().allMatch(e -> isIntegral(e) || e instanceof Boolean)) return AttributeType.INTS;
            if (list.stream().allMatch(e -> e instanceof Number)) return AttributeType.FLOATS;
            if (list.stream().allMatch(e -> e instanceof String)) return AttributeType.STRINGS;
        }
        throw new IllegalArgumentException("Value " + value + " of attribute '" + name + "' has no attribute representation.");
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }
}

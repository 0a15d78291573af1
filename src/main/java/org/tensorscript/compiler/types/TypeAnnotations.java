package org.tensorscript.compiler.types;

import org.tensorscript.compiler.frontend.parser.ast.AttributeNode;
import org.tensorscript.compiler.frontend.parser.ast.ConstantNode;
import org.tensorscript.compiler.frontend.parser.ast.ExprNode;
import org.tensorscript.compiler.frontend.parser.ast.NameNode;
import org.tensorscript.compiler.frontend.parser.ast.SubscriptNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interprets the closed set of annotation forms accepted on parameters, annotated assignments
 * and return types.
 * <p>
 * Scalar python types ({@code float}, {@code int}, {@code str}, {@code bool}) and their
 * {@code list[...]}/{@code Sequence[...]} forms declare attribute parameters. Element type names,
 * optionally subscripted with a shape ({@code FLOAT[N, 3]}), declare tensors.
 */
public final class TypeAnnotations {

    private static final Map<String, AttributeType> SCALAR_ATTRIBUTES = Map.of(
            "float", AttributeType.FLOAT,
            "int", AttributeType.INT,
            "str", AttributeType.STRING,
            "bool", AttributeType.INT
    );

    private static final Map<String, AttributeType> LIST_ATTRIBUTES = Map.of(
            "float", AttributeType.FLOATS,
            "int", AttributeType.INTS,
            "str", AttributeType.STRINGS
    );

    private TypeAnnotations() {}

    /**
     * Interprets a parameter annotation.
     * @param annotation The annotation expression, or {@code null} if absent.
     * @return The interpretation, or empty if the annotation is not one of the accepted forms.
     */
    public static Optional<TypeAnnotation> parameter(ExprNode annotation) {
        if (annotation == null) {
            return Optional.of(new TypeAnnotation.Untyped());
        }
        String simple = simpleName(annotation);
        if (simple != null && SCALAR_ATTRIBUTES.containsKey(simple)) {
            return Optional.of(new TypeAnnotation.AttributeAnnotation(SCALAR_ATTRIBUTES.get(simple), "bool".equals(simple)));
        }
        if (annotation instanceof SubscriptNode sub) {
            String container = simpleName(sub.value());
            if ("list".equals(container) || "List".equals(container) || "Sequence".equals(container)) {
                String element = simpleName(sub.index());
                AttributeType type = element == null ? null : LIST_ATTRIBUTES.get(element);
                return type == null ? Optional.empty() : Optional.of(new TypeAnnotation.AttributeAnnotation(type, false));
            }
        }
        return tensor(annotation).map(TypeAnnotation.TensorAnnotation::new);
    }

    /**
     * Interprets a tensor annotation such as {@code INT64} or {@code FLOAT[N, 3]}.
     * @param annotation The annotation expression.
     * @return The tensor type, or empty if the annotation does not denote a tensor.
     */
    public static Optional<TensorType> tensor(ExprNode annotation) {
        String simple = simpleName(annotation);
        if (simple != null) {
            return ElementType.fromAnnotationName(simple).map(TensorType::of);
        }
        if (annotation instanceof SubscriptNode sub) {
            String base = simpleName(sub.value());
            Optional<ElementType> element = base == null ? Optional.empty() : ElementType.fromAnnotationName(base);
            if (element.isEmpty()) {
                return Optional.empty();
            }
            List<Object> shape = new ArrayList<>();
            for (ExprNode dim : sub.indexElements()) {
                if (dim instanceof ConstantNode c && c.value() instanceof Long l) {
                    shape.add(l);
                } else if (dim instanceof ConstantNode c && c.value() == null) {
                    shape.add("?");
                } else if (dim instanceof NameNode n) {
                    shape.add(n.id());
                } else {
                    return Optional.empty();
                }
            }
            return Optional.of(new TensorType(element.get(), shape));
        }
        return Optional.empty();
    }

    /**
     * Interprets a return annotation: one tensor type or {@code tuple[...]} of tensor types.
     * @param annotation The annotation expression.
     * @return The declared return types, or empty if the annotation is not one of the accepted forms.
     */
    public static Optional<List<TensorType>> returnTypes(ExprNode annotation) {
        if (annotation instanceof SubscriptNode sub) {
            String container = simpleName(sub.value());
            if ("tuple".equals(container) || "Tuple".equals(container)) {
                List<TensorType> types = new ArrayList<>();
                for (ExprNode element : sub.indexElements()) {
                    Optional<TensorType> type = tensor(element);
                    if (type.isEmpty()) return Optional.empty();
                    types.add(type.get());
                }
                return Optional.of(types);
            }
        }
        return tensor(annotation).map(List::of);
    }

    // Accepts "FLOAT" as well as qualified forms such as "types.FLOAT".
    private static String simpleName(ExprNode node) {
        if (node instanceof NameNode n) return n.id();
        if (node instanceof AttributeNode a && a.dottedPath() != null) return a.attr();
        return null;
    }
}

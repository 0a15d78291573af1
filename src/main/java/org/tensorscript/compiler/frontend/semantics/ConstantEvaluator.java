package org.tensorscript.compiler.frontend.semantics;

import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.frontend.parser.ast.AttributeNode;
import org.tensorscript.compiler.frontend.parser.ast.BinaryOpNode;
import org.tensorscript.compiler.frontend.parser.ast.BoolOpNode;
import org.tensorscript.compiler.frontend.parser.ast.CompareNode;
import org.tensorscript.compiler.frontend.parser.ast.ConstantNode;
import org.tensorscript.compiler.frontend.parser.ast.ExprNode;
import org.tensorscript.compiler.frontend.parser.ast.ListNode;
import org.tensorscript.compiler.frontend.parser.ast.NameNode;
import org.tensorscript.compiler.frontend.parser.ast.Operator;
import org.tensorscript.compiler.frontend.parser.ast.TupleNode;
import org.tensorscript.compiler.frontend.parser.ast.UnaryOpNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Evaluates the narrow set of literal expressions that are needed at translation time:
 * parameter defaults, attribute values, slice bounds and module constants.
 * <p>
 * Integers evaluate to {@code Long}, floats to {@code Double}, lists and tuples to immutable lists.
 * Names and dotted names are resolved through the supplied resolver; anything else is not constant.
 */
public class ConstantEvaluator {

    private static final Object NOT_CONSTANT = new Object();

    private final Function<String, Optional<Object>> resolver;

    /**
     * @param resolver Resolves a plain or dotted name to a known constant value.
     */
    public ConstantEvaluator(Function<String, Optional<Object>> resolver) {
        this.resolver = resolver;
    }

    /**
     * @param expr An expression.
     * @return {@code true} if the expression can be evaluated at translation time.
     */
    public boolean isConstant(ExprNode expr) {
        return eval(expr) != NOT_CONSTANT;
    }

    /**
     * Evaluates a constant expression.
     * @param expr The expression.
     * @return The value; {@code null} for {@code None}.
     * @throws UnsupportedConstructException if the expression is not a constant expression.
     */
    public Object evaluate(ExprNode expr) {
        Object value = eval(expr);
        if (value == NOT_CONSTANT) {
            throw new UnsupportedConstructException("Expression is not a compile-time constant.", expr.source());
        }
        return value;
    }

    private Object eval(ExprNode expr) {
        if (expr instanceof ConstantNode c) {
            return c.value();
        }
        if (expr instanceof NameNode n) {
            return resolver.apply(n.id()).orElse(NOT_CONSTANT);
        }
        if (expr instanceof AttributeNode a) {
            String path = a.dottedPath();
            return path == null ? NOT_CONSTANT : resolver.apply(path).orElse(NOT_CONSTANT);
        }
        if (expr instanceof ListNode l) {
            return evalAll(l.elements());
        }
        if (expr instanceof TupleNode t) {
            return evalAll(t.elements());
        }
        if (expr instanceof UnaryOpNode u) {
            Object operand = eval(u.operand());
            return operand == NOT_CONSTANT ? NOT_CONSTANT : unary(u.op(), operand);
        }
        if (expr instanceof BinaryOpNode b) {
            Object left = eval(b.left());
            Object right = eval(b.right());
            if (left == NOT_CONSTANT || right == NOT_CONSTANT) return NOT_CONSTANT;
            return binary(b.op(), left, right);
        }
        if (expr instanceof BoolOpNode b) {
            Object result = null;
            for (ExprNode operand : b.values()) {
                result = eval(operand);
                if (result == NOT_CONSTANT) return NOT_CONSTANT;
                boolean truth = truthy(result);
                if (b.op() == Operator.AND ? !truth : truth) return result;
            }
            return result;
        }
        if (expr instanceof CompareNode c) {
            Object left = eval(c.left());
            if (left == NOT_CONSTANT) return NOT_CONSTANT;
            for (int i = 0; i < c.ops().size(); i++) {
                Object right = eval(c.comparators().get(i));
                if (right == NOT_CONSTANT) return NOT_CONSTANT;
                Object holds = compare(c.ops().get(i), left, right);
                if (holds == NOT_CONSTANT) return NOT_CONSTANT;
                if (!((Boolean) holds)) return Boolean.FALSE;
                left = right;
            }
            return Boolean.TRUE;
        }
        return NOT_CONSTANT;
    }

    private Object evalAll(List<ExprNode> elements) {
        List<Object> values = new ArrayList<>();
        for (ExprNode element : elements) {
            Object value = eval(element);
            if (value == NOT_CONSTANT || value == null) return NOT_CONSTANT;
            values.add(value);
        }
        return List.copyOf(values);
    }

    private static Object unary(Operator op, Object operand) {
        switch (op) {
            case NOT:
                return !truthy(operand);
            case USUB:
                if (operand instanceof Boolean b) return b ? -1L : 0L;
                if (operand instanceof Long l) return -l;
                if (operand instanceof Double d) return -d;
                return NOT_CONSTANT;
            case UADD:
                if (operand instanceof Boolean b) return b ? 1L : 0L;
                if (operand instanceof Long || operand instanceof Double) return operand;
                return NOT_CONSTANT;
            default:
                return NOT_CONSTANT;
        }
    }

    private static Object binary(Operator op, Object left, Object right) {
        if (op == Operator.ADD && left instanceof String l && right instanceof String r) {
            return l + r;
        }
        if (op == Operator.ADD && left instanceof List<?> l && right instanceof List<?> r) {
            List<Object> joined = new ArrayList<>(l);
            joined.addAll(r);
            return List.copyOf(joined);
        }
        if ((op == Operator.BIT_AND || op == Operator.BIT_OR) && left instanceof Boolean l && right instanceof Boolean r) {
            return op == Operator.BIT_AND ? l && r : l || r;
        }
        if (!isNumeric(left) || !isNumeric(right)) {
            return NOT_CONSTANT;
        }
        if (isIntegral(left) && isIntegral(right)) {
            long a = asLong(left);
            long b = asLong(right);
            switch (op) {
                case ADD: return a + b;
                case SUB: return a - b;
                case MULT: return a * b;
                case DIV: return b == 0 ? NOT_CONSTANT : (double) a / b;
                case FLOOR_DIV: return b == 0 ? NOT_CONSTANT : Math.floorDiv(a, b);
                case MOD: return b == 0 ? NOT_CONSTANT : Math.floorMod(a, b);
                case POW: return b >= 0 && b < 64 ? power(a, b) : Math.pow(a, b);
                case BIT_AND: return a & b;
                case BIT_OR: return a | b;
                default: return NOT_CONSTANT;
            }
        }
        double a = asDouble(left);
        double b = asDouble(right);
        switch (op) {
            case ADD: return a + b;
            case SUB: return a - b;
            case MULT: return a * b;
            case DIV: return b == 0 ? NOT_CONSTANT : a / b;
            case FLOOR_DIV: return b == 0 ? NOT_CONSTANT : Math.floor(a / b);
            case MOD: return b == 0 ? NOT_CONSTANT : a - b * Math.floor(a / b);
            case POW: return Math.pow(a, b);
            default: return NOT_CONSTANT;
        }
    }

    private static Object compare(Operator op, Object left, Object right) {
        if (op == Operator.EQ) return equalValues(left, right);
        if (op == Operator.NOT_EQ) return !equalValues(left, right);
        int cmp;
        if (isNumeric(left) && isNumeric(right)) {
            cmp = Double.compare(asDouble(left), asDouble(right));
        } else if (left instanceof String l && right instanceof String r) {
            cmp = l.compareTo(r);
        } else {
            return NOT_CONSTANT;
        }
        switch (op) {
            case LT: return cmp < 0;
            case LT_E: return cmp <= 0;
            case GT: return cmp > 0;
            case GT_E: return cmp >= 0;
            default: return NOT_CONSTANT;
        }
    }

    private static boolean equalValues(Object left, Object right) {
        if (isNumeric(left) && isNumeric(right)) {
            return asDouble(left) == asDouble(right);
        }
        return Objects.equals(left, right);
    }

    private static long power(long base, long exponent) {
        long result = 1;
        for (long i = 0; i < exponent; i++) {
            result *= base;
        }
        return result;
    }

    /**
     * Truthiness of a constant value: {@code None}, {@code False}, zero and empty strings or lists are false.
     * @param value The value.
     * @return Its truth value.
     */
    static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Long l) return l != 0;
        if (value instanceof Double d) return d != 0.0;
        if (value instanceof String s) return !s.isEmpty();
        if (value instanceof List<?> l) return !l.isEmpty();
        return true;
    }

    private static boolean isNumeric(Object value) {
        return value instanceof Long || value instanceof Double || value instanceof Boolean;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Boolean;
    }

    private static long asLong(Object value) {
        if (value instanceof Boolean b) return b ? 1 : 0;
        return (Long) value;
    }

    private static double asDouble(Object value) {
        if (value instanceof Boolean b) return b ? 1 : 0;
        return ((Number) value).doubleValue();
    }
}

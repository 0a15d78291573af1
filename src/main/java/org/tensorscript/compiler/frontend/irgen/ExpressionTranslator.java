package org.tensorscript.compiler.frontend.irgen;

import org.tensorscript.compiler.api.ArityException;
import org.tensorscript.compiler.api.CapturedVariableMutationException;
import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.api.TypeMismatchException;
import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.autocast.StaticAutoCast;
import org.tensorscript.compiler.frontend.parser.ast.AttributeNode;
import org.tensorscript.compiler.frontend.parser.ast.BinaryOpNode;
import org.tensorscript.compiler.frontend.parser.ast.BoolOpNode;
import org.tensorscript.compiler.frontend.parser.ast.CallNode;
import org.tensorscript.compiler.frontend.parser.ast.CompareNode;
import org.tensorscript.compiler.frontend.parser.ast.ConstantNode;
import org.tensorscript.compiler.frontend.parser.ast.ExprNode;
import org.tensorscript.compiler.frontend.parser.ast.KeywordArg;
import org.tensorscript.compiler.frontend.parser.ast.NameNode;
import org.tensorscript.compiler.frontend.parser.ast.Operator;
import org.tensorscript.compiler.frontend.parser.ast.SubscriptNode;
import org.tensorscript.compiler.frontend.parser.ast.UnaryOpNode;
import org.tensorscript.compiler.frontend.semantics.Binding;
import org.tensorscript.compiler.ir.IrAttribute;
import org.tensorscript.compiler.ir.TranslatedExpression;
import org.tensorscript.compiler.schema.AttributeSchema;
import org.tensorscript.compiler.schema.OpSchema;
import org.tensorscript.compiler.schema.Opset;
import org.tensorscript.compiler.types.AttributeType;
import org.tensorscript.compiler.types.ElementType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lowers expressions into nodes of the current function.
 * <p>
 * Most expressions end in a single node whose output is named after the caller's preferred target.
 * Such a node is first described as a {@link PendingNode} and only emitted once the output names are known,
 * so that an assignment {@code y = op.Add(a, b)} yields a node writing {@code y} directly.
 */
public final class ExpressionTranslator {

	private static final Map<Operator, String> BINARY_OPS = new EnumMap<>(Operator.class);
	private static final Map<Operator, String> COMPARE_OPS = new EnumMap<>(Operator.class);

	static {
		BINARY_OPS.put(Operator.ADD, "Add");
		BINARY_OPS.put(Operator.SUB, "Sub");
		BINARY_OPS.put(Operator.MULT, "Mul");
		BINARY_OPS.put(Operator.DIV, "Div");
		BINARY_OPS.put(Operator.MOD, "Mod");
		BINARY_OPS.put(Operator.POW, "Pow");
		BINARY_OPS.put(Operator.MAT_MULT, "MatMul");
		BINARY_OPS.put(Operator.BIT_AND, "And");
		BINARY_OPS.put(Operator.BIT_OR, "Or");

		COMPARE_OPS.put(Operator.EQ, "Equal");
		COMPARE_OPS.put(Operator.NOT_EQ, "Equal");
		COMPARE_OPS.put(Operator.LT, "Less");
		COMPARE_OPS.put(Operator.LT_E, "LessOrEqual");
		COMPARE_OPS.put(Operator.GT, "Greater");
		COMPARE_OPS.put(Operator.GT_E, "GreaterOrEqual");
	}

	/**
	 * A node whose operands are translated but whose outputs are not yet named.
	 */
	private record PendingNode(Callee callee, List<String> inputs, List<IrAttribute> attributes, SourceInfo source) {}

	private final TranslationContext ctx;
	private final SubscriptTranslator subscripts;

	ExpressionTranslator(TranslationContext ctx) {
		this.ctx = ctx;
		this.subscripts = new SubscriptTranslator(ctx, this);
	}

	/**
	 * Translates an expression into a single graph value.
	 * @param expr The expression.
	 * @param target The preferred name of the result, or {@code null}.
	 * @return The result value.
	 */
	public TranslatedExpression translate(ExprNode expr, String target) {
		Object lowered = lower(expr, target);
		if (lowered instanceof TranslatedExpression t) return t;
		PendingNode pending = (PendingNode) lowered;
		String result = ctx.uniqueName(target != null ? target : "tmp");
		emit(pending, List.of(result));
		return TranslatedExpression.any(result);
	}

	/**
	 * Translates a call with several outputs.
	 * @param call The call expression.
	 * @param targets The preferred output names.
	 * @return The output names, one per target.
	 */
	public List<String> translateMulti(CallNode call, List<String> targets) {
		PendingNode pending = call(call);
		List<String> outputs = targets.stream().map(ctx::uniqueName).toList();
		emit(pending, outputs);
		return outputs;
	}

	/**
	 * Translates an optional call argument; a missing argument or {@code None} yields {@code null}.
	 */
	TranslatedExpression translateOptional(ExprNode expr) {
		if (expr == null || (expr instanceof ConstantNode c && c.value() == null)) return null;
		return translate(expr, null);
	}

	private void emit(PendingNode pending, List<String> outputs) {
		Callee callee = pending.callee();
		ctx.emit(callee.opset(), callee.opType(), pending.inputs(), outputs, pending.attributes(), Map.of(), pending.source());
	}

	private Object lower(ExprNode expr, String target) {
		if (expr instanceof CallNode call) return call(call);
		if (expr instanceof BinaryOpNode bin) return binary(bin);
		if (expr instanceof BoolOpNode bool) return boolOp(bool);
		if (expr instanceof UnaryOpNode unary) return unary(unary, target);
		if (expr instanceof CompareNode cmp) return compare(cmp);
		if (expr instanceof NameNode name) return valueOf(ctx.lookup(name.id(), name.source()), name.id(), name.source());
		if (expr instanceof SubscriptNode sub) return subscripts.translate(sub, target);
		if (ctx.constants().isConstant(expr)) {
			return ctx.emitConstant(ctx.constants().evaluate(expr), target, expr.source());
		}
		throw new UnsupportedConstructException("Unsupported expression type " + expr.getClass().getSimpleName() + ".", expr.source());
	}

	/**
	 * Turns a binding into a graph value.
	 * @param binding The binding.
	 * @param name The script name, used as preferred name for materialized values.
	 * @param source The use position.
	 * @return The graph value.
	 */
	public TranslatedExpression valueOf(Binding binding, String name, SourceInfo source) {
		if (binding instanceof Binding.GraphValue v) {
			return v.provenance() == Binding.Provenance.CONSTANT
					? TranslatedExpression.constant(v.name())
					: TranslatedExpression.any(v.name());
		}
		if (binding instanceof Binding.AttributeRef ref) return promoteAttribute(ref, name, source);
		if (binding instanceof Binding.ConstantBinding c) return ctx.emitConstant(c.value(), name, source);
		throw new UnsupportedConstructException("'" + name + "' cannot be used as a value.", source);
	}

	private TranslatedExpression promoteAttribute(Binding.AttributeRef ref, String name, SourceInfo source) {
		String constantAttribute = ref.type().constantAttribute();
		if (constantAttribute == null || ref.type() == AttributeType.TENSOR) {
			throw new UnsupportedConstructException("Attribute parameter '" + ref.attrName() + "' of type "
					+ ref.type().schemaName() + " cannot be used as a value.", source);
		}
		String result = ctx.uniqueName(name);
		IrAttribute value = ctx.builder().makeAttributeRef(constantAttribute, ref.attrName(), ref.type());
		ctx.emit("Constant", List.of(), List.of(result), List.of(value), source);
		if (!ref.bool()) return TranslatedExpression.constant(result);
		String asBool = ctx.uniqueName(result + "_as_bool");
		ctx.emit("Cast", List.of(result), List.of(asBool),
				List.of(ctx.builder().makeAttribute("to", (long) ElementType.BOOL.code(), AttributeType.INT)), source);
		return TranslatedExpression.constant(asBool);
	}

	// --- Operators ---

	private PendingNode binary(BinaryOpNode node) {
		String opType = BINARY_OPS.get(node.op());
		if (opType == null) {
			throw new UnsupportedConstructException("Unsupported operator '" + node.op().symbol() + "'.", node.source());
		}
		List<IrAttribute> attributes = new ArrayList<>();
		if (node.op() == Operator.MOD && ctx.constants().isConstant(node.right())
				&& ctx.constants().evaluate(node.right()) instanceof Double) {
			attributes.add(ctx.builder().makeAttribute("fmod", 1L, AttributeType.INT));
		}
		Callee callee = operator(opType);
		TranslatedExpression left = translate(node.left(), null);
		TranslatedExpression right = translate(node.right(), null);
		return new PendingNode(callee, castOperands(callee, List.of(left, right), node.source()), attributes, node.source());
	}

	private PendingNode boolOp(BoolOpNode node) {
		Callee callee = operator(node.op() == Operator.AND ? "And" : "Or");
		TranslatedExpression left = translate(node.values().get(0), null);
		for (int i = 1; i < node.values().size(); i++) {
			TranslatedExpression right = translate(node.values().get(i), null);
			List<String> inputs = castOperands(callee, List.of(left, right), node.source());
			if (i == node.values().size() - 1) {
				return new PendingNode(callee, inputs, List.of(), node.source());
			}
			String tmp = ctx.uniqueName("tmp");
			emit(new PendingNode(callee, inputs, List.of(), node.source()), List.of(tmp));
			left = TranslatedExpression.any(tmp);
		}
		throw new IllegalStateException("Boolean operation with fewer than two operands.");
	}

	private Object unary(UnaryOpNode node, String target) {
		if ((node.op() == Operator.USUB || node.op() == Operator.UADD) && ctx.constants().isConstant(node.operand())) {
			return ctx.emitConstant(ctx.constants().evaluate(node), target, node.source());
		}
		String opType = switch (node.op()) {
			case USUB -> "Neg";
			case NOT -> "Not";
			default -> throw new UnsupportedConstructException(
					"Unsupported unary operator '" + node.op().symbol() + "' on a non-constant operand.", node.source());
		};
		Callee callee = operator(opType);
		TranslatedExpression operand = translate(node.operand(), null);
		return new PendingNode(callee, castOperands(callee, List.of(operand), node.source()), List.of(), node.source());
	}

	private PendingNode compare(CompareNode node) {
		if (node.ops().size() != 1) {
			throw new UnsupportedConstructException("Chained comparisons are not supported.", node.source());
		}
		Operator op = node.ops().get(0);
		Callee callee = operator(COMPARE_OPS.get(op));
		TranslatedExpression left = translate(node.left(), null);
		TranslatedExpression right = translate(node.comparators().get(0), null);
		List<String> inputs = castOperands(callee, List.of(left, right), node.source());
		if (op != Operator.NOT_EQ) {
			return new PendingNode(callee, inputs, List.of(), node.source());
		}
		String equal = ctx.uniqueName("tmp");
		emit(new PendingNode(callee, inputs, List.of(), node.source()), List.of(equal));
		return new PendingNode(operator("Not"), List.of(equal), List.of(), node.source());
	}

	private Callee operator(String opType) {
		Opset opset = ctx.defaultOpset();
		return Callee.operator(opset, opType, ctx.schema(opset, opType).orElse(null));
	}

	private List<String> castOperands(Callee callee, List<TranslatedExpression> args, SourceInfo source) {
		return StaticAutoCast.castInputs(callee.schema(), args, (value, witness) -> castLike(value, witness, source), source);
	}

	private String castLike(String value, String witness, SourceInfo source) {
		String result = ctx.uniqueName(value + "_cast");
		ctx.emit("CastLike", List.of(value, witness), List.of(result), List.of(), source);
		return result;
	}

	// --- Calls ---

	private PendingNode call(CallNode node) {
		Callee callee = callee(node.func());
		OpSchema schema = callee.schema();
		List<ExprNode> inputExprs;
		Map<String, ExprNode> attributeExprs;
		if (schema != null) {
			ArgumentSeparator.Separated separated = ArgumentSeparator.separate(schema, node.args(), node.keywords(), node.source());
			inputExprs = separated.inputs();
			attributeExprs = separated.attributes();
		} else {
			inputExprs = node.args();
			attributeExprs = new LinkedHashMap<>();
			for (KeywordArg kw : node.keywords()) attributeExprs.put(kw.name(), kw.value());
		}

		List<TranslatedExpression> args = new ArrayList<>();
		for (ExprNode input : inputExprs) args.add(translateOptional(input));
		List<IrAttribute> attributes = new ArrayList<>();
		for (Map.Entry<String, ExprNode> e : attributeExprs.entrySet()) {
			IrAttribute attribute = translateAttribute(e.getKey(), e.getValue(), schema, callee.opType());
			if (attribute != null) attributes.add(attribute);
		}
		return new PendingNode(callee, castOperands(callee, args, node.source()), attributes, node.source());
	}

	private Callee callee(ExprNode func) {
		if (func instanceof AttributeNode attr) {
			Opset opset = opsetOf(attr.value());
			ctx.useOpset(opset, attr.source());
			Optional<OpSchema> schema = ctx.schema(opset, attr.attr());
			if (schema.isEmpty()) {
				ctx.warn("'" + attr.attr() + "' is not a known operator of opset " + opset + ".", attr.source());
			}
			return Callee.operator(opset, attr.attr(), schema.orElse(null));
		}
		if (func instanceof NameNode name) {
			Optional<Binding> binding = ctx.lookup(name.id());
			if (binding.isEmpty()) {
				Opset opset = ctx.defaultOpset();
				Optional<OpSchema> schema = ctx.schema(opset, name.id());
				if (schema.isEmpty()) {
					ctx.warn("Unknown function name '" + name.id() + "'. The graph may not work.", name.source());
				}
				return Callee.operator(opset, name.id(), schema.orElse(null));
			}
			Binding b = binding.get();
			if (b instanceof Binding.ScriptFunctionRef ref) {
				ctx.current().addCalledFunction(ref.function());
				return new Callee(ref.moduleOpset(), ref.function().name(), ref.function().toSchema(), ref.function());
			}
			if (b instanceof Binding.NestedFunction nested) {
				checkCaptured(name.id(), nested, name.source());
				ctx.current().addCalledFunction(nested.function());
				return new Callee(ctx.moduleOpset(), nested.function().name(), nested.function().toSchema(), nested.function());
			}
			if (b instanceof Binding.OperatorRef op) {
				return Callee.operator(op.opset(), op.opType(), ctx.schema(op.opset(), op.opType()).orElse(null));
			}
		}
		throw new UnsupportedConstructException("Invalid callee.", func.source());
	}

	private Opset opsetOf(ExprNode expr) {
		if (expr instanceof NameNode name) {
			Optional<Binding> binding = ctx.lookup(name.id());
			if (binding.isPresent() && binding.get() instanceof Binding.OpsetBinding opset) return opset.opset();
			throw new UnsupportedConstructException("'" + name.id() + "' is not an opset.", name.source());
		}
		if (expr instanceof AttributeNode) {
			throw new UnsupportedConstructException("Nested module unimplemented.", expr.source());
		}
		throw new UnsupportedConstructException("Invalid opset expression.", expr.source());
	}

	/**
	 * Fails if a variable captured by a nested function has been rebound since the function was defined.
	 */
	private void checkCaptured(String functionName, Binding.NestedFunction nested, SourceInfo source) {
		for (Map.Entry<String, Binding> e : nested.captured().entrySet()) {
			Optional<Binding> now = ctx.lookup(e.getKey());
			if (now.isEmpty() || !Objects.equals(now.get(), e.getValue())) {
				throw new CapturedVariableMutationException("Outer scope variable '" + e.getKey()
						+ "' referenced by function '" + functionName + "' was modified.", source);
			}
		}
	}

	/**
	 * Translates one attribute argument.
	 * @return The attribute, or {@code null} if the argument is {@code None} and the attribute is omitted.
	 */
	private IrAttribute translateAttribute(String name, ExprNode expr, OpSchema schema, String opType) {
		AttributeSchema declared = schema == null ? null : schema.attribute(name).orElse(null);
		AttributeType expected = declared == null ? null : declared.type();

		if (expr instanceof NameNode n) {
			Optional<Binding> binding = ctx.lookup(n.id());
			if (binding.isPresent() && binding.get() instanceof Binding.AttributeRef ref) {
				if (expected != null && expected != ref.type()) {
					throw new TypeMismatchException("Attribute '" + name + "' of '" + opType + "' expects type "
							+ expected.schemaName() + " but parameter '" + ref.attrName() + "' has type "
							+ ref.type().schemaName() + ".", n.source());
				}
				return ctx.builder().makeAttributeRef(name, ref.attrName(), ref.type());
			}
			if (binding.isPresent() && binding.get() instanceof Binding.NestedFunction nested) {
				if (expected != null && expected != AttributeType.GRAPH) {
					throw new TypeMismatchException("Attribute '" + name + "' of '" + opType + "' expects type "
							+ expected.schemaName() + " but function '" + n.id() + "' is a graph.", n.source());
				}
				checkCaptured(n.id(), nested, n.source());
				nested.function().functionTable().values().forEach(ctx.current()::addCalledFunction);
				return ctx.builder().makeAttribute(name, nested.function().toGraph(), AttributeType.GRAPH);
			}
		}

		if (!ctx.constants().isConstant(expr)) {
			throw new UnsupportedConstructException("Value of attribute '" + name + "' must be a compile-time constant, "
					+ "an attribute parameter or a nested function.", expr.source());
		}
		Object value = ctx.constants().evaluate(expr);
		if (value == null) {
			if (declared != null && declared.required()) {
				throw new ArityException("Required attribute '" + name + "' of '" + opType + "' cannot be None.", expr.source());
			}
			return null;
		}
		try {
			return ctx.builder().makeAttribute(name, value, expected);
		} catch (IllegalArgumentException e) {
			throw new TypeMismatchException(e.getMessage(), expr.source(), e);
		}
	}
}

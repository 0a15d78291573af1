package org.tensorscript.compiler.frontend.irgen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.api.UnboundNameException;
import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.autocast.LiteralPromotion;
import org.tensorscript.compiler.diagnostics.DiagnosticsEngine;
import org.tensorscript.compiler.frontend.parser.ast.ExprNode;
import org.tensorscript.compiler.frontend.parser.ast.StmtNode;
import org.tensorscript.compiler.frontend.semantics.Binding;
import org.tensorscript.compiler.frontend.semantics.ConstantEvaluator;
import org.tensorscript.compiler.frontend.semantics.LivenessOracle;
import org.tensorscript.compiler.frontend.semantics.ScopeStack;
import org.tensorscript.compiler.ir.IrAttribute;
import org.tensorscript.compiler.ir.IrBuilder;
import org.tensorscript.compiler.ir.IrFunction;
import org.tensorscript.compiler.ir.TranslatedExpression;
import org.tensorscript.compiler.schema.OpSchema;
import org.tensorscript.compiler.schema.Opset;
import org.tensorscript.compiler.schema.SchemaRegistry;
import org.tensorscript.compiler.types.TensorType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state of the translation of one top-level function, passed to the statement converters.
 * Provides scope access, name generation and node emission into the innermost function or subgraph.
 */
public final class TranslationContext {

	private static final Logger LOG = LoggerFactory.getLogger(TranslationContext.class);

	private final String functionName;
	private final DiagnosticsEngine diagnostics;
	private final SchemaRegistry schemas;
	private final IrBuilder builder;
	private final StatementConverterRegistry registry;
	private final LivenessOracle liveness;
	private final FunctionTranslator functionTranslator;
	private final ScopeStack scopes;
	private final NameGenerator names = new NameGenerator();
	private final Deque<IrFunction> functions = new ArrayDeque<>();
	private final ConstantEvaluator constants;
	private final ExpressionTranslator expressions;
	private final Opset moduleOpset;
	private Opset defaultOpset;
	private List<TensorType> returnTypes;

	/**
	 * Constructs a new translation context.
	 * @param function The top-level function being translated; becomes the current function.
	 * @param scopes The scope stack of the function, backed by the module environment.
	 * @param diagnostics Receives warnings.
	 * @param schemas The operator schemas.
	 * @param builder The module builder.
	 * @param registry Resolves statement converters.
	 * @param liveness Live-variable facts for the function.
	 * @param defaultOpset The opset used for unqualified operator calls.
	 * @param moduleOpset The opset script functions are emitted in.
	 * @param functionTranslator Translates nested function definitions.
	 */
	public TranslationContext(IrFunction function, ScopeStack scopes, DiagnosticsEngine diagnostics,
							  SchemaRegistry schemas, IrBuilder builder, StatementConverterRegistry registry,
							  LivenessOracle liveness, Opset defaultOpset, Opset moduleOpset,
							  FunctionTranslator functionTranslator) {
		this.functionName = function.name();
		this.scopes = scopes;
		this.diagnostics = diagnostics;
		this.schemas = schemas;
		this.builder = builder;
		this.registry = registry;
		this.liveness = liveness;
		this.defaultOpset = defaultOpset;
		this.moduleOpset = moduleOpset;
		this.functionTranslator = functionTranslator;
		this.functions.push(function);
		this.constants = new ConstantEvaluator(this::constantValue);
		this.expressions = new ExpressionTranslator(this);
	}

	private Optional<Object> constantValue(String name) {
		return scopes.resolve(name)
				.filter(Binding.ConstantBinding.class::isInstance)
				.map(b -> ((Binding.ConstantBinding) b).value());
	}

	/**
	 * Converts a statement by resolving and invoking the appropriate converter.
	 * @param node The statement to convert.
	 */
	public void convert(StmtNode node) {
		registry.resolve(node).convert(node, this);
	}

	/**
	 * Translates an expression into a graph value.
	 * @param expr The expression.
	 * @param target The preferred result name, or {@code null}.
	 * @return The translated value.
	 */
	public TranslatedExpression translateExpression(ExprNode expr, String target) {
		return expressions.translate(expr, target);
	}

	/**
	 * Turns a binding into a graph value, materializing attribute references and constants as nodes.
	 * @param binding The binding.
	 * @param name The script name the binding is known under.
	 * @param source The use position.
	 * @return The graph value.
	 */
	public TranslatedExpression valueOf(Binding binding, String name, SourceInfo source) {
		return expressions.valueOf(binding, name, source);
	}

	// --- Functions and subgraphs ---

	/**
	 * @return The innermost function or subgraph being built.
	 */
	public IrFunction current() {
		return functions.peek();
	}

	/**
	 * Opens a subgraph or nested function: a new scope frame and a new unregistered function.
	 * @param name The name of the subgraph.
	 * @return The new current function.
	 */
	public IrFunction enterSubgraph(String name) {
		scopes.enterScope(name);
		IrFunction function = builder.newFunction(name, moduleOpset.domain(), false);
		functions.push(function);
		LOG.debug("{}: entering subgraph '{}'", functionName, name);
		return function;
	}

	/**
	 * Closes the innermost subgraph opened by {@link #enterSubgraph(String)}.
	 * @return The finished subgraph.
	 */
	public IrFunction exitSubgraph() {
		if (functions.size() == 1) {
			throw new IllegalStateException("Cannot exit the top-level function '" + functionName + "'.");
		}
		scopes.leaveScope();
		IrFunction function = functions.pop();
		builder.inheritOpsetImports(functions.peek(), function);
		LOG.debug("{}: leaving subgraph '{}'", functionName, function.name());
		return function;
	}

	// --- Names and bindings ---

	public String uniqueName(String candidate) {
		return names.generate(candidate);
	}

	public void reserveName(String name) {
		names.reserve(name);
	}

	public void bind(String name, Binding binding) {
		scopes.define(name, binding);
	}

	public Optional<Binding> lookup(String name) {
		return scopes.resolve(name);
	}

	/**
	 * Resolves a name or fails.
	 * @param name The script name.
	 * @param source The use position.
	 * @return The binding.
	 * @throws UnboundNameException if the name is not bound in any scope.
	 */
	public Binding lookup(String name, SourceInfo source) {
		return scopes.resolve(name).orElseThrow(() -> new UnboundNameException(name, "Unbound name: '" + name + "'.", source));
	}

	public ScopeStack scopes() {
		return scopes;
	}

	// --- Emission ---

	/**
	 * Appends a node in the given opset to the current function.
	 */
	public void emit(Opset opset, String opType, List<String> inputs, List<String> outputs, List<IrAttribute> attributes,
					 Map<String, IrFunction> subFunctions, SourceInfo source) {
		builder.addNode(current(), opset, opType, inputs, outputs, attributes, subFunctions, source);
	}

	/**
	 * Appends a node of the default opset to the current function.
	 */
	public void emit(String opType, List<String> inputs, List<String> outputs, List<IrAttribute> attributes, SourceInfo source) {
		emit(defaultOpset, opType, inputs, outputs, attributes, Map.of(), source);
	}

	/**
	 * Emits an {@code Identity} copy of a value.
	 * @param original The value to copy.
	 * @param preferred The preferred name of the copy.
	 * @return The name of the copy.
	 */
	public String emitCopy(String original, String preferred, SourceInfo source) {
		String copy = uniqueName(preferred);
		emit("Identity", List.of(original), List.of(copy), List.of(), source);
		return copy;
	}

	/**
	 * Emits a {@code Constant} node holding a promoted literal.
	 * @param value The literal value.
	 * @param preferred The preferred name, or {@code null} to derive one from the value.
	 * @param source The literal position.
	 * @return The constant value.
	 */
	public TranslatedExpression emitConstant(Object value, String preferred, SourceInfo source) {
		String name = uniqueName(preferred != null ? preferred : constantName(value));
		IrAttribute tensor = builder.makeAttribute("value", LiteralPromotion.promote(value, source), null);
		emit("Constant", List.of(), List.of(name), List.of(tensor), source);
		return TranslatedExpression.constant(name);
	}

	static String constantName(Object value) {
		if (value instanceof Long l) return int64Name(l);
		if (value instanceof List<?> list && list.size() == 1 && list.get(0) instanceof Long l) {
			return int64Name(l) + "_1d";
		}
		return "const";
	}

	private static String int64Name(long value) {
		String digits = Long.toString(value);
		return value >= 0 ? "int64_" + digits : "int64_m" + digits.substring(1);
	}

	/**
	 * Records the use of an opset of the default domain. The first one becomes the default opset
	 * of the function; using a second, different one fails.
	 */
	public void useOpset(Opset opset, SourceInfo source) {
		if (!opset.isDefaultDomain()) return;
		if (defaultOpset == null) {
			defaultOpset = opset;
		} else if (!defaultOpset.equals(opset)) {
			throw new UnsupportedConstructException(
					"Two distinct opsets were used (" + defaultOpset + " != " + opset + ").", source);
		}
	}

	/**
	 * Records a warning with its position. The compiler logs collected warnings once translation is done.
	 */
	public void warn(String message, SourceInfo source) {
		diagnostics.reportWarning(message, source);
	}

	// --- Accessors ---

	public Optional<OpSchema> schema(Opset opset, String opType) {
		return schemas.lookup(opset, opType);
	}

	public SchemaRegistry schemas() {
		return schemas;
	}

	public IrBuilder builder() {
		return builder;
	}

	public DiagnosticsEngine diagnostics() {
		return diagnostics;
	}

	public LivenessOracle liveness() {
		return liveness;
	}

	public ConstantEvaluator constants() {
		return constants;
	}

	public ExpressionTranslator expressions() {
		return expressions;
	}

	public FunctionTranslator functionTranslator() {
		return functionTranslator;
	}

	public String functionName() {
		return functionName;
	}

	public Opset defaultOpset() {
		return defaultOpset;
	}

	public Opset moduleOpset() {
		return moduleOpset;
	}

	/**
	 * @return The declared return types of the function being translated, or {@code null} if unchecked.
	 */
	public List<TensorType> returnTypes() {
		return returnTypes;
	}

	public void setReturnTypes(List<TensorType> returnTypes) {
		this.returnTypes = returnTypes;
	}
}

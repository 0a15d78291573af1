package org.tensorscript.compiler.frontend.irgen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tensorscript.compiler.api.ArityException;
import org.tensorscript.compiler.api.TypeMismatchException;
import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.diagnostics.DiagnosticsEngine;
import org.tensorscript.compiler.frontend.AstWalker;
import org.tensorscript.compiler.frontend.parser.ast.AttributeNode;
import org.tensorscript.compiler.frontend.parser.ast.CallNode;
import org.tensorscript.compiler.frontend.parser.ast.ConstantNode;
import org.tensorscript.compiler.frontend.parser.ast.ExprNode;
import org.tensorscript.compiler.frontend.parser.ast.ExprStmtNode;
import org.tensorscript.compiler.frontend.parser.ast.FunctionDefNode;
import org.tensorscript.compiler.frontend.parser.ast.NameNode;
import org.tensorscript.compiler.frontend.parser.ast.ParameterNode;
import org.tensorscript.compiler.frontend.parser.ast.ReturnNode;
import org.tensorscript.compiler.frontend.parser.ast.StmtNode;
import org.tensorscript.compiler.frontend.parser.ast.TupleNode;
import org.tensorscript.compiler.frontend.semantics.Binding;
import org.tensorscript.compiler.frontend.semantics.GlobalEnvironment;
import org.tensorscript.compiler.frontend.semantics.LivenessAnalyzer;
import org.tensorscript.compiler.frontend.semantics.LivenessOracle;
import org.tensorscript.compiler.frontend.semantics.ScopeStack;
import org.tensorscript.compiler.ir.IrBuilder;
import org.tensorscript.compiler.ir.IrFunction;
import org.tensorscript.compiler.schema.Opset;
import org.tensorscript.compiler.schema.SchemaRegistry;
import org.tensorscript.compiler.types.TensorType;
import org.tensorscript.compiler.types.TypeAnnotation;
import org.tensorscript.compiler.types.TypeAnnotations;

import java.util.List;
import java.util.Optional;

/**
 * Translates one script function definition into a function of the module.
 * <p>
 * Each top-level function gets its own {@link TranslationContext}: fresh scopes and a fresh name generator.
 * Nested definitions are translated in the context of their enclosing function.
 */
public class FunctionTranslator {

	private static final Logger LOG = LoggerFactory.getLogger(FunctionTranslator.class);

	private final GlobalEnvironment globals;
	private final SchemaRegistry schemas;
	private final IrBuilder builder;
	private final DiagnosticsEngine diagnostics;
	private final StatementConverterRegistry registry;
	private final Opset configuredDefaultOpset;
	private final Opset moduleOpset;

	/**
	 * @param globals The module-level bindings: opsets, operators, constants and earlier functions.
	 * @param schemas The operator schemas.
	 * @param builder The module builder the functions are registered in.
	 * @param diagnostics Receives warnings.
	 * @param registry Resolves statement converters.
	 * @param defaultOpset The opset of unqualified calls when a function uses no opset explicitly.
	 * @param moduleOpset The opset the script functions are emitted in.
	 */
	public FunctionTranslator(GlobalEnvironment globals, SchemaRegistry schemas, IrBuilder builder,
							  DiagnosticsEngine diagnostics, StatementConverterRegistry registry,
							  Opset defaultOpset, Opset moduleOpset) {
		this.globals = globals;
		this.schemas = schemas;
		this.builder = builder;
		this.diagnostics = diagnostics;
		this.registry = registry;
		this.configuredDefaultOpset = defaultOpset;
		this.moduleOpset = moduleOpset;
	}

	/**
	 * Translates a top-level function, computing liveness facts for it first.
	 * @param def The definition.
	 * @return The registered function.
	 */
	public IrFunction translate(FunctionDefNode def) {
		return translate(def, new LivenessAnalyzer().analyze(def));
	}

	/**
	 * Translates a top-level function with the given liveness facts.
	 * @param def The definition.
	 * @param liveness Live-variable facts for the definition.
	 * @return The registered function.
	 */
	public IrFunction translate(FunctionDefNode def, LivenessOracle liveness) {
		IrFunction function;
		try {
			function = builder.newFunction(def.name(), moduleOpset.domain(), true);
		} catch (IllegalArgumentException e) {
			throw new UnsupportedConstructException(e.getMessage(), def.source(), e);
		}
		Opset defaultOpset = findDefaultOpset(def);
		LOG.debug("Translating function '{}' with default opset {}", def.name(), defaultOpset);
		TranslationContext ctx = new TranslationContext(function, new ScopeStack(globals, def.name()), diagnostics,
				schemas, builder, registry, liveness, defaultOpset, moduleOpset, this);
		translateSignature(def, ctx);
		translateBody(def, ctx);
		return function;
	}

	/**
	 * Translates a definition nested in the function of the given context.
	 * @param def The nested definition.
	 * @param ctx The context of the enclosing function.
	 * @return The nested function, not registered in the module.
	 */
	public IrFunction translateNested(FunctionDefNode def, TranslationContext ctx) {
		List<TensorType> outerReturnTypes = ctx.returnTypes();
		IrFunction function = ctx.enterSubgraph(def.name());
		translateSignature(def, ctx);
		translateBody(def, ctx);
		ctx.exitSubgraph();
		ctx.setReturnTypes(outerReturnTypes);
		return function;
	}

	/**
	 * The opset of the first call {@code alias.Op(...)} whose alias names an opset of the default domain,
	 * or the configured default.
	 */
	Opset findDefaultOpset(FunctionDefNode def) {
		return AstWalker.findFirst(def, CallNode.class, this::defaultDomainOpsetOf).orElse(configuredDefaultOpset);
	}

	private Optional<Opset> defaultDomainOpsetOf(CallNode call) {
		if (call.func() instanceof AttributeNode attr && attr.value() instanceof NameNode alias) {
			return globals.resolve(alias.id())
					.filter(Binding.OpsetBinding.class::isInstance)
					.map(b -> ((Binding.OpsetBinding) b).opset())
					.filter(Opset::isDefaultDomain);
		}
		return Optional.empty();
	}

	private void translateSignature(FunctionDefNode def, TranslationContext ctx) {
		IrFunction function = ctx.current();
		for (ParameterNode parameter : def.parameters()) {
			TypeAnnotation annotation = TypeAnnotations.parameter(parameter.annotation()).orElse(null);
			if (annotation == null) {
				ctx.warn("Unsupported type annotation for argument " + parameter.name() + ".", parameter.annotation().source());
				annotation = new TypeAnnotation.Untyped();
			}
			if (annotation instanceof TypeAnnotation.AttributeAnnotation attr) {
				Object defaultValue = parameter.defaultValue() == null ? null : ctx.constants().evaluate(parameter.defaultValue());
				try {
					builder.addAttrParameter(function, parameter.name(), attr.type(), defaultValue);
				} catch (IllegalArgumentException e) {
					throw new TypeMismatchException(e.getMessage(), parameter.source(), e);
				}
				ctx.bind(parameter.name(), new Binding.AttributeRef(parameter.name(), attr.type(), attr.bool()));
				continue;
			}
			if (parameter.defaultValue() != null) {
				ctx.warn("Default value of input " + parameter.name() + " is ignored.", parameter.defaultValue().source());
			}
			TensorType type = annotation instanceof TypeAnnotation.TensorAnnotation t ? t.type() : null;
			String name = ctx.uniqueName(parameter.name());
			builder.addInput(function, name, type);
			ctx.bind(parameter.name(), new Binding.GraphValue(name, Binding.Provenance.INPUT, type));
		}

		List<TensorType> returnTypes = null;
		if (def.returns() != null) {
			returnTypes = TypeAnnotations.returnTypes(def.returns()).orElse(null);
			if (returnTypes == null) {
				ctx.warn("Unsupported type annotation for the return value of " + def.name() + ".", def.returns().source());
			}
		}
		ctx.setReturnTypes(returnTypes);
	}

	private void translateBody(FunctionDefNode def, TranslationContext ctx) {
		List<StmtNode> body = def.body();
		boolean returned = false;
		for (int i = 0; i < body.size(); i++) {
			StmtNode statement = body.get(i);
			if (returned) {
				throw new UnsupportedConstructException("Statements after a return statement are not supported.", statement.source());
			}
			if (i == 0 && statement instanceof ExprStmtNode e && e.isDocString()) {
				builder.addDocString(ctx.current(), (String) ((ConstantNode) e.value()).value());
			} else if (statement instanceof ReturnNode ret) {
				translateReturn(ret, ctx);
				returned = true;
			} else {
				ctx.convert(statement);
			}
		}
	}

	private void translateReturn(ReturnNode node, TranslationContext ctx) {
		if (node.value() == null) {
			throw new UnsupportedConstructException("Return statement without return-value not supported.", node.source());
		}
		boolean tuple = node.value() instanceof TupleNode;
		List<ExprNode> values = tuple ? ((TupleNode) node.value()).elements() : List.of(node.value());
		List<TensorType> returnTypes = ctx.returnTypes();
		if (returnTypes != null && returnTypes.size() != values.size()) {
			throw new ArityException("Mismatch in number of return values and types: " + returnTypes.size()
					+ " declared, " + values.size() + " returned.", node.source());
		}
		IrFunction function = ctx.current();
		for (int i = 0; i < values.size(); i++) {
			String preferred = tuple ? "return_val" + i : "return_val";
			String output = ctx.translateExpression(values.get(i), preferred).name();
			if (function.isInput(output)) {
				output = ctx.emitCopy(output, preferred, node.source());
			}
			if (function.hasOutput(output)) {
				output = ctx.emitCopy(output, output + "_copy", node.source());
			}
			builder.addOutput(function, output, returnTypes == null ? null : returnTypes.get(i));
		}
	}
}

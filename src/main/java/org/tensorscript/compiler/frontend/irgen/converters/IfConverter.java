package org.tensorscript.compiler.frontend.irgen.converters;

import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.api.UnboundNameException;
import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.frontend.irgen.IStatementConverter;
import org.tensorscript.compiler.frontend.irgen.TranslationContext;
import org.tensorscript.compiler.frontend.parser.ast.IfNode;
import org.tensorscript.compiler.frontend.parser.ast.StmtNode;
import org.tensorscript.compiler.frontend.semantics.Binding;
import org.tensorscript.compiler.ir.GraphAndFunctions;
import org.tensorscript.compiler.ir.IrAttribute;
import org.tensorscript.compiler.ir.IrFunction;
import org.tensorscript.compiler.types.AttributeType;
import org.tensorscript.compiler.types.TensorType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts {@link IfNode} into an {@code If} node with a then- and an else-subgraph.
 * <p>
 * The outputs of the node are the variables assigned in the statement that are live after it.
 * Both branches produce all of them; a branch that does not assign one forwards the enclosing value.
 */
public final class IfConverter implements IStatementConverter<IfNode> {

	@Override
	public void convert(IfNode node, TranslationContext ctx) {
		Set<String> liveOut = ctx.liveness().liveOut(node);
		List<String> liveDefs = ctx.liveness().assignedNames(node).stream().filter(liveOut::contains).toList();
		String test = ctx.translateExpression(node.test(), "cond").name();

		int line = node.source().lineNumber();
		GraphAndFunctions thenGraph = translateBranch(node.body(), "thenGraph_" + line, liveDefs, node, ctx);
		GraphAndFunctions elseGraph = translateBranch(node.orelse(), "elseGraph_" + line, liveDefs, node, ctx);

		List<String> outputs = new ArrayList<>();
		for (String name : liveDefs) {
			String renamed = ctx.uniqueName(name);
			ctx.bind(name, new Binding.GraphValue(renamed, Binding.Provenance.INTERMEDIATE, null));
			outputs.add(renamed);
		}
		if (outputs.isEmpty()) {
			throw new UnsupportedConstructException("A conditional must assign at least one variable used after it.", node.source());
		}
		if (outputs.equals(List.of(test))) {
			throw new UnsupportedConstructException("Input and output cannot be the same " + outputs + ".", node.source());
		}

		Map<String, IrFunction> subFunctions = new LinkedHashMap<>(thenGraph.functions());
		elseGraph.functions().forEach(subFunctions::putIfAbsent);
		List<IrAttribute> attributes = List.of(
				ctx.builder().makeAttribute("then_branch", thenGraph.graph(), AttributeType.GRAPH),
				ctx.builder().makeAttribute("else_branch", elseGraph.graph(), AttributeType.GRAPH));
		ctx.emit(ctx.defaultOpset(), "If", List.of(test), outputs, attributes, subFunctions, node.source());
	}

	private GraphAndFunctions translateBranch(List<StmtNode> body, String name, List<String> liveDefs, IfNode parent,
											  TranslationContext ctx) {
		SourceInfo source = body.isEmpty() ? parent.source() : body.get(0).source();
		IrFunction branch = ctx.enterSubgraph(name);
		body.forEach(ctx::convert);
		for (String var : liveDefs) {
			Optional<Binding> local = ctx.scopes().resolveLocal(var);
			if (local.isPresent()) {
				String output = ctx.valueOf(local.get(), var, source).name();
				if (!branch.isAssigned(output) || branch.hasOutput(output)) {
					output = ctx.emitCopy(output, var, source);
				}
				ctx.builder().addOutput(branch, output, typeOf(local.get()));
			} else {
				Binding outer = ctx.scopes().resolveOuter(var).orElseThrow(() -> new UnboundNameException(var,
						"Variable " + var + " is not assigned a value along a conditional branch.", source));
				String copy = ctx.emitCopy(ctx.valueOf(outer, var, source).name(), var, source);
				ctx.builder().addOutput(branch, copy, typeOf(outer));
			}
		}
		return ctx.exitSubgraph().toGraphAndFunctions();
	}

	private static TensorType typeOf(Binding binding) {
		return binding instanceof Binding.GraphValue v ? v.type() : null;
	}
}

package org.tensorscript.compiler.frontend.irgen.converters;

import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.api.UnboundNameException;
import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.frontend.irgen.IStatementConverter;
import org.tensorscript.compiler.frontend.irgen.TranslationContext;
import org.tensorscript.compiler.frontend.parser.ast.BreakNode;
import org.tensorscript.compiler.frontend.parser.ast.IfNode;
import org.tensorscript.compiler.frontend.parser.ast.NameNode;
import org.tensorscript.compiler.frontend.parser.ast.StmtNode;
import org.tensorscript.compiler.frontend.semantics.Binding;
import org.tensorscript.compiler.ir.GraphAndFunctions;
import org.tensorscript.compiler.ir.IrFunction;
import org.tensorscript.compiler.types.AttributeType;
import org.tensorscript.compiler.types.ElementType;
import org.tensorscript.compiler.types.TensorType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Shared lowering of {@code for} and {@code while} statements into a {@code Loop} node.
 * <p>
 * The loop-carried state is every variable the body assigns that is either read by the body before
 * being assigned or live after the loop. The body subgraph takes the iteration counter, the incoming
 * condition and the state, and yields the outgoing condition and the updated state. A trailing
 * {@code if <name>: break} turns into the negated outgoing condition.
 *
 * @param <T> The loop statement type.
 */
abstract class AbstractLoopConverter<T extends StmtNode> implements IStatementConverter<T> {

	/**
	 * The form-specific parts of a loop.
	 *
	 * @param loopVar The script name of the iteration counter.
	 * @param bound The name of the trip-count input, or {@code ""} for none.
	 * @param conditionInput The name of the condition input of the body.
	 * @param conditionName For {@code while}, the script name of the condition variable; otherwise {@code null}.
	 * @param initialCondition The name of the initial condition input.
	 * @param body The loop body.
	 */
	protected record LoopHeader(String loopVar, String bound, String conditionInput, String conditionName,
								String initialCondition, List<StmtNode> body) {}

	/**
	 * Validates the loop statement and translates its header into the enclosing function.
	 */
	protected abstract LoopHeader header(T node, TranslationContext ctx);

	@Override
	public void convert(T node, TranslationContext ctx) {
		LoopHeader header = header(node, ctx);
		SourceInfo source = node.source();

		Set<String> exposed = ctx.liveness().exposedUses(header.body());
		Set<String> liveOut = ctx.liveness().liveOut(node);
		List<String> state = ctx.liveness().assignedNames(header.body()).stream()
				.filter(n -> exposed.contains(n) || liveOut.contains(n))
				.toList();

		IrFunction body = ctx.enterSubgraph("loop_body");
		TensorType counterType = TensorType.scalar(ElementType.INT64);
		String counter = ctx.uniqueName(header.loopVar());
		ctx.builder().addInput(body, counter, counterType);
		ctx.bind(header.loopVar(), new Binding.GraphValue(counter, Binding.Provenance.LOOP_CARRIED, counterType));
		ctx.builder().addInput(body, header.conditionInput(), TensorType.scalar(ElementType.BOOL));
		for (String var : state) {
			String carried = ctx.uniqueName(var);
			ctx.builder().addInput(body, carried, null);
			ctx.bind(var, new Binding.GraphValue(carried, Binding.Provenance.LOOP_CARRIED, null));
		}

		String breakCondition = null;
		List<StmtNode> statements = header.body();
		for (int i = 0; i < statements.size(); i++) {
			StmtNode statement = statements.get(i);
			if (isBreakTest(statement)) {
				breakCondition = breakCondition((IfNode) statement, i == statements.size() - 1, ctx);
			} else {
				ctx.convert(statement);
			}
		}

		String conditionOut = ctx.uniqueName("cond_out");
		String condition = header.conditionInput();
		if (header.conditionName() != null) {
			Binding binding = ctx.scopes().resolveLocal(header.conditionName()).orElseThrow(() -> new UnboundNameException(
					header.conditionName(), "Unable to find condition variable '" + header.conditionName()
					+ "' in the loop body.", source));
			condition = ctx.valueOf(binding, header.conditionName(), source).name();
		}
		if (breakCondition != null) {
			ctx.emit("Not", List.of(breakCondition), List.of(conditionOut), List.of(), source);
		} else {
			ctx.emit("Identity", List.of(condition), List.of(conditionOut), List.of(), source);
		}
		ctx.builder().addOutput(body, conditionOut, TensorType.scalar(ElementType.BOOL));
		for (String var : state) {
			String output = ctx.valueOf(ctx.lookup(var, source), var, source).name();
			if (!body.isAssigned(output) || body.hasOutput(output)) {
				output = ctx.emitCopy(output, var, source);
			}
			ctx.builder().addOutput(body, output, null);
		}
		GraphAndFunctions graph = ctx.exitSubgraph().toGraphAndFunctions();

		List<String> inputs = new ArrayList<>();
		inputs.add(header.bound());
		inputs.add(header.initialCondition());
		for (String var : state) {
			inputs.add(ctx.valueOf(ctx.lookup(var, source), var, source).name());
		}
		List<String> outputs = new ArrayList<>();
		for (String var : state) {
			String result = ctx.uniqueName(var);
			ctx.bind(var, new Binding.GraphValue(result, Binding.Provenance.LOOP_CARRIED, null));
			outputs.add(result);
		}
		ctx.emit(ctx.defaultOpset(), "Loop", inputs, outputs,
				List.of(ctx.builder().makeAttribute("body", graph.graph(), AttributeType.GRAPH)),
				graph.functions(), source);
	}

	private static boolean isBreakTest(StmtNode statement) {
		return statement instanceof IfNode i && i.orelse().isEmpty()
				&& i.body().size() == 1 && i.body().get(0) instanceof BreakNode;
	}

	private String breakCondition(IfNode node, boolean last, TranslationContext ctx) {
		if (!(node.test() instanceof NameNode test)) {
			throw new UnsupportedConstructException(
					"A break must be guarded by a condition variable: 'if <condition>: break'.", node.source());
		}
		if (!last) {
			throw new UnsupportedConstructException("Instruction break must be the last one of the loop.", node.source());
		}
		Binding binding = ctx.scopes().resolveLocal(test.id()).orElseThrow(() -> new UnboundNameException(test.id(),
				"Unable to find condition variable '" + test.id() + "' in the loop body.", node.source()));
		return ctx.valueOf(binding, test.id(), node.source()).name();
	}
}

package org.tensorscript.compiler.frontend.irgen.converters;

import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.frontend.irgen.TranslationContext;
import org.tensorscript.compiler.frontend.parser.ast.CallNode;
import org.tensorscript.compiler.frontend.parser.ast.ForNode;
import org.tensorscript.compiler.frontend.parser.ast.NameNode;

/**
 * Converts {@code for i in range(n):}. The trip count is {@code n}; the initial condition is {@code true}.
 */
public final class ForLoopConverter extends AbstractLoopConverter<ForNode> {

	@Override
	protected LoopHeader header(ForNode node, TranslationContext ctx) {
		if (!(node.target() instanceof NameNode target)) {
			throw new UnsupportedConstructException("For loop target must be a single variable.", node.target().source());
		}
		if (!(node.iter() instanceof CallNode call) || !(call.func() instanceof NameNode f) || !"range".equals(f.id())) {
			throw new UnsupportedConstructException("Unsupported loop bound, only function 'range' is allowed.", node.iter().source());
		}
		if (call.args().size() != 1 || !call.keywords().isEmpty()) {
			throw new UnsupportedConstructException("Unsupported loop bound, it should be 'range(?)'.", node.iter().source());
		}
		String bound = ctx.translateExpression(call.args().get(0), "loop_bound").name();
		String conditionInput = ctx.uniqueName("cond_in");
		String initialCondition = ctx.emitConstant(Boolean.TRUE, "true", node.source()).name();
		return new LoopHeader(target.id(), bound, conditionInput, null, initialCondition, node.body());
	}
}

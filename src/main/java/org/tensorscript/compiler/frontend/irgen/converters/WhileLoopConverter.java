package org.tensorscript.compiler.frontend.irgen.converters;

import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.frontend.irgen.TranslationContext;
import org.tensorscript.compiler.frontend.parser.ast.NameNode;
import org.tensorscript.compiler.frontend.parser.ast.WhileNode;

/**
 * Converts {@code while <name>:}. There is no trip count; the loop starts with the current value of the
 * condition variable and continues with the value the body assigns to it.
 */
public final class WhileLoopConverter extends AbstractLoopConverter<WhileNode> {

	static final String LOOP_VAR = "infinite_loop";

	@Override
	protected LoopHeader header(WhileNode node, TranslationContext ctx) {
		if (!(node.test() instanceof NameNode test)) {
			throw new UnsupportedConstructException(
					"Unsupported loop condition, it should be 'while <condition_name>:'.", node.test().source());
		}
		String initialCondition = ctx.translateExpression(test, null).name();
		String conditionInput = ctx.uniqueName(test.id());
		return new LoopHeader(LOOP_VAR, "", conditionInput, test.id(), initialCondition, node.body());
	}
}

package org.tensorscript.compiler.frontend.irgen;

import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.frontend.parser.ast.StmtNode;

/**
 * Fallback converter for statements that have no graph lowering.
 */
public final class UnsupportedStatementConverter implements IStatementConverter<StmtNode> {

	@Override
	public void convert(StmtNode node, TranslationContext ctx) {
		String text = node.source().lineContent();
		String shown = text == null || text.isBlank() ? node.getClass().getSimpleName() : "'" + text.strip() + "'";
		throw new UnsupportedConstructException("Unsupported statement " + shown + ".", node.source());
	}
}

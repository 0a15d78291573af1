package org.tensorscript.compiler.frontend.irgen.converters;

import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.frontend.irgen.IStatementConverter;
import org.tensorscript.compiler.frontend.irgen.TranslationContext;
import org.tensorscript.compiler.frontend.parser.ast.ExprStmtNode;

/**
 * Converts {@link ExprStmtNode}. Only {@code print(...)} calls are accepted and emit nothing.
 * A leading doc string is consumed by the function translator before statements are converted.
 */
public final class ExprStmtConverter implements IStatementConverter<ExprStmtNode> {

	@Override
	public void convert(ExprStmtNode node, TranslationContext ctx) {
		if (node.isPrintCall()) return;
		throw new UnsupportedConstructException("Expression statements are not supported, the value would be discarded.", node.source());
	}
}

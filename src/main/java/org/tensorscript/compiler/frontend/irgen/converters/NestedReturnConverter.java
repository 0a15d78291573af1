package org.tensorscript.compiler.frontend.irgen.converters;

import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.frontend.irgen.IStatementConverter;
import org.tensorscript.compiler.frontend.irgen.TranslationContext;
import org.tensorscript.compiler.frontend.parser.ast.ReturnNode;

/**
 * Rejects {@code return} inside a branch or loop body. Function-level returns never reach the registry.
 */
public final class NestedReturnConverter implements IStatementConverter<ReturnNode> {

	@Override
	public void convert(ReturnNode node, TranslationContext ctx) {
		throw new UnsupportedConstructException("Return statements are not permitted inside control-flow statements.", node.source());
	}
}

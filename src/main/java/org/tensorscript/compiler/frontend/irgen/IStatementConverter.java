package org.tensorscript.compiler.frontend.irgen;

import org.tensorscript.compiler.frontend.parser.ast.StmtNode;

/**
 * Lowers a specific statement type into graph nodes of the current function.
 * <p>
 * Implementations should be stateless. All nodes must be emitted via the provided {@link TranslationContext}.
 *
 * @param <T> The concrete statement type handled by this converter.
 */
public interface IStatementConverter<T extends StmtNode> {

	/**
	 * Converts the given statement and emits results via the provided context.
	 *
	 * @param node The statement to convert.
	 * @param ctx  The translation context of the enclosing function.
	 */
	void convert(T node, TranslationContext ctx);
}

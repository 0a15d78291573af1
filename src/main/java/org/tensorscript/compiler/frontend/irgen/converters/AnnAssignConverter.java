package org.tensorscript.compiler.frontend.irgen.converters;

import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.frontend.irgen.IStatementConverter;
import org.tensorscript.compiler.frontend.irgen.TranslationContext;
import org.tensorscript.compiler.frontend.parser.ast.AnnAssignNode;
import org.tensorscript.compiler.types.TensorType;
import org.tensorscript.compiler.types.TypeAnnotations;

/**
 * Converts {@link AnnAssignNode}. The annotation is recorded on the binding; an annotation that is
 * not a tensor type is reported as a warning and ignored.
 */
public final class AnnAssignConverter implements IStatementConverter<AnnAssignNode> {

	@Override
	public void convert(AnnAssignNode node, TranslationContext ctx) {
		if (node.value() == null) {
			throw new UnsupportedConstructException("Annotated declarations without a value are not supported.", node.source());
		}
		TensorType type = TypeAnnotations.tensor(node.annotation()).orElse(null);
		if (type == null) {
			ctx.warn("Unsupported type annotation for variable '" + node.target().id() + "'.", node.annotation().source());
		}
		AssignConverter.assign(node.target(), node.value(), type, ctx);
	}
}

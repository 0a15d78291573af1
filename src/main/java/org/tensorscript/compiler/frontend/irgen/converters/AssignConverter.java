package org.tensorscript.compiler.frontend.irgen.converters;

import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.frontend.irgen.IStatementConverter;
import org.tensorscript.compiler.frontend.irgen.TranslationContext;
import org.tensorscript.compiler.frontend.parser.ast.AssignNode;
import org.tensorscript.compiler.frontend.parser.ast.CallNode;
import org.tensorscript.compiler.frontend.parser.ast.ExprNode;
import org.tensorscript.compiler.frontend.parser.ast.NameNode;
import org.tensorscript.compiler.frontend.parser.ast.TupleNode;
import org.tensorscript.compiler.frontend.semantics.Binding;
import org.tensorscript.compiler.ir.TranslatedExpression;
import org.tensorscript.compiler.types.TensorType;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts {@link AssignNode}: the right-hand side is translated with the target names as preferred
 * output names, and the targets are rebound to the results.
 * <p>
 * {@code a, b = x, y} assigns pairwise; {@code a, b = op.Split(...)} binds the outputs of one multi-output call.
 */
public final class AssignConverter implements IStatementConverter<AssignNode> {

	@Override
	public void convert(AssignNode node, TranslationContext ctx) {
		if (node.targets().size() != 1) {
			throw new UnsupportedConstructException("Multi-assignment not supported.", node.source());
		}
		assign(node.targets().get(0), node.value(), null, ctx);
	}

	static void assign(ExprNode lhs, ExprNode rhs, TensorType type, TranslationContext ctx) {
		if (rhs instanceof TupleNode values) {
			if (!(lhs instanceof TupleNode targets)) {
				throw new UnsupportedConstructException("Left term must be a tuple when the right term is one.", lhs.source());
			}
			if (targets.elements().size() != values.elements().size()) {
				throw new UnsupportedConstructException(
						"Expected same number of elements on lhs and rhs of assignments.", lhs.source());
			}
			for (int i = 0; i < targets.elements().size(); i++) {
				assignSingle(targets.elements().get(i), values.elements().get(i), type, ctx);
			}
			return;
		}
		assignSingle(lhs, rhs, type, ctx);
	}

	private static void assignSingle(ExprNode lhs, ExprNode rhs, TensorType type, TranslationContext ctx) {
		if (lhs instanceof NameNode name) {
			TranslatedExpression value = ctx.translateExpression(rhs, name.id());
			bindResult(name.id(), value, type, ctx);
			return;
		}
		if (lhs instanceof TupleNode tuple) {
			List<String> ids = new ArrayList<>();
			for (ExprNode element : tuple.elements()) {
				if (!(element instanceof NameNode n)) {
					throw new UnsupportedConstructException("Only names are supported in tuple targets.", element.source());
				}
				ids.add(n.id());
			}
			if (!(rhs instanceof CallNode call)) {
				throw new UnsupportedConstructException("Assigning to a tuple requires a call on the right.", rhs.source());
			}
			List<String> outputs = ctx.expressions().translateMulti(call, ids);
			for (int i = 0; i < ids.size(); i++) {
				bindResult(ids.get(i), TranslatedExpression.any(outputs.get(i)), type, ctx);
			}
			return;
		}
		throw new UnsupportedConstructException("Unsupported construct in LHS of assignment.", lhs.source());
	}

	private static void bindResult(String name, TranslatedExpression value, TensorType type, TranslationContext ctx) {
		Binding.Provenance provenance = value.isConstant() ? Binding.Provenance.CONSTANT : Binding.Provenance.INTERMEDIATE;
		ctx.bind(name, new Binding.GraphValue(value.name(), provenance, type));
	}
}

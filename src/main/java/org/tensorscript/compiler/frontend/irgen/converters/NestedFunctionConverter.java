package org.tensorscript.compiler.frontend.irgen.converters;

import org.tensorscript.compiler.frontend.irgen.IStatementConverter;
import org.tensorscript.compiler.frontend.irgen.TranslationContext;
import org.tensorscript.compiler.frontend.parser.ast.FunctionDefNode;
import org.tensorscript.compiler.frontend.semantics.Binding;
import org.tensorscript.compiler.ir.IrFunction;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts a {@code def} inside a function body into a nested function. The bindings of the outer
 * variables it reads are captured, so that a later rebinding can be detected where the function is used.
 */
public final class NestedFunctionConverter implements IStatementConverter<FunctionDefNode> {

	@Override
	public void convert(FunctionDefNode node, TranslationContext ctx) {
		IrFunction function = ctx.functionTranslator().translateNested(node, ctx);
		Map<String, Binding> captured = new LinkedHashMap<>();
		for (String name : ctx.liveness().freeVariables(node)) {
			captured.put(name, ctx.lookup(name, node.source()));
		}
		ctx.bind(node.name(), new Binding.NestedFunction(function, captured));
		ctx.current().addNestedFunction(function);
	}
}

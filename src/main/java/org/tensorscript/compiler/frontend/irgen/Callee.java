package org.tensorscript.compiler.frontend.irgen;

import org.tensorscript.compiler.ir.IrFunction;
import org.tensorscript.compiler.schema.OpSchema;
import org.tensorscript.compiler.schema.Opset;

/**
 * The resolved target of a call: a library operator or a script function.
 *
 * @param opset The opset the node is emitted in.
 * @param opType The operator or function name.
 * @param schema The signature, or {@code null} if it is unknown.
 * @param function The called script function, or {@code null} for library operators.
 */
public record Callee(Opset opset, String opType, OpSchema schema, IrFunction function) {

	public static Callee operator(Opset opset, String opType, OpSchema schema) {
		return new Callee(opset, opType, schema, null);
	}

	public boolean isScriptFunction() {
		return function != null;
	}
}

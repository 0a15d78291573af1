package org.tensorscript.compiler.frontend.semantics;

import org.tensorscript.compiler.ir.IrFunction;
import org.tensorscript.compiler.schema.Opset;
import org.tensorscript.compiler.types.AttributeType;
import org.tensorscript.compiler.types.TensorType;

import java.util.Map;

/**
 * What a script name stands for during translation.
 */
public sealed interface Binding {

    /**
     * An imported opset, used as the module part of {@code op.Add(...)}.
     * @param opset The opset.
     */
    record OpsetBinding(Opset opset) implements Binding {}

    /**
     * A name that directly denotes an operator of an opset.
     * @param opset The opset defining the operator.
     * @param opType The operator name.
     */
    record OperatorRef(Opset opset, String opType) implements Binding {}

    /**
     * A compile-time attribute parameter of the function being translated.
     * @param attrName The parameter name.
     * @param type The attribute type.
     * @param bool {@code true} if declared as {@code bool}.
     */
    record AttributeRef(String attrName, AttributeType type, boolean bool) implements Binding {}

    /**
     * A runtime value of the graph.
     * @param name The value name in the graph.
     * @param provenance Where the value comes from.
     * @param type The declared type, or {@code null}.
     */
    record GraphValue(String name, Provenance provenance, TensorType type) implements Binding {}

    /**
     * A function defined inside the function being translated.
     * @param function The lowered function.
     * @param captured The outer bindings of its free variables at definition time.
     */
    record NestedFunction(IrFunction function, Map<String, Binding> captured) implements Binding {
        public NestedFunction {
            captured = Map.copyOf(captured);
        }
    }

    /**
     * A module-level constant.
     * @param value The constant value; never {@code null}.
     */
    record ConstantBinding(Object value) implements Binding {}

    /**
     * A top-level function defined earlier in the same script.
     * @param function The lowered function.
     * @param moduleOpset The opset the function is registered under.
     */
    record ScriptFunctionRef(IrFunction function, Opset moduleOpset) implements Binding {}

    /**
     * The origin of a {@link GraphValue}.
     */
    enum Provenance {
        INPUT,
        LOOP_CARRIED,
        INTERMEDIATE,
        CONSTANT
    }
}

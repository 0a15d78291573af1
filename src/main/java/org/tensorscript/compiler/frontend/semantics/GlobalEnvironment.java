package org.tensorscript.compiler.frontend.semantics;

import org.tensorscript.compiler.ir.IrFunction;
import org.tensorscript.compiler.schema.Opset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The module-level bindings visible to every function of a script: imported opsets,
 * module constants and the script's own functions.
 */
public class GlobalEnvironment {

    private final Map<String, Binding> bindings = new LinkedHashMap<>();

    public void defineOpset(String alias, Opset opset) {
        bindings.put(alias, new Binding.OpsetBinding(opset));
    }

    public void defineOperator(String name, Opset opset, String opType) {
        bindings.put(name, new Binding.OperatorRef(opset, opType));
    }

    public void defineConstant(String name, Object value) {
        bindings.put(name, new Binding.ConstantBinding(value));
    }

    public void defineFunction(IrFunction function, Opset moduleOpset) {
        bindings.put(function.name(), new Binding.ScriptFunctionRef(function, moduleOpset));
    }

    /**
     * @param name A module-level name.
     * @return The binding, or empty if the module does not define the name.
     */
    public Optional<Binding> resolve(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /**
     * Resolves a module constant by name.
     * @param name The name.
     * @return The constant value, or empty if the name is not a module constant.
     */
    public Optional<Object> constant(String name) {
        Binding binding = bindings.get(name);
        if (binding instanceof Binding.ConstantBinding c) {
            return Optional.of(c.value());
        }
        return Optional.empty();
    }

    /**
     * @return All module-level bindings in definition order.
     */
    public Map<String, Binding> bindings() {
        return Collections.unmodifiableMap(bindings);
    }
}

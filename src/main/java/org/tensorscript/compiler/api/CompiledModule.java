package org.tensorscript.compiler.api;

import org.tensorscript.compiler.diagnostics.Diagnostic;
import org.tensorscript.compiler.ir.IrFunction;
import org.tensorscript.compiler.schema.Opset;

import java.util.List;
import java.util.Optional;

/**
 * The result of compiling a script: the module's opset, its functions in source order
 * and the warnings collected during translation.
 *
 * @param moduleOpset The opset under which the script's functions are registered.
 * @param functions The translated top-level functions in source order.
 * @param warnings The non-fatal diagnostics.
 */
public record CompiledModule(Opset moduleOpset, List<IrFunction> functions, List<Diagnostic> warnings) {

    public CompiledModule {
        functions = List.copyOf(functions);
        warnings = List.copyOf(warnings);
    }

    /**
     * @param name A function name.
     * @return The top-level function of that name, if the script defines it.
     */
    public Optional<IrFunction> function(String name) {
        return functions.stream().filter(f -> f.name().equals(name)).findFirst();
    }
}

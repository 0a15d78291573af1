package org.tensorscript.compiler;

import com.typesafe.config.Config;
import org.tensorscript.compiler.schema.Opset;

/**
 * The settings the compiler consumes, read from the {@code tensorscript.compiler} section of the configuration.
 *
 * @param defaultOpset The opset of unqualified operator calls in functions that use no opset explicitly.
 * @param moduleOpset The opset identity of the script module; script functions are emitted in its domain.
 * @param verbosity The {@link org.tensorscript.compiler.diagnostics.CompilerLogger} level, or -1 to leave it unchanged.
 */
public record CompilerOptions(Opset defaultOpset, Opset moduleOpset, int verbosity) {

    public static final String CONFIG_PATH = "tensorscript.compiler";

    public static CompilerOptions defaults() {
        return new CompilerOptions(new Opset("", 18), new Opset("this", 1), -1);
    }

    /**
     * Reads the options from a resolved configuration.
     * @param config The full configuration; must contain {@value #CONFIG_PATH}.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a setting is missing or malformed.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config compiler = config.getConfig(CONFIG_PATH);
        Opset defaultOpset = new Opset(compiler.getString("default-opset.domain"), compiler.getInt("default-opset.version"));
        Opset moduleOpset = new Opset(compiler.getString("module.domain"), compiler.getInt("module.version"));
        int verbosity = compiler.hasPath("verbosity") ? compiler.getInt("verbosity") : -1;
        return new CompilerOptions(defaultOpset, moduleOpset, verbosity);
    }
}

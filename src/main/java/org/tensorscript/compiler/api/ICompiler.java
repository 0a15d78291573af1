package org.tensorscript.compiler.api;

import java.util.List;

/**
 * Defines the public interface of the script compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given script.
     *
     * @param sourceLines The lines of the script.
     * @param fileName A name for the script, used in source positions and error messages.
     * @return A {@link CompiledModule} with all functions of the script.
     * @throws CompilationException if any error occurs; no partial module is produced.
     */
    CompiledModule compile(List<String> sourceLines, String fileName) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=error .. 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Compiles a script file.
     * @param scriptPath The path to the script.
     * @return A {@link CompiledModule} with all functions of the script.
     * @throws CompilationException if errors occur during compilation.
     * @throws java.io.IOException if the file cannot be read.
     */
    default CompiledModule compile(String scriptPath) throws CompilationException, java.io.IOException {
        return compile(java.nio.file.Files.readAllLines(java.nio.file.Path.of(scriptPath)), scriptPath);
    }
}

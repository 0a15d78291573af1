package org.tensorscript.cli.commands;

import com.typesafe.config.Config;
import org.tensorscript.cli.CommandLineInterface;
import org.tensorscript.compiler.Compiler;
import org.tensorscript.compiler.CompilerOptions;
import org.tensorscript.compiler.api.CompilationException;
import org.tensorscript.compiler.api.CompiledModule;
import org.tensorscript.compiler.diagnostics.Diagnostic;
import org.tensorscript.compiler.ir.GraphJsonWriter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "compile", description = "Compiles a script to the JSON interchange form of its graphs.")
public class CompileCommand implements Callable<Integer> {

    static final int EXIT_COMPILATION_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the script.")
    private File file;

    @Option(names = {"-o", "--output"}, description = "Write the JSON to this file instead of standard output.")
    private File output;

    @Option(names = {"--compact"}, description = "Write compact JSON regardless of the configured pretty-printing.")
    private boolean compact;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Config config = parent.getConfig();

        List<String> sourceLines;
        try {
            sourceLines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        Compiler compiler = new Compiler(CompilerOptions.fromConfig(config));
        CompiledModule module;
        try {
            module = compiler.compile(sourceLines, file.getName());
        } catch (CompilationException e) {
            err.println(e.getMessage());
            return EXIT_COMPILATION_ERROR;
        }
        for (Diagnostic warning : module.warnings()) {
            err.println(warning);
        }

        boolean prettyPrint = !compact && config.getBoolean("tensorscript.output.pretty-print");
        GraphJsonWriter writer = new GraphJsonWriter(prettyPrint);
        try {
            String json = writer.writeString(writer.toJson(module));
            if (output == null) {
                out.println(json);
                out.flush();
            } else {
                Files.writeString(output.toPath(), json + System.lineSeparator(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            err.println("Cannot write " + (output == null ? "output" : output) + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        return 0;
    }
}

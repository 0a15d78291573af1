package org.tensorscript.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tensorscript.compiler.api.CompilationException;
import org.tensorscript.compiler.api.CompiledModule;
import org.tensorscript.compiler.api.ICompiler;
import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.api.TranslationException;
import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.diagnostics.CompilerLogger;
import org.tensorscript.compiler.diagnostics.Diagnostic;
import org.tensorscript.compiler.diagnostics.DiagnosticsEngine;
import org.tensorscript.compiler.frontend.irgen.FunctionTranslator;
import org.tensorscript.compiler.frontend.irgen.StatementConverterRegistry;
import org.tensorscript.compiler.frontend.lexer.Lexer;
import org.tensorscript.compiler.frontend.lexer.Token;
import org.tensorscript.compiler.frontend.parser.Parser;
import org.tensorscript.compiler.frontend.parser.ast.AssignNode;
import org.tensorscript.compiler.frontend.parser.ast.ExprStmtNode;
import org.tensorscript.compiler.frontend.parser.ast.FunctionDefNode;
import org.tensorscript.compiler.frontend.parser.ast.ImportNode;
import org.tensorscript.compiler.frontend.parser.ast.NameNode;
import org.tensorscript.compiler.frontend.parser.ast.StmtNode;
import org.tensorscript.compiler.frontend.semantics.ConstantEvaluator;
import org.tensorscript.compiler.frontend.semantics.GlobalEnvironment;
import org.tensorscript.compiler.frontend.semantics.LivenessOracle;
import org.tensorscript.compiler.ir.IrBuilder;
import org.tensorscript.compiler.ir.IrFunction;
import org.tensorscript.compiler.schema.Opset;
import org.tensorscript.compiler.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The main compiler implementation. This class orchestrates the pipeline from script text
 * to a {@link CompiledModule}: lexing, parsing, module-level bindings and function translation.
 * It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);
    private static final Pattern OPSET_MODULE = Pattern.compile("(?:.*\\.)?opset(\\d+)");

    private final CompilerOptions options;
    private final SchemaRegistry schemas;
    private int verbosity;
    private String currentFunction;

    /**
     * Creates a compiler with default options and the bundled operator schemas.
     */
    public Compiler() {
        this(CompilerOptions.defaults(), SchemaRegistry.loadDefault());
    }

    public Compiler(CompilerOptions options) {
        this(options, SchemaRegistry.loadDefault());
    }

    public Compiler(CompilerOptions options, SchemaRegistry schemas) {
        this.options = options;
        this.schemas = schemas;
        this.verbosity = options.verbosity();
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public CompiledModule compile(List<String> sourceLines, String fileName) throws CompilationException {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
        CompilerLogger.info("Compiler: " + fileName);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexing
        Lexer lexer = new Lexer(String.join("\n", sourceLines), diagnostics, fileName);
        List<Token> tokens = lexer.scanTokens();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary());
        }

        // Phase 2: Parsing
        Parser parser = new Parser(tokens, diagnostics, sourceLines);
        List<StmtNode> statements = parser.parse();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary());
        }
        CompilerLogger.debug("Compiler: parsed " + statements.size() + " top-level statements");

        // Phase 3: Module bindings and function translation
        IrBuilder builder = new IrBuilder();
        GlobalEnvironment globals = new GlobalEnvironment();
        FunctionTranslator translator = new FunctionTranslator(globals, schemas, builder, diagnostics,
                StatementConverterRegistry.initializeWithDefaults(), options.defaultOpset(), options.moduleOpset());
        List<IrFunction> functions = new ArrayList<>();
        currentFunction = null;
        try {
            for (StmtNode statement : statements) {
                translateTopLevel(statement, globals, translator, functions, diagnostics);
            }
        } catch (TranslationException e) {
            throw new CompilationException(format(e, currentFunction), e);
        }

        List<Diagnostic> warnings = diagnostics.getWarnings();
        for (Diagnostic warning : warnings) {
            LOG.warn("{}:{}: {}", warning.fileName(), warning.lineNumber(), warning.message());
        }
        CompilerLogger.info("Compiler: " + functions.size() + " functions, " + warnings.size() + " warnings");
        return new CompiledModule(options.moduleOpset(), functions, warnings);
    }

    /**
     * Translates a single function against an explicit module environment. The function is bound in
     * the environment afterwards, so later calls can refer to it.
     *
     * @param def The function definition.
     * @param globals The module-level bindings.
     * @param builder The builder the function is registered in.
     * @param liveness Live-variable facts for the definition, or {@code null} to compute them.
     * @param diagnostics Receives warnings.
     * @return The translated function.
     * @throws CompilationException if the function cannot be translated.
     */
    public IrFunction translateFunction(FunctionDefNode def, GlobalEnvironment globals, IrBuilder builder,
                                        LivenessOracle liveness, DiagnosticsEngine diagnostics) throws CompilationException {
        FunctionTranslator translator = new FunctionTranslator(globals, schemas, builder, diagnostics,
                StatementConverterRegistry.initializeWithDefaults(), options.defaultOpset(), options.moduleOpset());
        try {
            IrFunction function = liveness == null ? translator.translate(def) : translator.translate(def, liveness);
            globals.defineFunction(function, options.moduleOpset());
            return function;
        } catch (TranslationException e) {
            throw new CompilationException(format(e, def.name()), e);
        }
    }

    private void translateTopLevel(StmtNode statement, GlobalEnvironment globals, FunctionTranslator translator,
                                   List<IrFunction> functions, DiagnosticsEngine diagnostics) {
        if (statement instanceof ImportNode imp) {
            defineImport(imp, globals, diagnostics);
        } else if (statement instanceof AssignNode assign
                && assign.targets().size() == 1 && assign.targets().get(0) instanceof NameNode name) {
            ConstantEvaluator evaluator = new ConstantEvaluator(globals::constant);
            globals.defineConstant(name.id(), evaluator.evaluate(assign.value()));
        } else if (statement instanceof FunctionDefNode def) {
            currentFunction = def.name();
            IrFunction function = translator.translate(def);
            globals.defineFunction(function, options.moduleOpset());
            functions.add(function);
            currentFunction = null;
            CompilerLogger.debug("Compiler: translated function " + def.name() + ": " + function);
        } else if (!(statement instanceof ExprStmtNode e && e.isDocString())) {
            throw new UnsupportedConstructException("Unsupported top-level statement.", statement.source());
        }
    }

    private void defineImport(ImportNode imp, GlobalEnvironment globals, DiagnosticsEngine diagnostics) {
        Matcher matcher = OPSET_MODULE.matcher(imp.module());
        String alias = imp.alias();
        if (matcher.matches()) {
            globals.defineOpset(alias, new Opset("", Integer.parseInt(matcher.group(1))));
        } else {
            diagnostics.reportWarning("Import of module '" + imp.module() + "' is ignored.", imp.source());
        }
    }

    private static String format(TranslationException e, String function) {
        SourceInfo source = e.sourceInfo() != null ? e.sourceInfo() : SourceInfo.UNKNOWN;
        StringBuilder sb = new StringBuilder();
        sb.append(source.fileName()).append(':').append(source.lineNumber()).append(':').append(source.columnNumber()).append(": ");
        if (function != null) {
            sb.append("in function '").append(function).append("': ");
        }
        sb.append(e.getMessage());
        return sb.toString();
    }
}

package org.tensorscript.compiler.e2e;

import com.fasterxml.jackson.databind.JsonNode;
import org.tensorscript.compiler.Compiler;
import org.tensorscript.compiler.api.CompilationException;
import org.tensorscript.compiler.api.CompiledModule;
import org.tensorscript.compiler.ir.GraphJsonWriter;
import org.tensorscript.compiler.ir.IrFunction;
import org.tensorscript.compiler.ir.IrNode;
import org.tensorscript.junit.extensions.logging.ExpectLog;
import org.tensorscript.junit.extensions.logging.LogLevel;
import org.tensorscript.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Compiles complete scripts through every phase and checks the emitted module.
 */
@ExtendWith(LogWatchExtension.class)
public class CompilerEndToEndTest {

    private static final String SCRIPT = """
            import opset18 as op

            EPS = 1e-6

            def normalize(X: FLOAT[N, C], axis: int = -1) -> FLOAT[N, C]:
                \"\"\"Scales X to unit sum along an axis.\"\"\"
                total = op.ReduceSum(X, op.Constant(value_ints=[1]), keepdims=1)
                return X / (total + EPS)

            def accumulate(X, n):
                s = op.Identity(X)
                for i in range(n):
                    s = normalize(s + X)
                    done = op.ReduceMax(s) > 0.5
                    if done: break
                return s

            def select(X, flag):
                if flag:
                    y = op.Relu(X)
                else:
                    y = op.Neg(X)
                return y[0]
            """;

    private static CompiledModule compile(String source) throws CompilationException {
        return new Compiler().compile(source.lines().toList(), "model.py");
    }

    @Test
    @Tag("integration")
    void compilesMultiFunctionScript() throws Exception {
        // Act
        CompiledModule module = compile(SCRIPT);

        // Assert
        assertThat(module.functions()).extracting(IrFunction::name).containsExactly("normalize", "accumulate", "select");
        assertThat(module.warnings()).isEmpty();

        IrFunction normalize = module.function("normalize").orElseThrow();
        assertThat(normalize.docString()).isEqualTo("Scales X to unit sum along an axis.");
        assertThat(normalize.nodes()).extracting(IrNode::opType).contains("ReduceSum", "Add", "Div");

        IrFunction accumulate = module.function("accumulate").orElseThrow();
        IrNode loop = accumulate.nodes().stream().filter(n -> n.opType().equals("Loop")).findFirst().orElseThrow();
        assertThat(loop.inputs()).hasSize(3);
        assertThat(accumulate.calledFunctions()).containsKey("normalize");
        assertThat(accumulate.opsetImports()).containsKeys("", "this");

        IrFunction select = module.function("select").orElseThrow();
        assertThat(select.nodes()).extracting(IrNode::opType).containsExactly("If", "Constant", "Gather");

        JsonNode json = new GraphJsonWriter(false).toJson(module);
        assertThat(json.get("functions")).hasSize(3);
        assertThat(json.at("/functions/1/functions/0").asText()).isEqualTo("normalize");
    }

    @Test
    @Tag("integration")
    void sameScriptCompilesToSameJson() throws Exception {
        // Arrange
        GraphJsonWriter writer = new GraphJsonWriter(false);

        // Act
        String first = writer.writeString(writer.toJson(compile(SCRIPT)));
        String second = writer.writeString(writer.toJson(compile(SCRIPT)));

        // Assert
        assertThat(first).isEqualTo(second);
    }

    @Test
    @Tag("integration")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = "org\\.tensorscript\\.compiler\\.Compiler",
            messagePattern = "model\\.py:2: Unknown function name 'Softplusish'\\. The graph may not work\\.")
    void warningsAreReturnedAndLoggedOnce() throws CompilationException {
        // Act
        CompiledModule module = compile("""
                def f(X):
                    return Softplusish(X)
                """);

        // Assert
        assertThat(module.warnings()).hasSize(1);
        assertThat(module.warnings().get(0).message()).isEqualTo("Unknown function name 'Softplusish'. The graph may not work.");
    }

    @Test
    @Tag("integration")
    void lexicalErrorStopsBeforeTranslation() {
        assertThatThrownBy(() -> compile("""
                def f(X):
                    s = "open
                    return X
                """))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("model.py")
                .hasMessageContaining("Unterminated string.");
    }

    @Test
    @Tag("integration")
    void syntaxErrorIsReportedWithPosition() {
        assertThatThrownBy(() -> compile("""
                def f(X)
                    return X
                """))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("model.py:1");
    }

    @Test
    @Tag("integration")
    void unsupportedTopLevelStatementIsRejected() {
        assertThatThrownBy(() -> compile("""
                import opset18 as op
                for i in range(3):
                    x = i
                """))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("model.py:2:")
                .hasMessageContaining("Unsupported top-level statement.");
    }
}

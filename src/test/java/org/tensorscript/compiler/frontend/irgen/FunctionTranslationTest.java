package org.tensorscript.compiler.frontend.irgen;

import org.tensorscript.compiler.api.ArityException;
import org.tensorscript.compiler.api.CapturedVariableMutationException;
import org.tensorscript.compiler.api.CompilationException;
import org.tensorscript.compiler.api.CompiledModule;
import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.ir.IrAttribute;
import org.tensorscript.compiler.ir.IrAttrParameter;
import org.tensorscript.compiler.ir.IrFunction;
import org.tensorscript.compiler.ir.IrGraph;
import org.tensorscript.compiler.ir.IrNode;
import org.tensorscript.compiler.ir.IrValueInfo;
import org.tensorscript.compiler.schema.FormalParameter;
import org.tensorscript.compiler.types.AttributeType;
import org.tensorscript.compiler.types.ElementType;
import org.tensorscript.compiler.types.TensorType;
import org.tensorscript.junit.extensions.logging.ExpectLog;
import org.tensorscript.junit.extensions.logging.LogLevel;
import org.tensorscript.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tensorscript.compiler.frontend.irgen.ScriptFixtures.compile;
import static org.tensorscript.compiler.frontend.irgen.ScriptFixtures.lastFunction;
import static org.tensorscript.compiler.frontend.irgen.ScriptFixtures.nodes;
import static org.tensorscript.compiler.frontend.irgen.ScriptFixtures.opTypes;
import static org.tensorscript.compiler.frontend.irgen.ScriptFixtures.single;

/**
 * Tests signatures, return values, nested definitions and calls between script functions.
 */
@ExtendWith(LogWatchExtension.class)
public class FunctionTranslationTest {

    @Test
    @Tag("unit")
    void annotatedSignatureDeclaresTypesAndAttributes() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X: FLOAT[N, 3], k: int = 2, mode: str = \"a\") -> FLOAT[N, 3]:",
                "    return op.Neg(X)");

        // Assert
        assertThat(f.inputs()).containsExactly(
                new IrValueInfo("X", new TensorType(ElementType.FLOAT, List.of("N", 3L))));
        assertThat(f.attrParameters()).containsExactly(
                new IrAttrParameter("k", AttributeType.INT, new IrAttribute.IntAttr("k", 2)),
                new IrAttrParameter("mode", AttributeType.STRING, new IrAttribute.StringAttr("mode", "a")));
        assertThat(f.outputs()).containsExactly(
                new IrValueInfo("return_val", new TensorType(ElementType.FLOAT, List.of("N", 3L))));
        assertThat(f.domain()).isEqualTo("this");
    }

    @Test
    @Tag("unit")
    void untypedInputsBecomeTypeVariablesInCallSignature() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(A, B: INT64):",
                "    return op.Add(A, A)");

        // Assert
        assertThat(f.inputs().get(0).type()).isNull();
        assertThat(f.toSchema().inputs()).extracting(FormalParameter::typeStr).containsExactly("T0", "tensor(int64)");
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "test\\.py:2: Unsupported type annotation for argument x\\.")
    void unsupportedAnnotationIsWarnedAndIgnored() throws CompilationException {
        // Act
        CompiledModule module = compile(
                "import opset18 as op",
                "def f(x: Widget):",
                "    return op.Neg(x)");

        // Assert
        assertThat(module.warnings()).hasSize(1);
        assertThat(module.function("f").orElseThrow().inputs().get(0).type()).isNull();
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Default value of input X is ignored\\.")
    void defaultValueOfTensorInputIsIgnored() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X=None):",
                "    return op.Neg(X)");

        // Assert
        assertThat(f.inputs()).extracting(IrValueInfo::name).containsExactly("X");
    }

    /**
     * A returned input cannot be an output of the same graph and is copied first.
     */
    @Test
    @Tag("unit")
    void returningAnInputInsertsCopy() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "def f(X):",
                "    return X");

        // Assert
        IrNode copy = single(f, "Identity");
        assertThat(copy.inputs()).containsExactly("X");
        assertThat(copy.outputs()).containsExactly("return_val");
        assertThat(f.outputs()).extracting(IrValueInfo::name).containsExactly("return_val");
    }

    @Test
    @Tag("unit")
    void returningTheSameValueTwiceCopiesTheSecond() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X):",
                "    Y = op.Neg(X)",
                "    return Y, Y");

        // Assert
        assertThat(f.outputs()).extracting(IrValueInfo::name).containsExactly("Y", "Y_copy");
        assertThat(single(f, "Identity").inputs()).containsExactly("Y");
    }

    @Test
    @Tag("unit")
    void returnCountMustMatchDeclaredTypes() {
        assertThatThrownBy(() -> compile(
                "import opset18 as op",
                "def f(X) -> tuple[FLOAT, FLOAT]:",
                "    return op.Neg(X)"))
                .isInstanceOf(CompilationException.class)
                .hasCauseInstanceOf(ArityException.class)
                .hasMessageContaining("Mismatch in number of return values and types: 2 declared, 1 returned.");
    }

    @Test
    @Tag("unit")
    void statementsAfterReturnAreRejected() {
        assertThatThrownBy(() -> compile(
                "import opset18 as op",
                "def f(X):",
                "    return op.Neg(X)",
                "    Y = op.Abs(X)"))
                .isInstanceOf(CompilationException.class)
                .hasCauseInstanceOf(UnsupportedConstructException.class)
                .hasMessageContaining("Statements after a return statement are not supported.");
    }

    @Test
    @Tag("unit")
    void returnWithoutValueIsRejected() {
        assertThatThrownBy(() -> compile(
                "def f(X):",
                "    return"))
                .isInstanceOf(CompilationException.class)
                .hasCauseInstanceOf(UnsupportedConstructException.class);
    }

    @Test
    @Tag("unit")
    void leadingStringBecomesDocString() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X):",
                "    \"\"\"Negates X.\"\"\"",
                "    return op.Neg(X)");

        // Assert
        assertThat(f.docString()).isEqualTo("Negates X.");
        assertThat(opTypes(f)).containsExactly("Neg");
    }

    // --- Statements ---

    @Test
    @Tag("unit")
    void tupleAssignmentBindsPairwise() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X):",
                "    a, b = op.Neg(X), op.Abs(X)",
                "    return op.Add(a, b)");

        // Assert
        assertThat(single(f, "Neg").outputs()).containsExactly("a");
        assertThat(single(f, "Abs").outputs()).containsExactly("b");
        assertThat(single(f, "Add").inputs()).containsExactly("a", "b");
    }

    @Test
    @Tag("unit")
    void tupleTargetTakesAllOutputsOfOneCall() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X):",
                "    low, high = op.Split(X)",
                "    return op.Sub(high, low)");

        // Assert
        assertThat(opTypes(f)).containsExactly("Split", "Sub");
        assertThat(single(f, "Split").outputs()).containsExactly("low", "high");
        assertThat(single(f, "Sub").inputs()).containsExactly("high", "low");
    }

    @Test
    @Tag("unit")
    void printStatementEmitsNothing() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X):",
                "    print(X)",
                "    return op.Neg(X)");

        // Assert
        assertThat(opTypes(f)).containsExactly("Neg");
    }

    @Test
    @Tag("unit")
    void returnInsideConditionalIsRejected() {
        assertThatThrownBy(() -> compile(
                "import opset18 as op",
                "def f(X, c):",
                "    if c:",
                "        return op.Neg(X)",
                "    return X"))
                .isInstanceOf(CompilationException.class)
                .hasCauseInstanceOf(UnsupportedConstructException.class)
                .hasMessageContaining("Return statements are not permitted inside control-flow statements.");
    }

    // --- Calls between functions ---

    @Test
    @Tag("unit")
    void callToEarlierFunctionEmitsModuleNode() throws CompilationException {
        // Act
        CompiledModule module = compile(
                "import opset18 as op",
                "def helper(A):",
                "    return op.Neg(A)",
                "def main(X):",
                "    return helper(X)");

        // Assert
        IrFunction main = module.function("main").orElseThrow();
        IrNode call = single(main, "helper");
        assertThat(call.domain()).isEqualTo("this");
        assertThat(call.inputs()).containsExactly("X");
        assertThat(main.calledFunctions()).containsKey("helper");
        assertThat(main.opsetImports()).containsEntry("this", 1);
    }

    @Test
    @Tag("unit")
    void nestedFunctionReadsOuterVariable() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X):",
                "    a = op.Neg(X)",
                "    def g(Y):",
                "        return op.Add(Y, a)",
                "    return g(X)");

        // Assert
        IrNode call = single(f, "g");
        assertThat(call.domain()).isEqualTo("this");
        assertThat(call.inputs()).containsExactly("X");
        assertThat(f.nestedFunctions()).containsKey("g");
        assertThat(f.functionTable()).containsKey("g");
        IrFunction g = f.nestedFunctions().get("g");
        assertThat(single(g, "Add").inputs()).containsExactly("Y", "a");
    }

    @Test
    @Tag("unit")
    void rebindingCapturedVariableBeforeCallFails() {
        assertThatThrownBy(() -> compile(
                "import opset18 as op",
                "def f(X):",
                "    a = op.Neg(X)",
                "    def g(Y):",
                "        return op.Add(Y, a)",
                "    a = op.Abs(X)",
                "    return g(a)"))
                .isInstanceOf(CompilationException.class)
                .hasCauseInstanceOf(CapturedVariableMutationException.class)
                .hasMessageContaining("Outer scope variable 'a' referenced by function 'g' was modified.");
    }

    /**
     * A nested function named as a graph-valued attribute becomes that attribute's subgraph.
     */
    @Test
    @Tag("unit")
    void nestedFunctionAsGraphAttribute() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X, n, c):",
                "    def g(s):",
                "        return op.Add(s, X)",
                "    return op.Loop(n, c, X, body=g)");

        // Assert
        IrNode loop = single(f, "Loop");
        assertThat(loop.inputs()).containsExactly("n", "c", "X");
        IrAttribute body = loop.attribute("body").orElseThrow();
        assertThat(body).isInstanceOf(IrAttribute.GraphAttr.class);
        IrGraph graph = ((IrAttribute.GraphAttr) body).value();
        assertThat(graph.inputs()).extracting(IrValueInfo::name).containsExactly("s");
        assertThat(single(graph.nodes(), "Add").inputs()).containsExactly("s", "X");
    }

    @Test
    @Tag("unit")
    void rebindingCapturedVariableBeforeGraphUseFails() {
        assertThatThrownBy(() -> compile(
                "import opset18 as op",
                "def f(X, n, c):",
                "    a = op.Neg(X)",
                "    def g(s):",
                "        return op.Add(s, a)",
                "    a = op.Abs(X)",
                "    return op.Loop(n, c, a, body=g)"))
                .isInstanceOf(CompilationException.class)
                .hasCauseInstanceOf(CapturedVariableMutationException.class)
                .hasMessageContaining("Outer scope variable 'a' referenced by function 'g' was modified.");
    }

    @Test
    @Tag("unit")
    void duplicateFunctionNameIsRejected() {
        assertThatThrownBy(() -> compile(
                "import opset18 as op",
                "def f(X):",
                "    return op.Neg(X)",
                "def f(X):",
                "    return op.Abs(X)"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Function 'f' already exists.");
    }

    // --- Module level ---

    @Test
    @Tag("unit")
    void moduleConstantIsMaterializedWhereUsed() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "N = 2 * 2",
                "def f(X):",
                "    return op.Add(X, N)");

        // Assert
        assertThat(opTypes(f)).containsExactly("Constant", "CastLike", "Add");
        IrNode constant = single(f, "Constant");
        assertThat(constant.outputs()).containsExactly("N");
        IrAttribute.TensorAttr value = (IrAttribute.TensorAttr) constant.attribute("value").orElseThrow();
        assertThat(value.value().values()).containsExactly(4L);
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Import of module 'numpy' is ignored\\.")
    void foreignImportIsIgnored() throws CompilationException {
        // Act
        CompiledModule module = compile(
                "import numpy as np",
                "import opset18 as op",
                "def f(X):",
                "    return op.Neg(X)");

        // Assert
        assertThat(module.warnings()).hasSize(1);
        assertThat(module.warnings().get(0).lineNumber()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Unknown function name 'Frobnicate'\\. The graph may not work\\.")
    void unknownBareFunctionIsEmittedWithWarning() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "def f(X):",
                "    return Frobnicate(X)");

        // Assert
        assertThat(opTypes(f)).containsExactly("Frobnicate");
    }

    @Test
    @Tag("unit")
    void multiAssignmentIsRejected() {
        assertThatThrownBy(() -> compile(
                "import opset18 as op",
                "def f(X):",
                "    a = b = op.Neg(X)",
                "    return a"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Multi-assignment not supported.");
    }

    @Test
    @Tag("unit")
    void translationIsDeterministic() throws CompilationException {
        // Arrange
        String[] script = {
                "import opset18 as op",
                "def f(X, n, c):",
                "    s = op.Identity(X)",
                "    for i in range(n):",
                "        if c:",
                "            s = s + 1",
                "        else:",
                "            s = s * 2.0",
                "    return s"};

        // Act
        IrFunction first = lastFunction(script);
        IrFunction second = lastFunction(script);

        // Assert
        assertThat(first.nodes()).isEqualTo(second.nodes());
        assertThat(nodes(first.nodes(), "Loop")).hasSize(1);
    }
}

package org.tensorscript.compiler.frontend.irgen;

import org.tensorscript.compiler.api.ArityException;
import org.tensorscript.compiler.api.CompilationException;
import org.tensorscript.compiler.api.EmptyListException;
import org.tensorscript.compiler.api.TypeMismatchException;
import org.tensorscript.compiler.api.UnboundNameException;
import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.ir.IrAttribute;
import org.tensorscript.compiler.ir.IrAttrParameter;
import org.tensorscript.compiler.ir.IrFunction;
import org.tensorscript.compiler.ir.IrNode;
import org.tensorscript.compiler.ir.IrValueInfo;
import org.tensorscript.compiler.types.AttributeType;
import org.tensorscript.junit.extensions.logging.ExpectLog;
import org.tensorscript.junit.extensions.logging.LogLevel;
import org.tensorscript.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tensorscript.compiler.frontend.irgen.ScriptFixtures.lastFunction;
import static org.tensorscript.compiler.frontend.irgen.ScriptFixtures.opTypes;
import static org.tensorscript.compiler.frontend.irgen.ScriptFixtures.single;

/**
 * Tests the lowering of expressions: operator calls, infix operators, literals and attributes.
 * The scripts are compiled through the public compiler entry point.
 */
@ExtendWith(LogWatchExtension.class)
public class ExpressionTranslationTest {

    /**
     * Verifies that a qualified call becomes one node whose output takes the return value name.
     */
    @Test
    @Tag("unit")
    void qualifiedCallBecomesSingleNode() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X, Y):",
                "    return op.Add(X, Y)");

        // Assert
        assertThat(f.nodes()).hasSize(1);
        IrNode add = f.nodes().get(0);
        assertThat(add.domain()).isEmpty();
        assertThat(add.opType()).isEqualTo("Add");
        assertThat(add.inputs()).containsExactly("X", "Y");
        assertThat(add.outputs()).containsExactly("return_val");
        assertThat(f.outputs()).extracting(IrValueInfo::name).containsExactly("return_val");
        assertThat(f.opsetImports()).containsEntry("", 18);
    }

    /**
     * A literal operand becomes a constant node and is cast like the tensor operand it is combined with.
     */
    @Test
    @Tag("unit")
    @DisplayName("Literal operand is cast like its tensor operand")
    void literalOperandIsCastLikeTensorOperand() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "def f(X):",
                "    return X + 1");

        // Assert
        assertThat(opTypes(f)).containsExactly("Constant", "CastLike", "Add");
        IrNode constant = single(f, "Constant");
        assertThat(constant.outputs()).containsExactly("int64_1");
        IrNode cast = single(f, "CastLike");
        assertThat(cast.inputs()).containsExactly("int64_1", "X");
        assertThat(single(f, "Add").inputs()).containsExactly("X", "int64_1_cast");
    }

    @Test
    @Tag("unit")
    void floatModulusUsesFmod() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "def f(X):",
                "    return X % 2.5");

        // Assert
        IrNode mod = single(f, "Mod");
        assertThat(mod.attribute("fmod")).contains(new IrAttribute.IntAttr("fmod", 1L));
    }

    @Test
    @Tag("unit")
    void notEqualIsEqualFollowedByNot() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "def f(X, Y):",
                "    return X != Y");

        // Assert
        assertThat(opTypes(f)).containsExactly("Equal", "Not");
        IrNode not = single(f, "Not");
        assertThat(not.inputs()).containsExactly(single(f, "Equal").outputs().get(0));
        assertThat(not.outputs()).containsExactly("return_val");
    }

    /**
     * A boolean operation over three operands is lowered pairwise, left to right.
     */
    @Test
    @Tag("unit")
    void booleanChainIsLoweredPairwise() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "def f(a, b, c):",
                "    return a and b and c");

        // Assert
        assertThat(opTypes(f)).containsExactly("And", "And");
        IrNode first = f.nodes().get(0);
        IrNode second = f.nodes().get(1);
        assertThat(first.inputs()).containsExactly("a", "b");
        assertThat(second.inputs()).containsExactly(first.outputs().get(0), "c");
        assertThat(second.outputs()).containsExactly("return_val");
    }

    @Test
    @Tag("unit")
    void negationOfLiteralIsFolded() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X):",
                "    y = -2",
                "    return op.Mul(X, y)");

        // Assert
        IrNode constant = single(f, "Constant");
        IrAttribute.TensorAttr value = (IrAttribute.TensorAttr) constant.attribute("value").orElseThrow();
        assertThat(value.value().values()).containsExactly(-2L);
        assertThat(constant.outputs()).containsExactly("y");
        assertThat(opTypes(f)).doesNotContain("Neg");
    }

    @Test
    @Tag("unit")
    void negationOfTensorIsNeg() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "def f(X):",
                "    return -X");

        // Assert
        assertThat(opTypes(f)).containsExactly("Neg");
    }

    @Test
    @Tag("unit")
    void keywordArgumentBecomesAttribute() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X):",
                "    return op.LeakyRelu(X, alpha=0.2)");

        // Assert
        assertThat(single(f, "LeakyRelu").attribute("alpha")).contains(new IrAttribute.FloatAttr("alpha", 0.2));
    }

    /**
     * An attribute parameter passed to an attribute is forwarded as a reference, not as a value.
     */
    @Test
    @Tag("unit")
    void attributeParameterIsForwardedByReference() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X, alpha: float = 0.5):",
                "    return op.LeakyRelu(X, alpha=alpha)");

        // Assert
        assertThat(f.inputs()).extracting(IrValueInfo::name).containsExactly("X");
        assertThat(f.attrParameters()).containsExactly(
                new IrAttrParameter("alpha", AttributeType.FLOAT, new IrAttribute.FloatAttr("alpha", 0.5)));
        assertThat(single(f, "LeakyRelu").attribute("alpha"))
                .contains(new IrAttribute.RefAttr("alpha", "alpha", AttributeType.FLOAT));
    }

    /**
     * An attribute parameter used as a value is materialized by a constant node referencing it.
     */
    @Test
    @Tag("unit")
    void attributeParameterUsedAsValueIsMaterialized() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X, alpha: float):",
                "    return op.Mul(X, alpha)");

        // Assert
        assertThat(opTypes(f)).containsExactly("Constant", "CastLike", "Mul");
        IrNode constant = single(f, "Constant");
        assertThat(constant.attribute("value_float"))
                .contains(new IrAttribute.RefAttr("value_float", "alpha", AttributeType.FLOAT));
        assertThat(single(f, "Mul").inputs()).containsExactly("X", "alpha_cast");
    }

    @Test
    @Tag("unit")
    void attributeParameterOfWrongTypeIsRejected() {
        assertThatThrownBy(() -> lastFunction(
                "import opset18 as op",
                "def f(X, k: int):",
                "    return op.LeakyRelu(X, alpha=k)"))
                .isInstanceOf(CompilationException.class)
                .hasCauseInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("expects type float");
    }

    /**
     * An operator missing from the opset is still emitted, with a warning.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*'Frobnicate' is not a known operator.*")
    void unknownOperatorIsEmittedWithWarning() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X):",
                "    return op.Frobnicate(X, mode='fast')");

        // Assert
        IrNode node = single(f, "Frobnicate");
        assertThat(node.inputs()).containsExactly("X");
        assertThat(node.attribute("mode")).contains(new IrAttribute.StringAttr("mode", "fast"));
    }

    @Test
    @Tag("unit")
    void floorDivisionIsRejected() {
        assertThatThrownBy(() -> lastFunction(
                "def f(X):",
                "    return X // 2"))
                .isInstanceOf(CompilationException.class)
                .hasCauseInstanceOf(UnsupportedConstructException.class)
                .hasMessageContaining("Unsupported operator '//'.");
    }

    @Test
    @Tag("unit")
    void chainedComparisonIsRejected() {
        assertThatThrownBy(() -> lastFunction(
                "def f(a, b, c):",
                "    return a < b < c"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Chained comparisons are not supported.");
    }

    /**
     * The error message carries the position and the enclosing function.
     */
    @Test
    @Tag("unit")
    void unboundNameIsReportedWithPosition() {
        assertThatThrownBy(() -> lastFunction(
                "import opset18 as op",
                "def f(X):",
                "    return op.Add(X, Z)"))
                .isInstanceOf(CompilationException.class)
                .hasCauseInstanceOf(UnboundNameException.class)
                .hasMessageStartingWith("test.py:3:")
                .hasMessageContaining("in function 'f'")
                .hasMessageContaining("Unbound name: 'Z'.");
    }

    @Test
    @Tag("unit")
    void tooManyPositionalArgumentsIsArityError() {
        assertThatThrownBy(() -> lastFunction(
                "import opset18 as op",
                "def f(X):",
                "    return op.Relu(X, X)"))
                .isInstanceOf(CompilationException.class)
                .hasCauseInstanceOf(ArityException.class)
                .hasMessageContaining("Too many positional arguments in call of 'Relu'");
    }

    @Test
    @Tag("unit")
    void emptyListLiteralIsRejected() {
        assertThatThrownBy(() -> lastFunction(
                "import opset18 as op",
                "def f(X):",
                "    return op.Add(X, [])"))
                .isInstanceOf(CompilationException.class)
                .hasCauseInstanceOf(EmptyListException.class);
    }

    @Test
    @Tag("unit")
    void mixingTwoOpsetsIsRejected() {
        assertThatThrownBy(() -> lastFunction(
                "import opset18 as op",
                "import opset15 as op15",
                "def f(X):",
                "    a = op.Relu(X)",
                "    return op15.Relu(a)"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Two distinct opsets were used");
    }

    /**
     * Optional inputs omitted in the middle of the argument list are kept as empty names.
     */
    @Test
    @Tag("unit")
    void omittedOptionalInputIsEmptyName() throws CompilationException {
        // Act
        IrFunction f = lastFunction(
                "import opset18 as op",
                "def f(X, s, e, st):",
                "    return op.Slice(X, s, e, None, st)");

        // Assert
        assertThat(single(f, "Slice").inputs()).containsExactly("X", "s", "e", "", "st");
    }
}

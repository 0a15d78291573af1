package org.tensorscript.compiler.frontend.semantics;

import org.tensorscript.compiler.diagnostics.DiagnosticsEngine;
import org.tensorscript.compiler.frontend.lexer.Lexer;
import org.tensorscript.compiler.frontend.parser.Parser;
import org.tensorscript.compiler.frontend.parser.ast.ForNode;
import org.tensorscript.compiler.frontend.parser.ast.FunctionDefNode;
import org.tensorscript.compiler.frontend.parser.ast.StmtNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LivenessAnalyzer}: live-out sets, assigned names, upward-exposed uses
 * and free variables of nested functions.
 */
public class LivenessAnalyzerTest {

    private static FunctionDefNode function(String... lines) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<StmtNode> ast = new Parser(new Lexer(String.join("\n", lines), diagnostics).scanTokens(), diagnostics).parse();
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return (FunctionDefNode) ast.get(0);
    }

    @Test
    @Tag("unit")
    void straightLineLiveOutDropsDeadValues() {
        // Arrange
        FunctionDefNode f = function(
                "def f(X):",
                "    a = op.Neg(X)",
                "    b = op.Abs(a)",
                "    c = op.Exp(X)",
                "    return b");

        // Act
        LivenessAnalyzer liveness = new LivenessAnalyzer().analyze(f);

        // Assert
        assertThat(liveness.liveOut(f.body().get(0))).containsExactlyInAnyOrder("X", "a");
        assertThat(liveness.liveOut(f.body().get(1))).containsExactlyInAnyOrder("X", "b");
        assertThat(liveness.liveOut(f.body().get(2))).containsExactly("b");
    }

    @Test
    @Tag("unit")
    void conditionalLiveOutOnlyHoldsValuesUsedAfterwards() {
        // Arrange
        FunctionDefNode f = function(
                "def f(X, c):",
                "    if c:",
                "        y = op.Neg(X)",
                "        t = op.Abs(X)",
                "    else:",
                "        y = op.Abs(X)",
                "    return y");

        // Act
        LivenessAnalyzer liveness = new LivenessAnalyzer().analyze(f);

        // Assert
        assertThat(liveness.liveOut(f.body().get(0))).containsExactly("y");
        assertThat(liveness.assignedNames(List.of(f.body().get(0)))).containsExactly("y", "t");
    }

    /**
     * Loop-carried values stay live before the loop, and the loop variable is counted as assigned.
     */
    @Test
    @Tag("unit")
    void loopCarriedValuesAreLiveBeforeTheLoop() {
        // Arrange
        FunctionDefNode f = function(
                "def f(X, n):",
                "    s = op.Identity(X)",
                "    for i in range(n):",
                "        s = op.Add(s, X)",
                "    return s");
        ForNode loop = (ForNode) f.body().get(1);

        // Act
        LivenessAnalyzer liveness = new LivenessAnalyzer().analyze(f);

        // Assert
        assertThat(liveness.liveOut(f.body().get(0))).contains("s", "X", "n");
        assertThat(liveness.liveOut(loop)).containsExactly("s");
        assertThat(liveness.exposedUses(loop.body())).containsExactlyInAnyOrder("s", "X");
        assertThat(liveness.assignedNames(List.of(loop))).containsExactly("i", "s");
    }

    @Test
    @Tag("unit")
    void whileConditionIsLiveAcrossIterations() {
        // Arrange
        FunctionDefNode f = function(
                "def f(X, c):",
                "    s = op.Identity(X)",
                "    while c:",
                "        s = op.Add(s, X)",
                "        c = op.Less(s, X)",
                "    return s");

        // Act
        LivenessAnalyzer liveness = new LivenessAnalyzer().analyze(f);

        // Assert
        assertThat(liveness.liveOut(f.body().get(0))).contains("s", "X", "c");
        assertThat(liveness.liveOut(f.body().get(1))).containsExactly("s");
    }

    /**
     * The callee of a call is not a read; only the outer values a nested function body reads are free.
     */
    @Test
    @Tag("unit")
    void freeVariablesOfNestedFunction() {
        // Arrange
        FunctionDefNode f = function(
                "def f(X):",
                "    a = op.Neg(X)",
                "    def g(Y):",
                "        return op.Add(Y, a)",
                "    return g(X)");
        FunctionDefNode g = (FunctionDefNode) f.body().get(1);

        // Act
        LivenessAnalyzer liveness = new LivenessAnalyzer().analyze(f);

        // Assert
        assertThat(liveness.freeVariables(g)).containsExactly("a");
    }

    @Test
    @Tag("unit")
    void unanalyzedStatementReportsItsAssignedNames() {
        // Arrange
        FunctionDefNode f = function(
                "def f(X):",
                "    y = op.Neg(X)",
                "    return y");

        // Act
        LivenessAnalyzer liveness = new LivenessAnalyzer();

        // Assert
        assertThat(liveness.liveOut(f.body().get(0))).containsExactly("y");
    }
}

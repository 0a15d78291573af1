package org.tensorscript.compiler.frontend.semantics;

import org.tensorscript.compiler.frontend.parser.ast.FunctionDefNode;
import org.tensorscript.compiler.frontend.parser.ast.StmtNode;

import java.util.List;
import java.util.Set;

/**
 * Def-use facts the control-flow lowering relies on. All returned sets iterate in source order
 * of first assignment where that order is meaningful.
 */
public interface LivenessOracle {

    /**
     * @param statements A block.
     * @return The names assigned anywhere in the block, including nested branches and loop bodies.
     */
    Set<String> assignedNames(List<StmtNode> statements);

    /**
     * @param statement A statement.
     * @return The names the statement assigns.
     */
    default Set<String> assignedNames(StmtNode statement) {
        return assignedNames(List.of(statement));
    }

    /**
     * @param statement A statement of the analyzed function.
     * @return The names whose values are still needed after the statement.
     */
    Set<String> liveOut(StmtNode statement);

    /**
     * @param statements A block.
     * @return The names the block reads before assigning them.
     */
    Set<String> exposedUses(List<StmtNode> statements);

    /**
     * @param function A nested function definition.
     * @return The names the function reads but neither assigns nor declares as parameters.
     */
    Set<String> freeVariables(FunctionDefNode function);
}

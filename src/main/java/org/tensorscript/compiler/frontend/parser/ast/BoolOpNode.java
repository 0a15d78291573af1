package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A chain of {@code and} or {@code or} with at least two operands.
 *
 * @param op Either {@link Operator#AND} or {@link Operator#OR}.
 * @param values The operands in source order.
 * @param source The position of the expression.
 */
public record BoolOpNode(Operator op, List<ExprNode> values, SourceInfo source) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(values);
    }
}

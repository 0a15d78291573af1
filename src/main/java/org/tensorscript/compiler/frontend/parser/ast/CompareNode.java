package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A comparison. Chained comparisons such as {@code a < b < c} keep all operators.
 *
 * @param left The leftmost operand.
 * @param ops The comparison operators.
 * @param comparators The right-hand operands, one per operator.
 * @param source The position of the expression.
 */
public record CompareNode(ExprNode left, List<Operator> ops, List<ExprNode> comparators, SourceInfo source) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return Children.of().add(left).addAll(comparators).build();
    }
}

package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A binary arithmetic or bitwise operation.
 *
 * @param left The left operand.
 * @param op The operator.
 * @param right The right operand.
 * @param source The position of the expression.
 */
public record BinaryOpNode(ExprNode left, Operator op, ExprNode right, SourceInfo source) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}

package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A unary operation: {@code -x}, {@code +x} or {@code not x}.
 *
 * @param op The operator.
 * @param operand The operand.
 * @param source The position of the expression.
 */
public record UnaryOpNode(Operator op, ExprNode operand, SourceInfo source) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}

package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * An assignment statement. {@code a = b = x} has two targets.
 *
 * @param targets The assignment targets, a {@link NameNode} or a {@link TupleNode} each.
 * @param value The assigned expression.
 * @param source The position of the statement.
 */
public record AssignNode(List<ExprNode> targets, ExprNode value, SourceInfo source) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return Children.of().addAll(targets).add(value).build();
    }
}

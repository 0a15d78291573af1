package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A counting loop {@code for target in iter:}.
 *
 * @param target The loop variable expression.
 * @param iter The iterated expression, normally {@code range(n)}.
 * @param body The loop body.
 * @param source The position of the statement.
 */
public record ForNode(ExprNode target, ExprNode iter, List<StmtNode> body, SourceInfo source) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return Children.of().add(target).add(iter).addAll(body).build();
    }
}

package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A conditional loop {@code while test:}.
 *
 * @param test The loop condition.
 * @param body The loop body.
 * @param source The position of the statement.
 */
public record WhileNode(ExprNode test, List<StmtNode> body, SourceInfo source) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return Children.of().add(test).addAll(body).build();
    }
}

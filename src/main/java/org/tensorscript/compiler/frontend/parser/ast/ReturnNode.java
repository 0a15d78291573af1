package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A return statement. A tuple value returns several outputs.
 *
 * @param value The returned expression, or {@code null} for a bare {@code return}.
 * @param source The position of the statement.
 */
public record ReturnNode(ExprNode value, SourceInfo source) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return Children.of().add(value).build();
    }
}

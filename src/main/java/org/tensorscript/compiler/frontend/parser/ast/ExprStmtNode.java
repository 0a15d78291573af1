package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * An expression used as a statement, e.g. a doc string or a {@code print(...)} call.
 *
 * @param value The expression.
 * @param source The position of the statement.
 */
public record ExprStmtNode(ExprNode value, SourceInfo source) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    /**
     * @return {@code true} if the expression is a string literal.
     */
    public boolean isDocString() {
        return value instanceof ConstantNode c && c.value() instanceof String;
    }

    /**
     * @return {@code true} if the expression is a call of {@code print}.
     */
    public boolean isPrintCall() {
        return value instanceof CallNode call && call.func() instanceof NameNode n && "print".equals(n.id());
    }
}

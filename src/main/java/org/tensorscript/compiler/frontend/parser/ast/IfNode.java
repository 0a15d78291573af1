package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A conditional statement. An {@code elif} chain is represented as a nested
 * {@link IfNode} that forms the whole else-block.
 *
 * @param test The condition.
 * @param body The then-block.
 * @param orelse The else-block, possibly empty.
 * @param source The position of the statement.
 */
public record IfNode(ExprNode test, List<StmtNode> body, List<StmtNode> orelse, SourceInfo source) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return Children.of().add(test).addAll(body).addAll(orelse).build();
    }
}

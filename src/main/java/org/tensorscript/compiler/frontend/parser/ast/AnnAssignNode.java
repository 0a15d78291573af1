package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * An annotated assignment {@code x: FLOAT[N] = expr}.
 *
 * @param target The assigned name.
 * @param annotation The type annotation.
 * @param value The assigned expression.
 * @param source The position of the statement.
 */
public record AnnAssignNode(NameNode target, ExprNode annotation, ExprNode value, SourceInfo source) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, annotation, value);
    }
}

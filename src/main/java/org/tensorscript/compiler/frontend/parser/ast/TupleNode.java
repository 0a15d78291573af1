package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A tuple display, e.g. the right-hand side of {@code a, b = x, y}.
 *
 * @param elements The elements.
 * @param source The position of the tuple.
 */
public record TupleNode(List<ExprNode> elements, SourceInfo source) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }
}

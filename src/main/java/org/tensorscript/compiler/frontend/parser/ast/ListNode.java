package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A list display {@code [a, b, c]}.
 *
 * @param elements The elements.
 * @param source The position of the list.
 */
public record ListNode(List<ExprNode> elements, SourceInfo source) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }
}

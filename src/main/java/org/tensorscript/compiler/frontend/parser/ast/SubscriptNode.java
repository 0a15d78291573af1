package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * An indexing expression {@code value[index]}. A multi-axis index is a {@link TupleNode}.
 *
 * @param value The indexed expression.
 * @param index The index: a {@link SliceNode}, a {@link TupleNode} or any expression.
 * @param source The position of the expression.
 */
public record SubscriptNode(ExprNode value, ExprNode index, SourceInfo source) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value, index);
    }

    /**
     * @return The per-axis index elements.
     */
    public List<ExprNode> indexElements() {
        if (index instanceof TupleNode t) return t.elements();
        return List.of(index);
    }
}

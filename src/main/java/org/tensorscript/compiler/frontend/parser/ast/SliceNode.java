package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A slice {@code lower:upper:step}; each part may be absent ({@code null}).
 *
 * @param lower The start, or {@code null}.
 * @param upper The stop, or {@code null}.
 * @param step The step, or {@code null}.
 * @param source The position of the slice.
 */
public record SliceNode(ExprNode lower, ExprNode upper, ExprNode step, SourceInfo source) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return Children.of().add(lower).add(upper).add(step).build();
    }

    /**
     * @return {@code true} for a bare {@code :} or {@code ::}.
     */
    public boolean isFull() {
        return lower == null && upper == null && step == null;
    }
}

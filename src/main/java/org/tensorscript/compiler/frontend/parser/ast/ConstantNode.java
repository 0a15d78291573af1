package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

/**
 * An AST node that represents a literal: an integer ({@link Long}), a float ({@link Double}),
 * a {@link Boolean}, a {@link String} or {@code None} (a {@code null} value).
 *
 * @param value The literal value.
 * @param source The position of the literal.
 */
public record ConstantNode(Object value, SourceInfo source) implements ExprNode {
    // This node has no children and inherits the empty list from getChildren().
}

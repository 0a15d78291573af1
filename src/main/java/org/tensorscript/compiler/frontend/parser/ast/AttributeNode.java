package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * An attribute access such as {@code op.Add}.
 *
 * @param value The expression whose attribute is accessed.
 * @param attr The attribute name.
 * @param source The position of the expression.
 */
public record AttributeNode(ExprNode value, String attr, SourceInfo source) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    /**
     * Returns the dotted path of this access if it only consists of names, e.g. {@code "math.pi"}.
     * @return The dotted path, or {@code null} if the base is not a plain name chain.
     */
    public String dottedPath() {
        if (value instanceof NameNode n) return n.id() + "." + attr;
        if (value instanceof AttributeNode a) {
            String prefix = a.dottedPath();
            return prefix == null ? null : prefix + "." + attr;
        }
        return null;
    }
}

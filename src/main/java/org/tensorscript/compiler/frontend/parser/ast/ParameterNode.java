package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A formal parameter of a function definition.
 *
 * @param name The parameter name.
 * @param annotation The type annotation, or {@code null}.
 * @param defaultValue The default value expression, or {@code null}.
 * @param source The position of the parameter.
 */
public record ParameterNode(String name, ExprNode annotation, ExprNode defaultValue, SourceInfo source) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return Children.of().add(annotation).add(defaultValue).build();
    }
}

package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A function definition, at module level or nested inside another function.
 *
 * @param name The function name.
 * @param parameters The formal parameters in declaration order.
 * @param returns The return annotation, or {@code null}.
 * @param body The function body.
 * @param source The position of the {@code def} keyword.
 */
public record FunctionDefNode(
        String name,
        List<ParameterNode> parameters,
        ExprNode returns,
        List<StmtNode> body,
        SourceInfo source
) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return Children.of().addAll(parameters).add(returns).addAll(body).build();
    }

    /**
     * @return The doc string if the first statement is a string literal, otherwise {@code null}.
     */
    public String docString() {
        if (!body.isEmpty() && body.get(0) instanceof ExprStmtNode e && e.isDocString()) {
            return (String) ((ConstantNode) e.value()).value();
        }
        return null;
    }
}

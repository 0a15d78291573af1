package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;

/**
 * A call expression.
 *
 * @param func The callee expression.
 * @param args The positional arguments.
 * @param keywords The keyword arguments, in source order.
 * @param source The position of the call.
 */
public record CallNode(ExprNode func, List<ExprNode> args, List<KeywordArg> keywords, SourceInfo source) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return Children.of()
                .add(func)
                .addAll(args)
                .addAll(keywords.stream().map(KeywordArg::value).toList())
                .build();
    }
}

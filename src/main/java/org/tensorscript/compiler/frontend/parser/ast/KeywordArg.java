package org.tensorscript.compiler.frontend.parser.ast;

/**
 * A keyword argument {@code name=value} of a call.
 *
 * @param name The keyword.
 * @param value The argument expression.
 */
public record KeywordArg(String name, ExprNode value) {
}

package org.tensorscript.compiler.frontend.parser.ast;

/**
 * Marker for AST nodes that denote an expression.
 */
public interface ExprNode extends AstNode {
}

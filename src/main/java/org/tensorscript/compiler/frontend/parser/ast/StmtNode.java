package org.tensorscript.compiler.frontend.parser.ast;

/**
 * Marker for AST nodes that denote a statement.
 */
public interface StmtNode extends AstNode {
}

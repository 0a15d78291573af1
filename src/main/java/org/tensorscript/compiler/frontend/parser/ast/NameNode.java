package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

/**
 * An AST node that represents a reference to a name.
 *
 * @param id The referenced name.
 * @param source The position of the name.
 */
public record NameNode(String id, SourceInfo source) implements ExprNode {
}

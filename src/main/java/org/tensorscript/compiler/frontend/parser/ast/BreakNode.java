package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

/**
 * A {@code break} statement.
 *
 * @param source The position of the statement.
 */
public record BreakNode(SourceInfo source) implements StmtNode {
}

package org.tensorscript.compiler.frontend.parser.ast;

import org.tensorscript.compiler.api.SourceInfo;

/**
 * A module-level {@code import module [as alias]} statement.
 *
 * @param module The imported module name, e.g. {@code opset18}.
 * @param alias The bound name; the last segment of the module name if no alias is given.
 * @param source The position of the statement.
 */
public record ImportNode(String module, String alias, SourceInfo source) implements StmtNode {
}

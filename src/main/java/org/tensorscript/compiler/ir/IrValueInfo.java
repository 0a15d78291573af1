package org.tensorscript.compiler.ir;

import org.tensorscript.compiler.types.TensorType;

/**
 * A declared input or output of a graph.
 *
 * @param name The value name.
 * @param type The declared type, or {@code null} if unknown.
 */
public record IrValueInfo(String name, TensorType type) {}

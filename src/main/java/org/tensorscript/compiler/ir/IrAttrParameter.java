package org.tensorscript.compiler.ir;

import org.tensorscript.compiler.types.AttributeType;

/**
 * A compile-time attribute parameter of a function.
 *
 * @param name The parameter name.
 * @param type The attribute type.
 * @param defaultValue The default value, or {@code null} if the parameter has none.
 */
public record IrAttrParameter(String name, AttributeType type, IrAttribute defaultValue) {}

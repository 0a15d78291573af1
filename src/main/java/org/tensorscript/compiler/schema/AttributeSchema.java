package org.tensorscript.compiler.schema;

import org.tensorscript.compiler.types.AttributeType;

/**
 * A declared attribute of an operator.
 *
 * @param name The attribute name.
 * @param type The attribute type.
 * @param required Whether a value must be supplied.
 * @param defaultValue The default value, or {@code null}.
 */
public record AttributeSchema(String name, AttributeType type, boolean required, Object defaultValue) {
}

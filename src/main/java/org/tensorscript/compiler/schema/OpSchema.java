package org.tensorscript.compiler.schema;

import java.util.List;
import java.util.Optional;

/**
 * The declared signature of an operator: formal inputs in order and named attributes.
 *
 * @param name The operator name.
 * @param domain The operator domain.
 * @param sinceVersion The first opset version this signature applies to.
 * @param inputs The formal inputs in order.
 * @param attributes The declared attributes in declaration order.
 */
public record OpSchema(
        String name,
        String domain,
        int sinceVersion,
        List<FormalParameter> inputs,
        List<AttributeSchema> attributes
) {

    public OpSchema {
        inputs = List.copyOf(inputs);
        attributes = List.copyOf(attributes);
    }

    /**
     * @param attributeName The attribute name.
     * @return The attribute declaration, or empty if the operator has no such attribute.
     */
    public Optional<AttributeSchema> attribute(String attributeName) {
        return attributes.stream().filter(a -> a.name().equals(attributeName)).findFirst();
    }

    /**
     * @param inputName The input name.
     * @return The position of the formal input, or -1 if there is none.
     */
    public int inputIndex(String inputName) {
        for (int i = 0; i < inputs.size(); i++) {
            if (inputs.get(i).name().equals(inputName)) return i;
        }
        return -1;
    }
}

package org.tensorscript.compiler.ir;

import org.tensorscript.compiler.api.SourceInfo;

import java.util.List;
import java.util.Optional;

/**
 * A single operator invocation in a graph. An omitted optional input is the empty string.
 *
 * @param domain The operator domain.
 * @param opType The operator name.
 * @param inputs The input value names in order.
 * @param outputs The output value names in order.
 * @param attributes The attributes in emission order.
 * @param source The script position that produced the node.
 */
public record IrNode(
        String domain,
        String opType,
        List<String> inputs,
        List<String> outputs,
        List<IrAttribute> attributes,
        SourceInfo source
) {

    public IrNode {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        attributes = List.copyOf(attributes);
    }

    /**
     * @param name The attribute name.
     * @return The attribute, or empty if the node has none of that name.
     */
    public Optional<IrAttribute> attribute(String name) {
        return attributes.stream().filter(a -> a.name().equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return String.join(", ", outputs) + " = " + (domain.isEmpty() ? "" : domain + ".") + opType
                + "(" + String.join(", ", inputs) + ")";
    }
}

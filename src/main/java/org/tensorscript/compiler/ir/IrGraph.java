package org.tensorscript.compiler.ir;

import java.util.List;

/**
 * An immutable graph: the body of a function or of a control-flow branch.
 *
 * @param name The graph name.
 * @param inputs The declared inputs.
 * @param outputs The declared outputs.
 * @param nodes The nodes in topological (emission) order.
 * @param docString The doc string, or {@code null}.
 */
public record IrGraph(
        String name,
        List<IrValueInfo> inputs,
        List<IrValueInfo> outputs,
        List<IrNode> nodes,
        String docString
) {
    public IrGraph {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        nodes = List.copyOf(nodes);
    }
}

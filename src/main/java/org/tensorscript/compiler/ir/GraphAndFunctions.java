package org.tensorscript.compiler.ir;

import java.util.Map;

/**
 * A graph together with every function it calls or nests, keyed by function name.
 *
 * @param graph The graph.
 * @param functions The functions referenced from the graph or its subgraphs.
 */
public record GraphAndFunctions(IrGraph graph, Map<String, IrFunction> functions) {}

package org.tensorscript.compiler.ir;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.schema.Opset;
import org.tensorscript.compiler.types.AttributeType;
import org.tensorscript.compiler.types.TensorType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles functions and subgraphs. Registered functions form the function table of the script module.
 */
public final class IrBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(IrBuilder.class);

    private final Map<String, IrFunction> functions = new LinkedHashMap<>();

    /**
     * Creates a new function.
     * @param name The function name.
     * @param domain The function domain.
     * @param register Whether to register the function in the module function table.
     * @return The new, empty function.
     * @throws IllegalArgumentException if a registered function of that name already exists.
     */
    public IrFunction newFunction(String name, String domain, boolean register) {
        IrFunction function = new IrFunction(name, domain);
        if (register) {
            if (functions.containsKey(name)) {
                throw new IllegalArgumentException("Function '" + name + "' already exists.");
            }
            functions.put(name, function);
        }
        return function;
    }

    /**
     * @return The registered functions in registration order.
     */
    public Map<String, IrFunction> functions() {
        return Collections.unmodifiableMap(functions);
    }

    public void addDocString(IrFunction function, String docString) {
        function.setDocString(docString);
    }

    public void addInput(IrFunction function, String name, TensorType type) {
        function.addInput(new IrValueInfo(name, type));
    }

    public void addOutput(IrFunction function, String name, TensorType type) {
        function.addOutput(new IrValueInfo(name, type));
    }

    /**
     * Declares an attribute parameter.
     * @param function The function.
     * @param name The parameter name.
     * @param type The attribute type.
     * @param defaultValue The default value as a Java value, or {@code null}.
     */
    public void addAttrParameter(IrFunction function, String name, AttributeType type, Object defaultValue) {
        IrAttribute defaultAttr = defaultValue == null ? null : IrAttribute.of(name, defaultValue, type);
        function.addAttrParameter(new IrAttrParameter(name, type, defaultAttr));
    }

    /**
     * Appends a node to a function.
     * @param function The function receiving the node.
     * @param opset The opset of the operator.
     * @param opType The operator name.
     * @param inputs The input names.
     * @param outputs The output names.
     * @param attributes The attributes.
     * @param subFunctions Functions referenced from subgraph attributes, hoisted into the function table.
     * @param source The originating script position.
     * @return The appended node.
     */
    public IrNode addNode(IrFunction function, Opset opset, String opType, List<String> inputs, List<String> outputs,
                          List<IrAttribute> attributes, Map<String, IrFunction> subFunctions, SourceInfo source) {
        IrNode node = new IrNode(opset.domain(), opType, inputs, outputs, attributes, source);
        function.addNode(node);
        function.addOpsetImport(opset);
        subFunctions.values().forEach(function::addCalledFunction);
        LOG.debug("{}: {}", function.name(), node);
        return node;
    }

    /**
     * Records the opsets of a subgraph in its enclosing function, so the function imports
     * every domain its graph attributes use.
     * @param into The enclosing function.
     * @param from The subgraph.
     */
    public void inheritOpsetImports(IrFunction into, IrFunction from) {
        from.opsetImports().forEach((domain, version) -> into.addOpsetImport(new Opset(domain, version)));
    }

    public IrAttribute makeAttribute(String name, Object value, AttributeType expected) {
        return IrAttribute.of(name, value, expected);
    }

    public IrAttribute makeAttributeRef(String name, String refAttrName, AttributeType type) {
        return new IrAttribute.RefAttr(name, refAttrName, type);
    }
}

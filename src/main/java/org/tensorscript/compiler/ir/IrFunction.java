package org.tensorscript.compiler.ir;

import org.tensorscript.compiler.schema.AttributeSchema;
import org.tensorscript.compiler.schema.FormalParameter;
import org.tensorscript.compiler.schema.OpSchema;
import org.tensorscript.compiler.schema.Opset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A function or subgraph under construction.
 * <p>
 * The same type is used for top-level script functions, nested functions and the bodies of
 * control-flow statements. It tracks every name its own nodes assign so that reconciliation can
 * tell a value produced inside the block from one merely visible from an outer block.
 */
public final class IrFunction {

    private final String name;
    private final String domain;
    private final List<IrValueInfo> inputs = new ArrayList<>();
    private final List<IrValueInfo> outputs = new ArrayList<>();
    private final List<IrAttrParameter> attrParameters = new ArrayList<>();
    private final List<IrNode> nodes = new ArrayList<>();
    private final Set<String> assignedNames = new LinkedHashSet<>();
    private final Map<String, Integer> opsetImports = new LinkedHashMap<>();
    private final Map<String, IrFunction> calledFunctions = new LinkedHashMap<>();
    private final Map<String, IrFunction> nestedFunctions = new LinkedHashMap<>();
    private String docString;

    /**
     * Creates an empty function.
     * @param name The function or subgraph name.
     * @param domain The domain the function is registered in.
     */
    public IrFunction(String name, String domain) {
        this.name = name;
        this.domain = domain;
    }

    public String name() {
        return name;
    }

    public String domain() {
        return domain;
    }

    public List<IrValueInfo> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<IrValueInfo> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    public List<IrAttrParameter> attrParameters() {
        return Collections.unmodifiableList(attrParameters);
    }

    public List<IrNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * @return The names assigned by nodes of this function, in emission order.
     */
    public Set<String> assignedNames() {
        return Collections.unmodifiableSet(assignedNames);
    }

    /**
     * @return The opsets used by this function, domain to version.
     */
    public Map<String, Integer> opsetImports() {
        return Collections.unmodifiableMap(opsetImports);
    }

    public Map<String, IrFunction> calledFunctions() {
        return Collections.unmodifiableMap(calledFunctions);
    }

    public Map<String, IrFunction> nestedFunctions() {
        return Collections.unmodifiableMap(nestedFunctions);
    }

    public String docString() {
        return docString;
    }

    void setDocString(String docString) {
        this.docString = docString;
    }

    void addInput(IrValueInfo input) {
        inputs.add(input);
    }

    void addOutput(IrValueInfo output) {
        outputs.add(output);
    }

    void addAttrParameter(IrAttrParameter parameter) {
        attrParameters.add(parameter);
    }

    void addNode(IrNode node) {
        nodes.add(node);
        assignedNames.addAll(node.outputs());
    }

    void addOpsetImport(Opset opset) {
        opsetImports.putIfAbsent(opset.domain(), opset.version());
    }

    /**
     * Records a script function called from this function, directly or from one of its subgraphs.
     * @param function The called function.
     */
    public void addCalledFunction(IrFunction function) {
        calledFunctions.putIfAbsent(function.name(), function);
    }

    /**
     * Records a function defined inside this function.
     * @param function The nested function.
     */
    public void addNestedFunction(IrFunction function) {
        nestedFunctions.put(function.name(), function);
    }

    /**
     * @param valueName A value name.
     * @return {@code true} if a node of this function assigns the name.
     */
    public boolean isAssigned(String valueName) {
        return assignedNames.contains(valueName);
    }

    /**
     * @param valueName A value name.
     * @return {@code true} if the name is a declared input of this function.
     */
    public boolean isInput(String valueName) {
        return inputs.stream().anyMatch(i -> i.name().equals(valueName));
    }

    /**
     * @param valueName A value name.
     * @return {@code true} if the name is already a declared output of this function.
     */
    public boolean hasOutput(String valueName) {
        return outputs.stream().anyMatch(o -> o.name().equals(valueName));
    }

    /**
     * @return The function table: every function called or nested in this function.
     */
    public Map<String, IrFunction> functionTable() {
        Map<String, IrFunction> table = new LinkedHashMap<>(calledFunctions);
        table.putAll(nestedFunctions);
        return table;
    }

    /**
     * @return An immutable snapshot of this function as a graph.
     */
    public IrGraph toGraph() {
        return new IrGraph(name, inputs, outputs, nodes, docString);
    }

    /**
     * @return The graph together with all functions it references, transitively.
     */
    public GraphAndFunctions toGraphAndFunctions() {
        Map<String, IrFunction> all = new LinkedHashMap<>();
        collectFunctions(this, all);
        return new GraphAndFunctions(toGraph(), Collections.unmodifiableMap(all));
    }

    private static void collectFunctions(IrFunction function, Map<String, IrFunction> into) {
        for (IrFunction f : function.functionTable().values()) {
            if (into.putIfAbsent(f.name(), f) == null) {
                collectFunctions(f, into);
            }
        }
    }

    /**
     * Derives the call signature of this function: its inputs in order and its attribute parameters.
     * Typed inputs become concrete types; each untyped input gets its own type variable.
     * @return The signature as an operator schema.
     */
    public OpSchema toSchema() {
        List<FormalParameter> formals = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            IrValueInfo input = inputs.get(i);
            String typeStr = input.type() == null ? "T" + i : input.type().elementType().tensorTypeString();
            formals.add(FormalParameter.single(input.name(), typeStr));
        }
        List<AttributeSchema> attributes = attrParameters.stream()
                .map(p -> new AttributeSchema(p.name(), p.type(), p.defaultValue() == null, null))
                .toList();
        return new OpSchema(name, domain, 1, formals, attributes);
    }

    @Override
    public String toString() {
        return "IrFunction[" + domain + "." + name + ", " + nodes.size() + " nodes]";
    }
}

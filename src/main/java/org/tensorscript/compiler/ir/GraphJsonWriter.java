package org.tensorscript.compiler.ir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.tensorscript.compiler.api.CompiledModule;
import org.tensorscript.compiler.types.TensorType;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

/**
 * Serializes modules, functions and graphs into the JSON interchange form.
 * <p>
 * Subgraphs are written inline under the attribute that holds them; function tables
 * list the names of the referenced functions, whose bodies appear once at module level.
 */
public final class GraphJsonWriter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    /**
     * @param prettyPrint Whether to indent the output.
     */
    public GraphJsonWriter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = new ObjectMapper();
        if (prettyPrint) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    /**
     * Converts a compiled module into its JSON tree.
     * @param module The module.
     * @return The JSON tree.
     */
    public ObjectNode toJson(CompiledModule module) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode opset = root.putObject("opset");
        opset.put("domain", module.moduleOpset().domain());
        opset.put("version", module.moduleOpset().version());
        ArrayNode functions = root.putArray("functions");
        for (IrFunction function : module.functions()) {
            functions.add(toJson(function));
        }
        return root;
    }

    /**
     * Converts a function into its JSON tree.
     * @param function The function.
     * @return The JSON tree.
     */
    public ObjectNode toJson(IrFunction function) {
        ObjectNode json = mapper.createObjectNode();
        json.put("name", function.name());
        json.put("domain", function.domain());
        if (function.docString() != null) {
            json.put("docString", function.docString());
        }
        ArrayNode imports = json.putArray("opsetImports");
        for (Map.Entry<String, Integer> entry : function.opsetImports().entrySet()) {
            imports.addObject().put("domain", entry.getKey()).put("version", entry.getValue());
        }
        json.set("inputs", valueInfos(function.inputs()));
        json.set("outputs", valueInfos(function.outputs()));
        ArrayNode attrParams = json.putArray("attributeParameters");
        for (IrAttrParameter p : function.attrParameters()) {
            ObjectNode param = attrParams.addObject();
            param.put("name", p.name());
            param.put("type", p.type().schemaName());
            if (p.defaultValue() != null) {
                param.set("default", attribute(p.defaultValue()));
            }
        }
        json.set("nodes", nodes(function.toGraph()));
        ArrayNode table = json.putArray("functions");
        function.toGraphAndFunctions().functions().keySet().forEach(table::add);
        return json;
    }

    /**
     * Converts a graph into its JSON tree.
     * @param graph The graph.
     * @return The JSON tree.
     */
    public ObjectNode toJson(IrGraph graph) {
        ObjectNode json = mapper.createObjectNode();
        json.put("name", graph.name());
        if (graph.docString() != null) {
            json.put("docString", graph.docString());
        }
        json.set("inputs", valueInfos(graph.inputs()));
        json.set("outputs", valueInfos(graph.outputs()));
        json.set("nodes", nodes(graph));
        return json;
    }

    /**
     * Renders a JSON tree as text.
     * @param json The tree.
     * @return The JSON text.
     * @throws JsonProcessingException if the tree cannot be serialized.
     */
    public String writeString(JsonNode json) throws JsonProcessingException {
        return mapper.writeValueAsString(json);
    }

    /**
     * Writes a JSON tree to a writer.
     * @param json The tree.
     * @param out The target writer; it is not closed.
     * @throws IOException if writing fails.
     */
    public void write(JsonNode json, Writer out) throws IOException {
        out.write(writeString(json));
        out.write(System.lineSeparator());
        out.flush();
    }

    private ArrayNode valueInfos(Iterable<IrValueInfo> infos) {
        ArrayNode array = mapper.createArrayNode();
        for (IrValueInfo info : infos) {
            ObjectNode value = array.addObject();
            value.put("name", info.name());
            TensorType type = info.type();
            if (type != null) {
                ObjectNode typeJson = value.putObject("type");
                typeJson.put("elemType", type.elementType().name());
                if (type.shape() != null) {
                    ArrayNode shape = typeJson.putArray("shape");
                    for (Object dim : type.shape()) {
                        if (dim instanceof Long l) shape.add(l);
                        else shape.add(String.valueOf(dim));
                    }
                }
            }
        }
        return array;
    }

    private ArrayNode nodes(IrGraph graph) {
        ArrayNode array = mapper.createArrayNode();
        for (IrNode node : graph.nodes()) {
            ObjectNode json = array.addObject();
            json.put("opType", node.opType());
            json.put("domain", node.domain());
            ArrayNode inputs = json.putArray("inputs");
            node.inputs().forEach(inputs::add);
            ArrayNode outputs = json.putArray("outputs");
            node.outputs().forEach(outputs::add);
            if (!node.attributes().isEmpty()) {
                ArrayNode attrs = json.putArray("attributes");
                node.attributes().forEach(a -> attrs.add(attribute(a)));
            }
        }
        return array;
    }

    private ObjectNode attribute(IrAttribute attribute) {
        ObjectNode json = mapper.createObjectNode();
        json.put("name", attribute.name());
        json.put("type", attribute.type().schemaName());
        if (attribute instanceof IrAttribute.IntAttr a) {
            json.put("i", a.value());
        } else if (attribute instanceof IrAttribute.FloatAttr a) {
            json.put("f", a.value());
        } else if (attribute instanceof IrAttribute.StringAttr a) {
            json.put("s", a.value());
        } else if (attribute instanceof IrAttribute.IntsAttr a) {
            ArrayNode values = json.putArray("ints");
            a.values().forEach(values::add);
        } else if (attribute instanceof IrAttribute.FloatsAttr a) {
            ArrayNode values = json.putArray("floats");
            a.values().forEach(values::add);
        } else if (attribute instanceof IrAttribute.StringsAttr a) {
            ArrayNode values = json.putArray("strings");
            a.values().forEach(values::add);
        } else if (attribute instanceof IrAttribute.TensorAttr a) {
            json.set("t", tensor(a.value()));
        } else if (attribute instanceof IrAttribute.GraphAttr a) {
            json.set("g", toJson(a.value()));
        } else if (attribute instanceof IrAttribute.RefAttr a) {
            json.put("refAttrName", a.refAttrName());
        }
        return json;
    }

    private ObjectNode tensor(TensorLiteral tensor) {
        ObjectNode json = mapper.createObjectNode();
        json.put("dataType", tensor.elementType().name());
        ArrayNode dims = json.putArray("dims");
        tensor.dims().forEach(dims::add);
        ArrayNode values = json.putArray("values");
        for (Object v : tensor.values()) {
            if (v instanceof Boolean b) values.add(b);
            else if (v instanceof Long l) values.add(l);
            else if (v instanceof Double d) values.add(d);
            else values.add(String.valueOf(v));
        }
        return json;
    }
}

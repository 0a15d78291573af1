package org.tensorscript.compiler.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tensorscript.compiler.types.AttributeType;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable registry of operator schemas, keyed by domain and operator name.
 * <p>
 * A lookup picks the newest schema whose {@code since} version does not exceed the opset version,
 * so one registry serves every opset version of a domain.
 */
public final class SchemaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    /** Classpath location of the bundled schema set. */
    public static final String DEFAULT_RESOURCE = "opschemas.json";

    private static volatile SchemaRegistry defaultInstance;

    private final Map<String, List<OpSchema>> byKey;

    private SchemaRegistry(Map<String, List<OpSchema>> byKey) {
        this.byKey = byKey;
    }

    /**
     * Creates a registry from explicit schemas.
     * @param schemas The schemas to register.
     * @return The registry.
     */
    public static SchemaRegistry of(List<OpSchema> schemas) {
        Map<String, List<OpSchema>> map = new HashMap<>();
        for (OpSchema schema : schemas) {
            map.computeIfAbsent(key(schema.domain(), schema.name()), k -> new ArrayList<>()).add(schema);
        }
        map.values().forEach(list -> list.sort(Comparator.comparingInt(OpSchema::sinceVersion)));
        map.replaceAll((k, v) -> List.copyOf(v));
        return new SchemaRegistry(Map.copyOf(map));
    }

    /**
     * Returns the registry loaded from the bundled {@value #DEFAULT_RESOURCE} resource.
     * @return The shared default registry.
     * @throws IllegalStateException if the resource is missing or malformed.
     */
    public static SchemaRegistry loadDefault() {
        SchemaRegistry instance = defaultInstance;
        if (instance == null) {
            synchronized (SchemaRegistry.class) {
                instance = defaultInstance;
                if (instance == null) {
                    try (InputStream in = SchemaRegistry.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                        if (in == null) {
                            throw new IllegalStateException("Schema resource not found on classpath: " + DEFAULT_RESOURCE);
                        }
                        instance = load(in);
                    } catch (IOException e) {
                        throw new IllegalStateException("Failed to read schema resource " + DEFAULT_RESOURCE, e);
                    }
                    defaultInstance = instance;
                }
            }
        }
        return instance;
    }

    /**
     * Reads schemas from a JSON document of the form {@code {"schemas": [...]}}.
     * @param in The JSON input.
     * @return The registry.
     * @throws IOException if the document cannot be read or is malformed.
     */
    public static SchemaRegistry load(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        JsonNode root = mapper.readTree(in);
        JsonNode schemasNode = root == null ? null : root.get("schemas");
        if (schemasNode == null || !schemasNode.isArray()) {
            throw new IOException("Schema document has no 'schemas' array.");
        }
        List<OpSchema> schemas = new ArrayList<>();
        for (JsonNode node : schemasNode) {
            schemas.add(parseSchema(node, mapper));
        }
        LOG.debug("Loaded {} operator schemas", schemas.size());
        return of(schemas);
    }

    private static OpSchema parseSchema(JsonNode node, ObjectMapper mapper) throws IOException {
        String name = requireText(node, "name");
        String domain = node.path("domain").asText("");
        int since = node.path("since").asInt(1);

        List<FormalParameter> inputs = new ArrayList<>();
        for (JsonNode input : node.path("inputs")) {
            FormalParameter.Option option = switch (input.path("option").asText("single")) {
                case "single" -> FormalParameter.Option.SINGLE;
                case "optional" -> FormalParameter.Option.OPTIONAL;
                case "variadic" -> FormalParameter.Option.VARIADIC;
                default -> throw new IOException("Unknown input option in schema " + name + ": " + input.path("option").asText());
            };
            inputs.add(new FormalParameter(requireText(input, "name"), requireText(input, "type"), option,
                    input.path("homogeneous").asBoolean(true)));
        }

        List<AttributeSchema> attributes = new ArrayList<>();
        for (JsonNode attr : node.path("attributes")) {
            String attrName = requireText(attr, "name");
            AttributeType type = AttributeType.fromSchemaName(requireText(attr, "type"))
                    .orElseThrow(() -> new IOException("Unknown attribute type in schema " + name + "." + attrName));
            Object defaultValue = attr.has("default") ? mapper.treeToValue(attr.get("default"), Object.class) : null;
            attributes.add(new AttributeSchema(attrName, type, attr.path("required").asBoolean(false), normalize(defaultValue)));
        }
        return new OpSchema(name, domain, since, inputs, attributes);
    }

    // Jackson yields Integer for small ints; attribute values use Long throughout.
    private static Object normalize(Object value) {
        if (value instanceof Integer i) return i.longValue();
        if (value instanceof List<?> list) return list.stream().map(SchemaRegistry::normalize).toList();
        return value;
    }

    private static String requireText(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IOException("Schema entry is missing text field '" + field + "': " + node);
        }
        return value.asText();
    }

    /**
     * Looks up the schema of an operator as defined by the given opset.
     * @param opset The opset the operator is taken from.
     * @param name The operator name.
     * @return The newest applicable schema, or empty if the opset does not define the operator.
     */
    public Optional<OpSchema> lookup(Opset opset, String name) {
        List<OpSchema> versions = byKey.get(key(opset.domain(), name));
        if (versions == null) return Optional.empty();
        OpSchema best = null;
        for (OpSchema schema : versions) {
            if (schema.sinceVersion() <= opset.version()) best = schema;
        }
        return Optional.ofNullable(best);
    }

    /**
     * @param opset The opset.
     * @param name The operator name.
     * @return {@code true} if the opset defines the operator.
     */
    public boolean defines(Opset opset, String name) {
        return lookup(opset, name).isPresent();
    }

    private static String key(String domain, String name) {
        return domain + "::" + name;
    }
}

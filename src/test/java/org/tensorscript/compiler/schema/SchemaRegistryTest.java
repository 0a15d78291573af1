package org.tensorscript.compiler.schema;

import org.tensorscript.compiler.types.AttributeType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SchemaRegistry}: loading the bundled operator catalogue and resolving
 * operator versions against an opset.
 */
public class SchemaRegistryTest {

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @Tag("unit")
    void bundledCatalogueDefinesCoreOperators() {
        // Act
        SchemaRegistry registry = SchemaRegistry.loadDefault();

        // Assert
        Opset opset18 = new Opset("", 18);
        assertThat(registry.defines(opset18, "Add")).isTrue();
        assertThat(registry.defines(opset18, "Loop")).isTrue();
        assertThat(registry.defines(opset18, "NoSuchOp")).isFalse();
        OpSchema concat = registry.lookup(opset18, "Concat").orElseThrow();
        assertThat(concat.inputs().get(0).isVariadic()).isTrue();
        assertThat(concat.attribute("axis")).hasValueSatisfying(a -> assertThat(a.required()).isTrue());
    }

    /**
     * An operator introduced after the requested opset version is not available in it.
     */
    @Test
    @Tag("unit")
    void operatorsNewerThanOpsetAreUnavailable() {
        // Arrange
        SchemaRegistry registry = SchemaRegistry.loadDefault();

        // Act & Assert
        assertThat(registry.lookup(new Opset("", 13), "CastLike")).isEmpty();
        assertThat(registry.lookup(new Opset("", 15), "CastLike")).isPresent();
        assertThat(registry.lookup(new Opset("custom", 18), "Add")).isEmpty();
    }

    @Test
    @Tag("unit")
    void attributeDefaultsAreNormalized() {
        // Arrange
        SchemaRegistry registry = SchemaRegistry.loadDefault();

        // Act
        AttributeSchema fmod = registry.lookup(new Opset("", 18), "Mod").orElseThrow().attribute("fmod").orElseThrow();
        AttributeSchema alpha = registry.lookup(new Opset("", 18), "LeakyRelu").orElseThrow().attribute("alpha").orElseThrow();

        // Assert
        assertThat(fmod.type()).isEqualTo(AttributeType.INT);
        assertThat(fmod.defaultValue()).isEqualTo(0L);
        assertThat(alpha.type()).isEqualTo(AttributeType.FLOAT);
        assertThat(alpha.defaultValue()).isEqualTo(0.01);
    }

    /**
     * The newest version not newer than the opset wins.
     */
    @Test
    @Tag("unit")
    void picksNewestApplicableVersion() throws IOException {
        // Arrange
        SchemaRegistry registry = SchemaRegistry.load(json("""
                {"schemas": [
                  {"name": "Op", "since": 1, "inputs": [{"name": "X", "type": "T"}]},
                  {"name": "Op", "since": 10, "inputs": [{"name": "X", "type": "T"}, {"name": "Y", "type": "T", "option": "optional"}]}
                ]}
                """));

        // Act & Assert
        assertThat(registry.lookup(new Opset("", 9), "Op").orElseThrow().sinceVersion()).isEqualTo(1);
        assertThat(registry.lookup(new Opset("", 12), "Op").orElseThrow().inputs()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void malformedDocumentIsRejected() {
        assertThatThrownBy(() -> SchemaRegistry.load(json("{\"ops\": []}")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no 'schemas' array");
        assertThatThrownBy(() -> SchemaRegistry.load(json("{\"schemas\": [{\"name\": \"Op\", \"inputs\": [{\"name\": \"X\", \"type\": \"T\", \"option\": \"many\"}]}]}")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Unknown input option");
    }
}

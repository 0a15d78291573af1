package org.tensorscript.compiler;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.tensorscript.compiler.schema.Opset;
import org.tensorscript.config.ConfigLoader;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CompilerOptionsTest {

    @Test
    @Tag("unit")
    void referenceConfigurationMatchesDefaults() {
        // Act
        CompilerOptions options = CompilerOptions.fromConfig(ConfigFactory.parseResources("reference.conf").resolve());

        // Assert
        assertThat(options).isEqualTo(CompilerOptions.defaults());
        assertThat(options.defaultOpset()).isEqualTo(new Opset("", 18));
        assertThat(options.moduleOpset()).isEqualTo(new Opset("this", 1));
        assertThat(options.verbosity()).isEqualTo(-1);
    }

    @Test
    @Tag("unit")
    void fileSettingsOverrideDefaults() {
        // Act
        CompilerOptions options = CompilerOptions.fromConfig(ConfigLoader.load("org/tensorscript/config/test-config.conf"));

        // Assert
        assertThat(options.defaultOpset()).isEqualTo(new Opset("", 15));
        assertThat(options.moduleOpset()).isEqualTo(new Opset("test.module", 1));
    }

    @Test
    @Tag("unit")
    void missingSectionIsAConfigError() {
        assertThatThrownBy(() -> CompilerOptions.fromConfig(ConfigFactory.empty()))
                .isInstanceOf(ConfigException.Missing.class);
    }
}

package org.tensorscript.cli;

import com.typesafe.config.ConfigFactory;
import org.tensorscript.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class CommandLineInterfaceTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cmd;
    private Path config;

    @BeforeEach
    void setUp() throws IOException {
        ConfigFactory.invalidateCaches();
        LoggingConfigurator.reset();
        config = write("test.conf", "tensorscript.logging.default-level = \"WARN\"\n");
        cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    @Test
    @Tag("unit")
    void testCliInitialization() {
        assertThat(cmd.getCommandName()).isEqualTo("tensorscript");
        assertThat(cmd.getSubcommands()).containsKey("compile");
    }

    @Test
    @Tag("unit")
    void withoutSubcommandPrintsUsage() {
        // Act
        int exitCode = cmd.execute();

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: tensorscript").contains("compile");
    }

    @Test
    @Tag("unit")
    void compilesScriptToStandardOutput() throws IOException {
        // Arrange
        Path script = write("model.py",
                "import opset18 as op",
                "def f(X):",
                "    return op.Abs(X)");

        // Act
        int exitCode = cmd.execute("--config", config.toString(), "compile", "--compact", "-f", script.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\"opType\":\"Abs\"").contains("\"name\":\"f\"");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @Tag("unit")
    void writesOutputFileWhenRequested() throws IOException {
        // Arrange
        Path script = write("model.py",
                "import opset18 as op",
                "def f(X):",
                "    return op.Neg(X)");
        Path target = dir.resolve("model.json");

        // Act
        int exitCode = cmd.execute("--config", config.toString(), "compile", "-f", script.toString(), "-o", target.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEmpty();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).contains("\"Neg\"");
    }

    @Test
    @Tag("unit")
    void compilationErrorReturnsOne() throws IOException {
        // Arrange
        Path script = write("broken.py",
                "def f(X):",
                "    return Z");

        // Act
        int exitCode = cmd.execute("--config", config.toString(), "compile", "-f", script.toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("broken.py:2:").contains("Unbound name: 'Z'.");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @Tag("unit")
    void unreadableScriptReturnsTwo() {
        // Act
        int exitCode = cmd.execute("--config", config.toString(), "compile", "-f", dir.resolve("missing.py").toString());

        // Assert
        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).startsWith("Cannot read ");
    }

    @Test
    @Tag("unit")
    void missingConfigFileIsAUsageError() throws IOException {
        // Arrange
        Path script = write("model.py",
                "import opset18 as op",
                "def f(X):",
                "    return op.Neg(X)");

        // Act
        int exitCode = cmd.execute("--config", dir.resolve("nope.conf").toString(), "compile", "-f", script.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Configuration file specified via --config was not found");
    }

    private Path write(String name, String... lines) throws IOException {
        return Files.writeString(dir.resolve(name), String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
    }
}

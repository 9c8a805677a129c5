package com.netconf.yangprinter.cli;

import com.netconf.yangprinter.SampleModules;
import com.netconf.yangprinter.printer.YangPrinter;
import com.netconf.yangprinter.registry.ModuleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the yang-print command.
 */
class YangPrintCommandTest {

    @TempDir
    Path tempDir;

    private ModuleRegistry registry;
    private StringWriter out;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        registry = ModuleRegistry.load();
        out = new StringWriter();
        commandLine = new CommandLine(new YangPrintCommand(registry));
        commandLine.setOut(new PrintWriter(out));
    }

    @Test
    void testPrintsModuleToStandardOutput() {
        int exitCode = commandLine.execute("--module", "example-types");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo(new YangPrinter().printToString(SampleModules.exampleTypes()));
    }

    @Test
    void testLayoutOptions() {
        int exitCode = commandLine.execute("-m", "example-types", "--indent", "4", "--no-blank-lines");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("""
                    identity crypto-alg {
                        description
                            "Base identity for crypto algorithms";
                    }
                """);
    }

    @Test
    void testWritesOutputFile() throws IOException {
        Path output = tempDir.resolve("yang/example-system.yang");

        int exitCode = commandLine.execute("-m", "example-system", "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output)).startsWith("module example-system {\n");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testExistingOutputRequiresForce() throws IOException {
        Path output = tempDir.resolve("existing.yang");
        Files.writeString(output, "keep me");

        assertThat(commandLine.execute("-m", "example-types", "-o", output.toString())).isEqualTo(1);
        assertThat(Files.readString(output)).isEqualTo("keep me");

        assertThat(commandLine.execute("-m", "example-types", "-o", output.toString(), "--force")).isZero();
        assertThat(Files.readString(output)).startsWith("module example-types {");
    }

    @Test
    void testUnknownModuleFails() {
        assertThat(commandLine.execute("-m", "no-such-module")).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testMissingModuleFails() {
        assertThat(commandLine.execute()).isEqualTo(1);
    }

    @Test
    void testUnwritableStandardOutputFails() {
        commandLine.setOut(new PrintWriter(new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("broken pipe");
            }

            @Override
            public void flush() throws IOException {
                throw new IOException("broken pipe");
            }

            @Override
            public void close() {
            }
        }));

        assertThat(commandLine.execute("--module", "example-types")).isEqualTo(1);
    }

    @Test
    void testListModules() {
        assertThat(commandLine.execute("--list")).isZero();
        assertThat(out.toString()).isEmpty();
    }
}

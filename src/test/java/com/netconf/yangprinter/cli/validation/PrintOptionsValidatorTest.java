package com.netconf.yangprinter.cli.validation;

import com.netconf.yangprinter.cli.exception.OptionsValidationException;
import com.netconf.yangprinter.cli.model.PrintOptions;
import com.netconf.yangprinter.cli.model.ValidatedPrintOptions;
import com.netconf.yangprinter.registry.ModuleRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PrintOptionsValidator.
 */
class PrintOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final PrintOptionsValidator validator = new PrintOptionsValidator(ModuleRegistry.load());

    @Test
    void testValidOptionsToStandardOutput() {
        ValidatedPrintOptions validated = validator.validate(parse("-m", "example-system"));

        assertThat(validated.getModule().getName()).isEqualTo("example-system");
        assertThat(validated.isToStandardOutput()).isTrue();
        assertThat(validated.getPrinterConfig().getIndentWidth()).isEqualTo(2);
        assertThat(validated.getPrinterConfig().isBlankLineAfterText()).isTrue();
    }

    @Test
    void testOutputPathIsNormalized() {
        Path output = tempDir.resolve("sub/../module.yang");

        ValidatedPrintOptions validated = validator.validate(parse("-m", "example-types", "-o", output.toString()));

        assertThat(validated.getOutputPath()).isEqualTo(tempDir.resolve("module.yang").toAbsolutePath().normalize());
    }

    @Test
    void testListDoesNotNeedModule() {
        ValidatedPrintOptions validated = validator.validate(parse("--list"));

        assertThat(validated.getModule()).isNull();
    }

    @Test
    void testAllErrorsAreCollected() throws IOException {
        Path existing = tempDir.resolve("existing.yang");
        Files.writeString(existing, "");

        assertThatThrownBy(() -> validator.validate(parse("-m", "unknown", "--indent", "0", "-o", existing.toString())))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(3)
                        .anySatisfy(error -> assertThat(error).contains("Unknown module 'unknown'")
                                .contains("example-types, example-system"))
                        .anySatisfy(error -> assertThat(error).contains("Indent width"))
                        .anySatisfy(error -> assertThat(error).contains("--force")));
    }

    @Test
    void testMessageSummarizesEveryError() {
        assertThatThrownBy(() -> validator.validate(parse("-m", "unknown", "--indent", "9")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageStartingWith("Invalid yang-print options (2): ")
                .hasMessageContaining("Unknown module 'unknown'")
                .hasMessageContaining("; Indent width");
    }

    @Test
    void testOutputDirectoryIsRejected() {
        assertThatThrownBy(() -> validator.validate(parse("-m", "example-types", "-o", tempDir.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("is a directory");
    }

    @Test
    void testModuleIsRequired() {
        assertThatThrownBy(() -> validator.validate(parse()))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Module name is required");
    }

    private static PrintOptions parse(String... args) {
        return CommandLine.populateCommand(new PrintOptions(), args);
    }
}

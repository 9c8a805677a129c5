package com.netconf.yangprinter.cli.validation;

import com.netconf.yangprinter.cli.exception.OptionsValidationException;
import com.netconf.yangprinter.cli.model.PrintOptions;
import com.netconf.yangprinter.cli.model.ValidatedPrintOptions;
import com.netconf.yangprinter.model.SchemaModule;
import com.netconf.yangprinter.printer.PrinterConfig;
import com.netconf.yangprinter.registry.ModuleRegistry;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class PrintOptionsValidator {

    static final int MAX_INDENT = 8;

    private final ModuleRegistry registry;

    public PrintOptionsValidator(ModuleRegistry registry) {
        this.registry = registry;
    }

    public ValidatedPrintOptions validate(PrintOptions o) {
        List<String> errors = new ArrayList<>();

        SchemaModule module = null;
        if (!o.isList()) {
            if (isBlank(o.getModuleName())) {
                errors.add("Module name is required (--module / -m) unless --list is given.");
            } else {
                module = registry.find(o.getModuleName().trim()).orElse(null);
                if (module == null) {
                    errors.add("Unknown module '" + o.getModuleName() + "'. Available: " + availableModules());
                }
            }
        }

        if (o.getIndentWidth() < 1 || o.getIndentWidth() > MAX_INDENT) {
            errors.add("Indent width must be in range 1-" + MAX_INDENT + ". Got: " + o.getIndentWidth());
        }

        Path outputPath = null;
        if (o.getOutput() != null) {
            outputPath = o.getOutput().toAbsolutePath().normalize();
            if (Files.isDirectory(outputPath)) {
                errors.add("Output path is a directory: " + outputPath);
            } else if (Files.exists(outputPath) && !o.isForce()) {
                errors.add("Output file already exists: " + outputPath + ". Use --force to overwrite.");
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        PrinterConfig printerConfig = PrinterConfig.builder()
                .indentWidth(o.getIndentWidth())
                .blankLineAfterText(!o.isNoBlankLines())
                .build();
        return new ValidatedPrintOptions(module, outputPath, printerConfig);
    }

    private String availableModules() {
        List<String> names = registry.getModuleNames();
        return names.isEmpty() ? "none" : String.join(", ", names);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}

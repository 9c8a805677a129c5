package com.netconf.yangprinter.printer;

import com.netconf.yangprinter.model.SchemaModule;
import com.netconf.yangprinter.util.OutputFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.Path;

/**
 * Prints a resolved {@link SchemaModule} as YANG text.
 * <p>
 * The printer never modifies the tree and keeps no state between calls, so
 * one instance may print different modules from different threads. Writes
 * to a shared sink must be serialized by the caller. The sink is flushed
 * but never closed.
 */
public class YangPrinter {

    private static final Logger log = LoggerFactory.getLogger(YangPrinter.class);

    private final PrinterConfig config;

    public YangPrinter() {
        this(PrinterConfig.defaults());
    }

    public YangPrinter(PrinterConfig config) {
        this.config = config;
    }

    /**
     * Write {@code module} to {@code sink}.
     *
     * @throws PrinterException if the sink fails; nothing more is written after the failing write
     */
    public void emit(Writer sink, SchemaModule module) {
        log.debug("Printing module {}", module.getName());
        new ModuleEmitter(sink, module, config).emit();
        log.debug("Printed module {}", module.getName());
    }

    /**
     * Write {@code module} to {@code sink}, reporting a sink failure through
     * the return value.
     *
     * @return 0 on success, 1 if the sink failed
     */
    public int print(Writer sink, SchemaModule module) {
        try {
            emit(sink, module);
            return 0;
        } catch (PrinterException e) {
            log.error("Printing module {} failed", e.getModuleName(), e);
            return 1;
        }
    }

    public String printToString(SchemaModule module) {
        StringWriter sink = new StringWriter();
        emit(sink, module);
        return sink.toString();
    }

    /**
     * Print {@code module} into {@code outputFile}, replacing any existing file.
     */
    public PrintResult printToFile(Path outputFile, SchemaModule module) {
        String text = printToString(module);
        try {
            OutputFiles.safeWriteString(outputFile, text);
        } catch (IOException e) {
            log.error("Could not write {}", outputFile, e);
            return PrintResult.failure(module.getName(), e.getMessage());
        }
        return PrintResult.builder()
                .success(true)
                .moduleName(module.getName())
                .outputPath(outputFile)
                .lineCount(OutputFiles.countLines(text))
                .build();
    }
}

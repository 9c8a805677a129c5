package com.netconf.yangprinter.printer;

import com.netconf.yangprinter.util.QuotedText;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes indented YANG statements to the sink of a single print call.
 * Any {@link IOException} from the sink surfaces as a {@link PrinterException}.
 */
class StatementWriter {

    private final Writer sink;
    private final PrinterConfig config;
    private final String moduleName;

    StatementWriter(Writer sink, PrinterConfig config, String moduleName) {
        this.sink = sink;
        this.config = config;
        this.moduleName = moduleName;
    }

    /**
     * Keyword, argument and the opening brace on one line.
     */
    void openBlock(int level, String keyword, String argument) {
        line(level, keyword + " " + argument + " {");
    }

    void closeBlock(int level) {
        line(level, "}");
    }

    /**
     * {@code <keyword> <argument>;}
     */
    void statement(int level, String keyword, String argument) {
        line(level, keyword + " " + argument + ";");
    }

    /**
     * {@code <keyword> "<argument>";}
     */
    void quotedStatement(int level, String keyword, String argument) {
        statement(level, keyword, QuotedText.quote(argument));
    }

    /**
     * The label on its own line, then the text quoted and re-indented one
     * level deeper, line by line.
     */
    void quotedText(int level, String label, String text) {
        line(level, label);
        for (String physicalLine : QuotedText.indentLines(text, indent(level + 1))) {
            write(physicalLine);
            write(config.getLineSeparator());
        }
        if (config.isBlankLineAfterText()) {
            write(config.getLineSeparator());
        }
    }

    void line(int level, String content) {
        write(indent(level));
        write(content);
        write(config.getLineSeparator());
    }

    void flush() {
        try {
            sink.flush();
        } catch (IOException e) {
            throw new PrinterException(moduleName, e);
        }
    }

    private String indent(int level) {
        return " ".repeat(level * config.getIndentWidth());
    }

    private void write(String text) {
        try {
            sink.write(text);
        } catch (IOException e) {
            throw new PrinterException(moduleName, e);
        }
    }
}

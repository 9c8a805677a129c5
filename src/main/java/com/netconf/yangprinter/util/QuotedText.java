package com.netconf.yangprinter.util;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out a text argument as a double-quoted YANG string spanning one or
 * more physical lines.
 */
@UtilityClass
public class QuotedText {

    /**
     * Split {@code text} at each {@code '\n'} and prefix every resulting line
     * with {@code indent}. The opening quote goes before the first line and
     * {@code ";} after the last one. Line content is kept verbatim; quotes
     * inside the text are not escaped.
     *
     * @param text   the raw text, possibly multi-line
     * @param indent indentation applied to every physical line
     * @return the physical lines without line terminators
     */
    public List<String> indentLines(String text, String indent) {
        String[] lines = text.split("\n", -1);
        List<String> result = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            StringBuilder line = new StringBuilder(indent);
            if (i == 0) {
                line.append('"');
            }
            line.append(lines[i]);
            if (i == lines.length - 1) {
                line.append("\";");
            }
            result.add(line.toString());
        }
        return result;
    }

    /**
     * Wrap a single-line argument in double quotes.
     */
    public String quote(String value) {
        return "\"" + value + "\"";
    }
}

package com.sdsketch.loader;

import com.sdsketch.model.Dependency;
import com.sdsketch.model.Equation;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads the equation section: blocks of {@code name = expression ~ units ~ description |}. Only the
 * structural part is interpreted; expressions other than {@code A FUNCTION OF( ... )} are kept as
 * text and yield no dependencies.
 */
public final class EquationReader {
    private static final Logger LOGGER = Logger.getLogger(EquationReader.class.getName());
    static final String FUNCTION_OF = "A FUNCTION OF";
    private static final String ENCODING_HEADER = "{UTF-8}";

    private final List<LoaderMessage> messages;

    public EquationReader(List<LoaderMessage> messages) {
        this.messages = messages;
    }

    public List<Equation> read(String sourceName, String equationsText) {
        List<Equation> equations = new ArrayList<>();
        String text = equationsText;
        int headerAt = text.indexOf(ENCODING_HEADER);
        if (headerAt >= 0 && text.substring(0, headerAt).isBlank()) {
            text = " ".repeat(headerAt + ENCODING_HEADER.length()) + text.substring(headerAt + ENCODING_HEADER.length());
        }
        int start = 0;
        while (start < text.length()) {
            int end = FieldTokenizer.indexOfUnquoted(text, '|', start);
            if (end < 0) {
                break;
            }
            String block = text.substring(start, end);
            int lineNo = lineOf(text, start + leadingWhitespace(block));
            Equation equation = readBlock(block, sourceName, lineNo);
            if (equation != null) {
                equations.add(equation);
            }
            start = end + 1;
        }
        return equations;
    }

    private Equation readBlock(String block, String sourceName, int lineNo) {
        int firstTilde = FieldTokenizer.indexOfUnquoted(block, '~', 0);
        String definition = firstTilde < 0 ? block : block.substring(0, firstTilde);
        int equals = FieldTokenizer.indexOfUnquoted(definition, '=', 0);
        if (equals < 0) {
            // section banners such as the .Control group carry no definition
            return null;
        }
        String name = normalize(FieldTokenizer.unquote(normalize(definition.substring(0, equals))));
        if (name.isEmpty()) {
            warn("Skipping equation block without a name", sourceName, lineNo);
            return null;
        }
        String expression = normalize(definition.substring(equals + 1));
        String units = "";
        String description = "";
        if (firstTilde >= 0) {
            int secondTilde = FieldTokenizer.indexOfUnquoted(block, '~', firstTilde + 1);
            if (secondTilde < 0) {
                units = block.substring(firstTilde + 1).trim();
            } else {
                units = block.substring(firstTilde + 1, secondTilde).trim();
                description = block.substring(secondTilde + 1).trim();
            }
        }
        List<Dependency> dependencies = List.of();
        if (expression.contains(FUNCTION_OF)) {
            dependencies = parseFunctionOf(expression);
            if (dependencies == null) {
                warn("Unbalanced " + FUNCTION_OF + " argument list for '" + name + "'", sourceName, lineNo);
                dependencies = List.of();
            }
        }
        return new Equation(name, expression, units, description, dependencies);
    }

    /** Arguments of the first {@code A FUNCTION OF( ... )}, or {@code null} when its span is unbalanced. */
    public static List<Dependency> parseFunctionOf(String expression) {
        int keyword = expression.indexOf(FUNCTION_OF);
        if (keyword < 0) {
            return List.of();
        }
        int open = expression.indexOf('(', keyword);
        int close = FieldTokenizer.findClosingParen(expression, open);
        if (close < 0) {
            return null;
        }
        List<Dependency> dependencies = new ArrayList<>();
        for (String argument : FieldTokenizer.split(expression.substring(open + 1, close))) {
            String trimmed = argument.trim();
            boolean negative = false;
            if (trimmed.startsWith("-")) {
                negative = true;
                trimmed = trimmed.substring(1);
            } else if (trimmed.startsWith("+")) {
                trimmed = trimmed.substring(1);
            }
            String name = FieldTokenizer.unquote(trimmed);
            if (!name.isEmpty()) {
                dependencies.add(new Dependency(name, negative));
            }
        }
        return dependencies;
    }

    /** Joins backslash continuations and collapses runs of whitespace. */
    static String normalize(String text) {
        return text.replaceAll("\\\\\\s*\\r?\\n", " ").trim().replaceAll("\\s+", " ");
    }

    private void warn(String message, String sourceName, int lineNo) {
        LOGGER.warning(() -> sourceName + ":" + lineNo + ": " + message);
        messages.add(LoaderMessage.warning(message, sourceName, lineNo));
    }

    private static int leadingWhitespace(String block) {
        int i = 0;
        while (i < block.length() && Character.isWhitespace(block.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int lineOf(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}

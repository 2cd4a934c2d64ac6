package com.sdsketch.loader;

import java.util.ArrayList;
import java.util.List;

/**
 * Editable view of a text as lines that remembers each line's own terminator, so untouched lines
 * come back byte-identical. Inserted lines use the file's dominant terminator.
 */
public final class LineBuffer {
    private final List<String> lines = new ArrayList<>();
    private final List<String> terminators = new ArrayList<>();
    private final String newline;

    private LineBuffer(String newline) {
        this.newline = newline;
    }

    public static LineBuffer of(String text) {
        LineBuffer buffer = new LineBuffer(text.contains("\r\n") ? "\r\n" : "\n");
        int start = 0;
        while (start < text.length()) {
            int end = text.indexOf('\n', start);
            if (end < 0) {
                buffer.lines.add(text.substring(start));
                buffer.terminators.add("");
                break;
            }
            boolean crlf = end > start && text.charAt(end - 1) == '\r';
            buffer.lines.add(text.substring(start, crlf ? end - 1 : end));
            buffer.terminators.add(crlf ? "\r\n" : "\n");
            start = end + 1;
        }
        return buffer;
    }

    public String getNewline() {
        return newline;
    }

    public int size() {
        return lines.size();
    }

    public String get(int index) {
        return lines.get(index);
    }

    public List<String> lines() {
        return List.copyOf(lines);
    }

    public void set(int index, String line) {
        lines.set(index, line);
    }

    /** Inserts {@code newLines} before position {@code index}; {@code index == size()} appends. */
    public void insert(int index, List<String> newLines) {
        if (newLines.isEmpty()) {
            return;
        }
        boolean atEnd = index == lines.size();
        String tail = atEnd ? (index > 0 ? terminators.get(index - 1) : "") : newline;
        if (index > 0 && terminators.get(index - 1).isEmpty()) {
            terminators.set(index - 1, newline);
        }
        for (int i = 0; i < newLines.size(); i++) {
            lines.add(index + i, newLines.get(i));
            boolean last = i == newLines.size() - 1;
            terminators.add(index + i, atEnd && last ? tail : newline);
        }
    }

    public String render() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            builder.append(lines.get(i)).append(terminators.get(i));
        }
        return builder.toString();
    }
}

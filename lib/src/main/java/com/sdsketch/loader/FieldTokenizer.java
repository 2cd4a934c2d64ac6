package com.sdsketch.loader;

import java.util.ArrayList;
import java.util.List;

/**
 * Quote- and parenthesis-aware scanner shared by the sketch record reader and the equation reader.
 *
 * <p>A comma only separates fields at top level. Inside {@code "..."} everything is literal and
 * {@code ""} is an escaped quote. Inside parentheses commas do not split either, which keeps
 * polylines such as {@code 1|(10,20)(30,40)|} and nested dependency names in a single field.
 */
public final class FieldTokenizer {

    enum State {
        NORMAL,
        IN_QUOTES,
        IN_PARENS
    }

    private FieldTokenizer() {}

    public static List<String> split(String text) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        State state = State.NORMAL;
        int depth = 0;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            switch (state) {
                case NORMAL:
                    if (c == ',') {
                        fields.add(current.toString());
                        current.setLength(0);
                        continue;
                    }
                    current.append(c);
                    if (c == '"') {
                        state = State.IN_QUOTES;
                    } else if (c == '(') {
                        depth = 1;
                        state = State.IN_PARENS;
                    }
                    break;
                case IN_QUOTES:
                    current.append(c);
                    if (c == '"') {
                        if (i + 1 < length && text.charAt(i + 1) == '"') {
                            current.append('"');
                            i++;
                        } else {
                            state = depth > 0 ? State.IN_PARENS : State.NORMAL;
                        }
                    }
                    break;
                case IN_PARENS:
                    current.append(c);
                    if (c == '"') {
                        state = State.IN_QUOTES;
                    } else if (c == '(') {
                        depth++;
                    } else if (c == ')') {
                        depth--;
                        if (depth == 0) {
                            state = State.NORMAL;
                        }
                    }
                    break;
                default:
                    throw new IllegalStateException("Unexpected state " + state);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    /**
     * Returns the index of the parenthesis closing the one at {@code openIndex}, or -1 when the span
     * is unbalanced. Parentheses inside quoted names are ignored.
     */
    public static int findClosingParen(String text, int openIndex) {
        if (openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != '(') {
            return -1;
        }
        boolean inQuotes = false;
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        i++;
                    } else {
                        inQuotes = false;
                    }
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Index of the first {@code target} character outside quotes, starting at {@code from}, or -1.
     */
    public static int indexOfUnquoted(String text, char target, int from) {
        boolean inQuotes = false;
        for (int i = Math.max(0, from); i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                if (inQuotes && i + 1 < text.length() && text.charAt(i + 1) == '"') {
                    i++;
                    continue;
                }
                inQuotes = !inQuotes;
            } else if (c == target && !inQuotes) {
                return i;
            }
        }
        return -1;
    }

    /** Strips surrounding whitespace and one pair of enclosing quotes, undoubling inner quotes. */
    public static String unquote(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1).replace("\"\"", "\"");
        }
        return trimmed;
    }
}

package com.sdsketch.writer;

/** Quoting rules for variable names in equations and sketch records. */
public final class NameQuoting {
    private static final String SPECIAL = ",()|\"";

    private NameQuoting() {}

    public static boolean needsQuotes(String name) {
        for (int i = 0; i < name.length(); i++) {
            if (SPECIAL.indexOf(name.charAt(i)) >= 0) {
                return true;
            }
        }
        return !name.equals(name.strip()) || name.indexOf('\n') >= 0;
    }

    public static String quote(String name) {
        if (!needsQuotes(name)) {
            return name;
        }
        return '"' + name.replace("\"", "\"\"") + '"';
    }
}

package com.sdsketch.loader;

/**
 * A diagnostic produced while reading, building or patching a sketch file. Recoverable problems
 * (a malformed record, a duplicate name, an unresolved reference) are reported as WARNING and
 * processing continues.
 */
public final class LoaderMessage {

    /** Fatal problems raise {@link LoaderException} instead of producing a message. */
    public enum Level {
        WARNING
    }

    private final Level level;
    private final String message;
    private final String sourceFilename;
    private final int sourceLineno;

    public LoaderMessage(Level level, String message, String sourceFilename, int sourceLineno) {
        this.level = level;
        this.message = message;
        this.sourceFilename = sourceFilename;
        this.sourceLineno = sourceLineno;
    }

    public static LoaderMessage warning(String message, String sourceFilename, int sourceLineno) {
        return new LoaderMessage(Level.WARNING, message, sourceFilename, sourceLineno);
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceFilename() {
        return sourceFilename;
    }

    public int getSourceLineno() {
        return sourceLineno;
    }

    @Override
    public String toString() {
        String location = sourceLineno > 0 ? sourceFilename + ":" + sourceLineno : sourceFilename;
        return level + " " + location + ": " + message;
    }
}

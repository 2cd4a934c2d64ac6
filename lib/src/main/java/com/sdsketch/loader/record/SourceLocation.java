package com.sdsketch.loader.record;

import java.util.Objects;

/** File name and 1-based line number a record was read from. */
public final class SourceLocation {
    private final String sourceName;
    private final int line;

    public SourceLocation(String sourceName, int line) {
        this.sourceName = sourceName;
        this.line = line;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceLocation)) {
            return false;
        }
        SourceLocation other = (SourceLocation) obj;
        return line == other.line && Objects.equals(sourceName, other.sourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, line);
    }

    @Override
    public String toString() {
        return sourceName + ":" + line;
    }
}

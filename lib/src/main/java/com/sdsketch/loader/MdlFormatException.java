package com.sdsketch.loader;

/**
 * Fatal structural problem with a sketch file: the sketch marker is missing, or the patcher cannot
 * find an anchor it must insert at.
 */
public final class MdlFormatException extends LoaderException {
    private final String construct;

    public MdlFormatException(String construct, String message) {
        super(message);
        this.construct = construct;
    }

    /** Name of the missing or offending construct, e.g. {@code "sketch section"}. */
    public String getConstruct() {
        return construct;
    }
}

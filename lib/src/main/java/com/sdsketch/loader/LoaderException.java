package com.sdsketch.loader;

/**
 * Checked exception signalling that a sketch file could not be read or processed at all. Problems
 * confined to a single record never raise; they are reported as {@link LoaderMessage}s.
 */
public class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}

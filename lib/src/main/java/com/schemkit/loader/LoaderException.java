package com.schemkit.loader;

/**
 * Checked exception signalling that a schematic could not be loaded, either because the file could
 * not be read or because its records are structurally broken.
 */
public final class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}

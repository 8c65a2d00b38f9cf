package com.mosaicmaker.session;

/**
 * A session operation could not run: a required input is missing or unreadable, or an earlier
 * step has not produced what this one needs.
 */
public final class MosaicException extends Exception {

    public MosaicException(String message) {
        super(message);
    }

    public MosaicException(String message, Throwable cause) {
        super(message, cause);
    }
}

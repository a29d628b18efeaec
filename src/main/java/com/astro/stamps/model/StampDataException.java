package com.astro.stamps.model;

/**
 * Raised when a raw stamp or catalog row cannot be turned into a calibrated
 * record. The message names the band, stamp or row that failed.
 */
public class StampDataException extends Exception {

    public enum Kind { MISSING_FIELD, MALFORMED_VALUE, SHAPE_MISMATCH, IO_FAILURE }

    private final Kind kind;

    public StampDataException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StampDataException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /** Same kind and cause, with {@code context} prefixed to the message. */
    public StampDataException withContext(String context) {
        return new StampDataException(kind, context + ": " + getMessage(), getCause() != null ? getCause() : this);
    }
}

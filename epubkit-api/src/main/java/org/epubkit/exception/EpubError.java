package org.epubkit.exception;

import lombok.Getter;

@Getter
public enum EpubError {
    NOT_FOUND("%s not found"),
    DECODE_ERROR("Malformed XML in %s: %s"),
    OUT_OF_RANGE("Chapter index %d out of range (spine has %d entries)"),
    UNSUPPORTED_CONTENT("Chapter %d is not an HTML document (media type '%s')"),
    CONTENT_TOO_LARGE("Chapter %d content exceeds maximum length (%d > %d bytes)"),
    CANCELLED("Operation cancelled: %s"),
    ACCESS_ERROR("Failed to read %s: %s");

    private final String message;

    EpubError(String message) {
        this.message = message;
    }

    public EpubException createException(Object... details) {
        return new EpubException(this, String.format(message, details));
    }

    public EpubException createException(Throwable cause, Object... details) {
        return new EpubException(this, String.format(message, details), cause);
    }
}

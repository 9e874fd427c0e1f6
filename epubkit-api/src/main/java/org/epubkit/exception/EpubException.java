package org.epubkit.exception;

import lombok.Getter;

/**
 * Unchecked failure raised by every EPUB operation. The {@link EpubError} tells callers
 * which kind of failure occurred without parsing the message.
 */
@Getter
public class EpubException extends RuntimeException {

    private final EpubError error;

    public EpubException(EpubError error, String message) {
        super(message);
        this.error = error;
    }

    public EpubException(EpubError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}

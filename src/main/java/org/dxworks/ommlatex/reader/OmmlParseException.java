package org.dxworks.ommlatex.reader;

/**
 * Raised when a fragment cannot be read into an equation tree at all.
 */
public class OmmlParseException extends Exception {

    public OmmlParseException(String message) {
        super(message);
    }

    public OmmlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.dxworks.apislice.analyzer;

/**
 * No grammar could produce a usable structural view of a file.
 */
public class ParseException extends Exception {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

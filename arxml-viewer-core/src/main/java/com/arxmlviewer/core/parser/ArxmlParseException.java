package com.arxmlviewer.core.parser;

/**
 * Thrown when an ARXML file cannot be read or is not well-formed XML.
 *
 * <p>Structural irregularities inside a well-formed document never raise
 * this exception; they are reported through {@link DebugInfo}.
 */
public class ArxmlParseException extends Exception {

    public ArxmlParseException(String message) {
        super(message);
    }

    public ArxmlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

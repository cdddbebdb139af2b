package com.praga.tools;

/**
 * Thrown by a tool function to report that the query matched nothing. Invocations turn it into
 * the structured not-found response instead of an error.
 */
public class NoMatchingDocumentsException extends RuntimeException {

    public static final String DEFAULT_MESSAGE = "No matching documents found";

    public NoMatchingDocumentsException() {
        super(DEFAULT_MESSAGE);
    }

    public NoMatchingDocumentsException(String message) {
        super(message);
    }
}

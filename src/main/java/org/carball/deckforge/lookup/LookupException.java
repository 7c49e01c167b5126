package org.carball.deckforge.lookup;

/**
 * Raised by a collaborator lookup that could not answer. Callers degrade instead of failing.
 */
public class LookupException extends RuntimeException {

    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}

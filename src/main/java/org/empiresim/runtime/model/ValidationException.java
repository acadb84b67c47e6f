package org.empiresim.runtime.model;

/**
 * Thrown when a value handed to the engine is malformed or out of its accepted range.
 * Raised at the boundary, before any state is mutated.
 */
public class ValidationException extends IllegalArgumentException {

    /**
     * Creates a new ValidationException with the given message.
     *
     * @param message description of the rejected input.
     */
    public ValidationException(String message) {
        super(message);
    }
}

package io.clype.reactorkinesis.model;

/**
 * Thrown by {@code enqueue} when a structured payload cannot be converted to JSON.
 */
public class PayloadSerializationException extends RuntimeException {

    public PayloadSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.clype.reactorkinesis.transport;

/**
 * Thrown when a batch call fails as a whole for a reason the SDK does not already express
 * as a runtime exception, or when the service's response breaks the positional contract.
 */
public class StreamTransportException extends RuntimeException {

    public StreamTransportException(String message) {
        super(message);
    }

    public StreamTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.clype.reactorkinesis.model;

import java.util.Objects;

/**
 * Identifies the Kinesis stream a writer publishes to.
 *
 * <p>Kinesis accepts either a stream name or a stream ARN on {@code PutRecords}. Values
 * beginning with {@code arn:} are treated as ARNs and sent as {@code StreamARN}; anything
 * else is sent as {@code StreamName}. No other validation is performed locally: a stream
 * that does not exist is reported by the service on the first flush.</p>
 *
 * @param value the stream name or ARN exactly as configured
 */
public record StreamIdentifier(String value) {

    private static final String ARN_PREFIX = "arn:";

    /**
     * @throws NullPointerException     if value is null
     * @throws IllegalArgumentException if value is blank
     */
    public StreamIdentifier {
        Objects.requireNonNull(value, "stream cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("stream cannot be blank");
        }
    }

    public static StreamIdentifier of(String value) {
        return new StreamIdentifier(value);
    }

    public boolean isArn() {
        return value.startsWith(ARN_PREFIX);
    }

    /**
     * Returns the short stream name, for logs and metric tags.
     *
     * @return the configured name, or the segment after the last {@code /} of an ARN
     *         (e.g. {@code example} for {@code arn:aws:kinesis:us-east-2:123456789012:stream/example})
     */
    public String name() {
        if (!isArn()) {
            return value;
        }
        int lastSlash = value.lastIndexOf('/');
        if (lastSlash >= 0 && lastSlash < value.length() - 1) {
            return value.substring(lastSlash + 1);
        }
        return value.substring(value.lastIndexOf(':') + 1);
    }

    @Override
    public String toString() {
        return value;
    }
}

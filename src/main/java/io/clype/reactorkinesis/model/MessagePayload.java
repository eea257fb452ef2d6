package io.clype.reactorkinesis.model;

import java.util.Objects;

/**
 * A message accepted by {@code enqueue}, before serialization.
 *
 * <p>There are exactly three variants, each with its own serialization rule:</p>
 * <ul>
 *   <li>{@link Bytes}: passed through unchanged</li>
 *   <li>{@link Text}: encoded as UTF-8</li>
 *   <li>{@link Structured}: encoded as canonical (compact, key-sorted) JSON</li>
 * </ul>
 *
 * @see io.clype.reactorkinesis.service.PayloadSerializer
 */
public interface MessagePayload {

    static MessagePayload of(byte[] bytes) {
        return new Bytes(bytes);
    }

    static MessagePayload of(String text) {
        return new Text(text);
    }

    static MessagePayload structured(Object value) {
        return new Structured(value);
    }

    /** Raw bytes. */
    record Bytes(byte[] bytes) implements MessagePayload {
        public Bytes {
            Objects.requireNonNull(bytes, "bytes cannot be null");
        }
    }

    /** Text, sent as UTF-8. */
    record Text(String text) implements MessagePayload {
        public Text {
            Objects.requireNonNull(text, "text cannot be null");
        }
    }

    /** Any value Jackson can serialize; {@code null} is written as the JSON literal {@code null}. */
    record Structured(Object value) implements MessagePayload {}
}

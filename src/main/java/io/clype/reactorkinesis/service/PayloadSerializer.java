package io.clype.reactorkinesis.service;

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import io.clype.reactorkinesis.model.MessagePayload;
import io.clype.reactorkinesis.model.PayloadSerializationException;

/**
 * Turns a {@link MessagePayload} into the bytes sent to the stream.
 *
 * <p>Byte payloads are copied. Structured values are written as compact JSON with object properties and map entries
 * sorted by key, so equal values always produce identical bytes.</p>
 */
public class PayloadSerializer {

    private final ObjectMapper mapper;

    public PayloadSerializer() {
        this.mapper = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .build();
    }

    /**
     * Serializes a payload.
     *
     * @throws PayloadSerializationException if a structured value cannot be written as JSON
     */
    public byte[] serialize(MessagePayload payload) {
        if (payload instanceof MessagePayload.Bytes bytes) {
            // copied so later changes to the caller's array do not reach the queue
            return bytes.bytes().clone();
        }
        if (payload instanceof MessagePayload.Text text) {
            return text.text().getBytes(StandardCharsets.UTF_8);
        }
        if (payload instanceof MessagePayload.Structured structured) {
            return toJson(structured.value());
        }
        throw new IllegalArgumentException("Unsupported payload type: "
                + (payload == null ? "null" : payload.getClass().getName()));
    }

    private byte[] toJson(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new PayloadSerializationException(
                    "Unable to serialize " + value.getClass().getName() + " as JSON", e);
        }
    }
}

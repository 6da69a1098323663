package com.pgoutbox.application.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * Converts the payload column text into the value a handler consumes.
 */
public sealed interface PayloadMapper<T> permits PayloadMapper.RawString, PayloadMapper.RawObject, PayloadMapper.Typed {

    T map(String payload) throws IOException;

    /**
     * Hands the payload over untouched.
     */
    enum RawString implements PayloadMapper<String> {
        INSTANCE;

        @Override
        public String map(String payload) {
            return payload;
        }
    }

    /**
     * Parses the payload into a generic JSON tree.
     */
    record RawObject(ObjectMapper objectMapper) implements PayloadMapper<JsonNode> {

        public RawObject {
            Objects.requireNonNull(objectMapper, "objectMapper");
        }

        @Override
        public JsonNode map(String payload) throws IOException {
            if (payload == null) {
                throw new IOException("Payload is null");
            }
            return objectMapper.readTree(payload);
        }
    }

    record Typed<T>(Class<T> kind, ObjectMapper objectMapper) implements PayloadMapper<T> {

        public Typed {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(objectMapper, "objectMapper");
        }

        @Override
        public T map(String payload) throws IOException {
            if (payload == null) {
                throw new IOException("Payload is null");
            }
            return objectMapper.readValue(payload, kind);
        }
    }
}

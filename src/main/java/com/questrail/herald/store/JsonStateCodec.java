package com.questrail.herald.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON {@link StateCodec} backed by Jackson.
 *
 * <p>Timestamps are written as ISO-8601 strings so the files stay readable
 * and hand-editable. Unknown properties are ignored so that an older build
 * can still read a file written by a newer one within the same schema.</p>
 */
public final class JsonStateCodec<S> implements StateCodec<S> {

    private final ObjectMapper mapper;
    private final JavaType envelopeType;

    public JsonStateCodec(Class<S> stateType) {
        this(defaultMapper(), stateType);
    }

    public JsonStateCodec(ObjectMapper mapper, Class<S> stateType) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(stateType, "stateType");
        this.envelopeType = mapper.getTypeFactory()
                .constructParametricType(StateEnvelope.class, stateType);
    }

    /**
     * Mapper configuration shared by all state files.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public byte[] encode(StateEnvelope<S> envelope) throws IOException {
        Objects.requireNonNull(envelope, "envelope");
        return mapper.writeValueAsBytes(envelope);
    }

    @Override
    public StateEnvelope<S> decode(byte[] bytes) throws StateCorruptionException {
        if (bytes == null || bytes.length == 0) {
            throw new StateCorruptionException("state file is empty");
        }
        try {
            StateEnvelope<S> envelope = mapper.readValue(bytes, envelopeType);
            if (envelope == null || envelope.state() == null) {
                throw new StateCorruptionException("state record has no state");
            }
            return envelope;
        } catch (IOException | IllegalArgumentException e) {
            throw new StateCorruptionException("state record is malformed: " + e.getMessage(), e);
        }
    }
}

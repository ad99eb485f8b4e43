package com.ryuqq.conductor.adapter.inmemory.codec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.conductor.core.contract.AgentTaskResponse;
import com.ryuqq.conductor.core.model.AgentRecord;
import com.ryuqq.conductor.core.model.MessageRole;

import java.io.IOException;

/**
 * JSON codec for wire contracts and persisted workflow state.
 *
 * <p><strong>Format:</strong></p>
 * <ul>
 *   <li>camelCase field names (record component names)</li>
 *   <li>{@link MessageRole} as its lowercase wire value</li>
 *   <li>{@link java.time.Instant} as ISO-8601 text</li>
 *   <li>null fields omitted, unknown fields ignored on read</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class JsonMessageCodec {

    private final ObjectMapper mapper;

    public JsonMessageCodec() {
        this(defaultMapper());
    }

    public JsonMessageCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * Creates the mapper used by default.
     *
     * @return configured ObjectMapper
     */
    public static ObjectMapper defaultMapper() {
        SimpleModule roles = new SimpleModule("conductor-message-role");
        roles.addSerializer(MessageRole.class, new MessageRoleSerializer());
        roles.addDeserializer(MessageRole.class, new MessageRoleDeserializer());

        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(roles);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.addMixIn(AgentTaskResponse.class, AgentTaskResponseMixin.class);
        mapper.addMixIn(AgentRecord.class, AgentRecordMixin.class);
        return mapper;
    }

    public String encode(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Pretty-printed bytes, for files.
     *
     * @param value value to write
     * @return UTF-8 JSON bytes
     */
    public byte[] encodePretty(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    public <T> T decode(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException("Failed to decode " + type.getSimpleName(), e);
        }
    }

    public <T> T decode(byte[] json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (IOException e) {
            throw new JsonCodecException("Failed to decode " + type.getSimpleName(), e);
        }
    }

    @JsonIgnoreProperties({"timeoutSentinel"})
    private abstract static class AgentTaskResponseMixin {
    }

    @JsonIgnoreProperties({"orchestrator"})
    private abstract static class AgentRecordMixin {
    }

    private static final class MessageRoleSerializer extends JsonSerializer<MessageRole> {

        @Override
        public void serialize(MessageRole role, JsonGenerator generator, SerializerProvider provider) throws IOException {
            generator.writeString(role.wireValue());
        }
    }

    private static final class MessageRoleDeserializer extends JsonDeserializer<MessageRole> {

        @Override
        public MessageRole deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            try {
                return MessageRole.fromWireValue(parser.getValueAsString());
            } catch (IllegalArgumentException e) {
                return (MessageRole) context.handleWeirdStringValue(
                    MessageRole.class, parser.getValueAsString(), "%s", e.getMessage());
            }
        }
    }
}

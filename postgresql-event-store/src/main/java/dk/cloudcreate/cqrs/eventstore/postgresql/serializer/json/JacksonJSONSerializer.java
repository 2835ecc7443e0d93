package dk.cloudcreate.cqrs.eventstore.postgresql.serializer.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.cqrs.eventstore.eventstream.EventMetaData;

import java.util.Map;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jackson based {@link JSONSerializer}
 */
public class JacksonJSONSerializer implements JSONSerializer {
    private static final TypeReference<Map<String, String>> META_DATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JacksonJSONSerializer(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
    }

    /**
     * Create an {@link ObjectMapper} with support for the <code>java.time</code> types that writes dates as ISO-8601 strings
     * and ignores unknown properties when deserializing
     */
    public static ObjectMapper createDefaultObjectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule())
                                 .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                                 .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                                 .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public String serialize(Object objectToSerialize) {
        requireNonNull(objectToSerialize, "No objectToSerialize provided");
        try {
            return objectMapper.writeValueAsString(objectToSerialize);
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(msg("Failed to serialize {} to JSON", objectToSerialize.getClass().getName()), e);
        }
    }

    @Override
    public <T> T deserialize(String json, String javaType) {
        requireNonNull(javaType, "No javaType provided");
        return deserialize(json, resolveClass(javaType));
    }

    @Override
    public <T> T deserialize(String json, Class<T> javaType) {
        requireNonNull(json, "No json provided");
        requireNonNull(javaType, "No javaType provided");
        try {
            return objectMapper.readValue(json, javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize JSON to {}", javaType.getName()), e);
        }
    }

    @Override
    public String serializeMetaData(EventMetaData metaData) {
        requireNonNull(metaData, "No metaData provided");
        return serialize(metaData.asMap());
    }

    @Override
    public EventMetaData deserializeMetaData(String json) {
        requireNonNull(json, "No json provided");
        try {
            return EventMetaData.of(objectMapper.readValue(json, META_DATA_TYPE));
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException("Failed to deserialize JSON to EventMetaData", e);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> Class<T> resolveClass(String javaType) {
        var classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = JacksonJSONSerializer.class.getClassLoader();
        }
        try {
            return (Class<T>) Class.forName(javaType, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new JSONDeserializationException(msg("Failed to resolve Java type '{}'", javaType), e);
        }
    }
}

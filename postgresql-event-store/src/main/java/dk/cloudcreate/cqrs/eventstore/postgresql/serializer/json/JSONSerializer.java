package dk.cloudcreate.cqrs.eventstore.postgresql.serializer.json;

import dk.cloudcreate.cqrs.eventstore.eventstream.EventMetaData;

/**
 * JSON serializer and deserializer for event payloads, {@link EventMetaData} and snapshot state
 */
public interface JSONSerializer {
    /**
     * Serialize a java object to JSON
     *
     * @param objectToSerialize the java object that will be serialized to JSON
     * @return the JSON payload
     * @throws JSONSerializationException in case the <code>objectToSerialize</code> couldn't be serialized to JSON
     */
    String serialize(Object objectToSerialize);

    /**
     * Deserialize the payload in the <code>json</code> parameter into the Java type specified by the Fully Qualified Class Name contained
     * in the <code>javaType</code> parameter
     *
     * @param json     the json payload
     * @param javaType the Fully Qualified Class Name for the Java type that the json payload should be deserialized into
     * @param <T>      the corresponding Java type
     * @return the deserialized json payload
     * @throws JSONDeserializationException in case the json couldn't be deserialized to the specified java type
     */
    <T> T deserialize(String json, String javaType);

    /**
     * Deserialize the payload in the <code>json</code> parameter into the Java type specified by the <code>javaType</code> parameter
     *
     * @throws JSONDeserializationException in case the json couldn't be deserialized to the specified java type
     */
    <T> T deserialize(String json, Class<T> javaType);

    /**
     * @throws JSONSerializationException in case the <code>metaData</code> couldn't be serialized to JSON
     */
    String serializeMetaData(EventMetaData metaData);

    /**
     * @throws JSONDeserializationException in case the json couldn't be deserialized to {@link EventMetaData}
     */
    EventMetaData deserializeMetaData(String json);
}

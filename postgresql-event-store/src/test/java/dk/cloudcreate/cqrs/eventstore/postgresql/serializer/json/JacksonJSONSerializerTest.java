package dk.cloudcreate.cqrs.eventstore.postgresql.serializer.json;

import dk.cloudcreate.cqrs.common.types.CorrelationId;
import dk.cloudcreate.cqrs.eventstore.eventstream.EventMetaData;
import dk.cloudcreate.cqrs.eventstore.postgresql.test_data.ProductEvent;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class JacksonJSONSerializerTest {
    private final JacksonJSONSerializer serializer = new JacksonJSONSerializer(JacksonJSONSerializer.createDefaultObjectMapper());

    @Test
    void verify_that_an_event_can_be_deserialized_using_its_fully_qualified_class_name() {
        // Given
        var event = new ProductEvent.ProductDiscontinued("product-1", LocalDate.of(2023, 5, 17));
        var json  = serializer.serialize(event);

        // When
        ProductEvent deserialized = serializer.deserialize(json, ProductEvent.ProductDiscontinued.class.getName());

        // Then
        assertThat(json).contains("\"2023-05-17\"");
        assertThat(deserialized).isEqualTo(event);
    }

    @Test
    void verify_that_unknown_properties_are_ignored() {
        // Given
        var json = "{\"productId\":\"product-1\",\"name\":\"Chair\",\"price\":10.5,\"color\":\"red\"}";

        // When
        var deserialized = serializer.deserialize(json, ProductEvent.ProductAdded.class);

        // Then
        assertThat(deserialized).isEqualTo(new ProductEvent.ProductAdded("product-1", "Chair", new BigDecimal("10.5")));
    }

    @Test
    void verify_that_meta_data_survives_serialization() {
        // Given
        var metaData = EventMetaData.of("user", "alice").withCorrelationId(CorrelationId.of("correlation-1"));

        // When
        var deserialized = serializer.deserializeMetaData(serializer.serializeMetaData(metaData));

        // Then
        assertThat(deserialized).isEqualTo(metaData);
        assertThat(deserialized.correlationId()).contains(CorrelationId.of("correlation-1"));
    }

    @Test
    void verify_that_an_unknown_java_type_results_in_a_JSONDeserializationException() {
        assertThatThrownBy(() -> serializer.deserialize("{}", "com.example.DoesNotExist"))
                .isInstanceOf(JSONDeserializationException.class);
    }
}

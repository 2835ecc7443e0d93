package dk.cloudcreate.cqrs.eventstore.postgresql.test_data;

import java.math.BigDecimal;
import java.time.LocalDate;

public sealed interface ProductEvent {
    String productId();

    record ProductAdded(String productId, String name, BigDecimal price) implements ProductEvent {
    }

    record ProductDiscontinued(String productId, LocalDate discontinuedAt) implements ProductEvent {
    }
}

package dk.cloudcreate.cqrs.eventstore.postgresql.test_data;

import java.math.BigDecimal;

public record ProductState(String name, BigDecimal price, boolean discontinued) {
}

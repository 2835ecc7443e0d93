package dk.cloudcreate.cqrs.eventstore.inmemory;

public record AccountEvent(String description) {
}

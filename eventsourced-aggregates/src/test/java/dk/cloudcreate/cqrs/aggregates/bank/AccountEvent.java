package dk.cloudcreate.cqrs.aggregates.bank;

public sealed interface AccountEvent {
    record AccountOpened(long initialBalance) implements AccountEvent {
    }

    record AmountDeposited(long amount) implements AccountEvent {
    }

    record AmountWithdrawn(long amount) implements AccountEvent {
    }
}

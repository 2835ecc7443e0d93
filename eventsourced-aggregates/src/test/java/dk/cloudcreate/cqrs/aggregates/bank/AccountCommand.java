package dk.cloudcreate.cqrs.aggregates.bank;

public sealed interface AccountCommand {
    record OpenAccount(long initialBalance) implements AccountCommand {
    }

    record Deposit(long amount) implements AccountCommand {
    }

    record Withdraw(long amount) implements AccountCommand {
    }
}

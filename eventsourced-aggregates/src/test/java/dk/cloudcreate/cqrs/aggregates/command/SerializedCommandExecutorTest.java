package dk.cloudcreate.cqrs.aggregates.command;

import dk.cloudcreate.cqrs.aggregates.*;
import dk.cloudcreate.cqrs.aggregates.bank.*;
import dk.cloudcreate.cqrs.aggregates.bank.AccountCommand.*;
import dk.cloudcreate.cqrs.aggregates.dispatch.QueryProcessor;
import dk.cloudcreate.cqrs.eventstore.inmemory.InMemoryEventStore;
import dk.cloudcreate.cqrs.eventstore.types.EventOrder;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.*;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class SerializedCommandExecutorTest {
    private InMemoryEventStore<AccountEvent>                     eventStore;
    private InterceptingEventStore<AccountEvent>                 interceptingEventStore;
    private SerializedCommandExecutor<AccountCommand, AccountEvent> executor;

    @BeforeEach
    void setup() {
        eventStore = new InMemoryEventStore<>(BankAccount.ACCOUNTS);
        interceptingEventStore = new InterceptingEventStore<>(eventStore);
        // Without retries any concurrent handling of the same aggregate would surface as a ConcurrencyRetriesExhaustedException
        var commandProcessor = new CommandProcessor<>(new BankAccount(),
                                                      interceptingEventStore,
                                                      List.<QueryProcessor<AccountEvent>>of(),
                                                      Optional.empty(),
                                                      CommandProcessorConfiguration.builder()
                                                                                   .maxConcurrencyRetries(0)
                                                                                   .build());
        executor = new SerializedCommandExecutor<>(commandProcessor, 8);
        executor.start();
    }

    @AfterEach
    void cleanup() {
        executor.stop();
    }

    @Test
    void verify_that_commands_for_the_same_aggregate_are_handled_one_at_a_time_in_submission_order() throws Exception {
        // Given
        executor.submit("acct-1", new OpenAccount(0)).get(5, TimeUnit.SECONDS);

        // When
        var futures = IntStream.rangeClosed(1, 50)
                               .mapToObj(i -> executor.submit("acct-1", new Deposit(i)))
                               .collect(Collectors.toList());
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        // Then
        for (var i = 0; i < futures.size(); i++) {
            assertThat(futures.get(i).get().get(0).eventOrder()).isEqualTo(EventOrder.of(i + 2));
        }
        assertThat(eventStore.load("acct-1")).hasSize(51);
        await().atMost(Duration.ofSeconds(5)).until(() -> executor.numberOfActiveMailboxes() == 0);
    }

    @Test
    void verify_that_commands_for_different_aggregates_run_in_parallel() throws Exception {
        // Given
        var bothAppending = new CountDownLatch(2);
        interceptingEventStore.beforeEveryAppend(aggregateId -> {
            bothAppending.countDown();
            try {
                if (!bothAppending.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("The other aggregate was never handled concurrently");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        // When
        var first  = executor.submit("acct-1", new OpenAccount(1));
        var second = executor.submit("acct-2", new OpenAccount(2));

        // Then
        assertThat(first.get(10, TimeUnit.SECONDS)).hasSize(1);
        assertThat(second.get(10, TimeUnit.SECONDS)).hasSize(1);
    }

    @Test
    void verify_that_a_failing_command_fails_its_future_but_not_the_following_commands() throws Exception {
        // When
        var rejected = executor.submit("acct-1", new Deposit(10));
        var opened   = executor.submit("acct-1", new OpenAccount(0));

        // Then
        assertThatThrownBy(() -> rejected.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(CommandRejectedException.class);
        assertThat(opened.get(5, TimeUnit.SECONDS)).hasSize(1);
    }

    @Test
    void verify_that_submitting_to_a_stopped_executor_fails() {
        // Given
        executor.stop();

        // Then
        assertThat(executor.isStarted()).isFalse();
        assertThatThrownBy(() -> executor.submit("acct-1", new OpenAccount(0)))
                .isInstanceOf(IllegalStateException.class);
    }
}

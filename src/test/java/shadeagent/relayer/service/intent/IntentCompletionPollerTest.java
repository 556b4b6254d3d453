package shadeagent.relayer.service.intent;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import shadeagent.relayer.config.RelayerProperties;
import shadeagent.relayer.dto.intent.IntentState;
import shadeagent.relayer.dto.intent.IntentStatus;
import shadeagent.relayer.dto.intent.ValidatedIntent;
import shadeagent.relayer.service.persistence.IntentStatusPersistenceService;
import shadeagent.relayer.service.queue.IntentQueue;
import shadeagent.relayer.service.settlement.ExecutionStatus;
import shadeagent.relayer.service.settlement.SettlementClient;
import shadeagent.relayer.service.status.InMemoryIntentStatusStore;
import shadeagent.relayer.service.status.IntentStatusStore;
import shadeagent.relayer.support.MutableClock;
import shadeagent.relayer.support.TestIntents;

@ExtendWith(MockitoExtension.class)
@DisplayName("IntentCompletionPoller Tests")
class IntentCompletionPollerTest {

    private static final String BASE_URL = "http://settlement.test";

    @Mock
    private IntentQueue queue;

    @Mock
    private SettlementClient settlementClient;

    @Mock
    private IntentStatusPersistenceService persistenceService;

    private RelayerProperties properties;
    private IntentStatusStore statusStore;
    private IntentCompletionPoller poller;
    private ValidatedIntent intent;

    @BeforeEach
    void setUp() {
        properties = new RelayerProperties();
        properties.getSettlement().setBaseUrl(BASE_URL);
        statusStore = new InMemoryIntentStatusStore(persistenceService, properties);
        poller = new IntentCompletionPoller(statusStore, queue, settlementClient, properties, Clock.systemUTC());
        intent = TestIntents.kaminoDeposit("c1").toBuilder()
            .depositAddress("dep-1")
            .depositMemo("memo-1")
            .originTxHash("0xorigin")
            .build();
    }

    private void park(IntentState state, ValidatedIntent data, Instant since) {
        statusStore.setStatus("c1", IntentStatus.builder()
            .intentId("c1")
            .state(state)
            .attempt(1)
            .depositAddress(data != null ? data.getDepositAddress() : "dep-1")
            .depositMemo("memo-1")
            .intentData(data)
            .awaitingSince(since)
            .build());
    }

    private void settlementReports(String status) {
        when(settlementClient.getExecutionStatus(BASE_URL, "dep-1", "memo-1")).thenReturn(new ExecutionStatus(status));
    }

    private IntentStatus current() {
        return statusStore.getStatus("c1").orElseThrow();
    }

    @Nested
    @DisplayName("Completed settlement")
    class CompletedTests {

        @Test
        @DisplayName("Should re-enqueue the stored intent with only the completion flag added")
        void shouldResumeWithFlag() {
            park(IntentState.AWAITING_INTENTS, intent, Instant.now());
            settlementReports("SUCCESS");

            poller.pollAwaitingIntents();

            ArgumentCaptor<ValidatedIntent> resumed = ArgumentCaptor.forClass(ValidatedIntent.class);
            verify(queue).enqueue(resumed.capture());
            ValidatedIntent sent = resumed.getValue();
            assertTrue(sent.externallySettled());
            assertEquals(intent.withMetadataValue(ValidatedIntent.INTENTS_COMPLETED, true), sent);
            assertEquals("kamino-deposit", sent.actionName());
            assertEquals(IntentState.PROCESSING, current().getState());
            assertEquals("Intents swap completed, resuming execution", current().getDetail());
        }

        @Test
        @DisplayName("Should accept 'completed' as a success status")
        void shouldAcceptCompletedStatus() {
            park(IntentState.AWAITING_INTENTS, intent, Instant.now());
            settlementReports("completed");

            poller.pollAwaitingIntents();

            verify(queue).enqueue(any());
        }

        @Test
        @DisplayName("Should fail when the stored intent data is missing")
        void shouldFailWithoutIntentData() {
            park(IntentState.AWAITING_INTENTS, null, Instant.now());
            settlementReports("success");

            poller.pollAwaitingIntents();

            assertEquals(IntentState.FAILED, current().getState());
            assertEquals("missing intent data", current().getError());
            verify(queue, never()).enqueue(any());
        }

        @Test
        @DisplayName("Should resume only once across consecutive ticks")
        void shouldResumeOnce() {
            park(IntentState.AWAITING_INTENTS, intent, Instant.now());
            settlementReports("success");

            poller.pollAwaitingIntents();
            poller.pollAwaitingIntents();

            verify(queue).enqueue(any());
        }
    }

    @Nested
    @DisplayName("Failed settlement")
    class FailedTests {

        @Test
        @DisplayName("Should fail a refunded swap and never re-enqueue it")
        void shouldFailRefunded() {
            park(IntentState.AWAITING_INTENTS, intent, Instant.now());
            settlementReports("REFUNDED");

            poller.pollAwaitingIntents();

            assertEquals(IntentState.FAILED, current().getState());
            assertEquals("Intents swap refunded", current().getError());
            verify(queue, never()).enqueue(any());
        }

        @Test
        @DisplayName("Should fail a failed swap")
        void shouldFailFailed() {
            park(IntentState.AWAITING_INTENTS, intent, Instant.now());
            settlementReports("failed");

            poller.pollAwaitingIntents();

            assertEquals("Intents swap failed", current().getError());
        }
    }

    @Nested
    @DisplayName("Still waiting")
    class WaitingTests {

        @Test
        @DisplayName("Should keep waiting on pending and unknown statuses")
        void shouldKeepWaiting() {
            park(IntentState.AWAITING_INTENTS, intent, Instant.now());
            when(settlementClient.getExecutionStatus(BASE_URL, "dep-1", "memo-1"))
                .thenReturn(new ExecutionStatus("PENDING_DEPOSIT"))
                .thenReturn(new ExecutionStatus("weird_status"));

            poller.pollAwaitingIntents();
            poller.pollAwaitingIntents();

            assertEquals(IntentState.AWAITING_INTENTS, current().getState());
            verify(queue, never()).enqueue(any());
        }

        @Test
        @DisplayName("Should promote a detected deposit to awaiting intents")
        void shouldPromoteDetectedDeposit() {
            park(IntentState.AWAITING_DEPOSIT, intent, Instant.now());
            settlementReports("KNOWN_DEPOSIT_TX");

            poller.pollAwaitingIntents();

            assertEquals(IntentState.AWAITING_INTENTS, current().getState());
            verify(queue, never()).enqueue(any());
        }

        @Test
        @DisplayName("Should keep polling after a settlement error")
        void shouldSurviveSettlementErrors() {
            park(IntentState.AWAITING_INTENTS, intent, Instant.now());
            when(settlementClient.getExecutionStatus(anyString(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("timeout"))
                .thenReturn(new ExecutionStatus("success"));

            poller.pollAwaitingIntents();
            assertEquals(IntentState.AWAITING_INTENTS, current().getState());

            poller.pollAwaitingIntents();
            verify(queue).enqueue(any());
        }

        @Test
        @DisplayName("Should skip intents without a deposit address")
        void shouldSkipWithoutDepositAddress() {
            statusStore.setStatus("c1", IntentStatus.builder()
                .intentId("c1")
                .state(IntentState.AWAITING_INTENTS)
                .intentData(intent)
                .awaitingSince(Instant.now())
                .build());

            poller.pollAwaitingIntents();

            verifyNoInteractions(settlementClient);
        }
    }

    @Test
    @DisplayName("Should fail an intent that waited past the maximum")
    void shouldTimeOut() {
        Instant since = Instant.now();
        park(IntentState.AWAITING_INTENTS, intent, since);
        MutableClock later = new MutableClock(since.plus(Duration.ofMillis(properties.getPoller().getMaxWaitMs())));
        later.advance(Duration.ofSeconds(1));
        IntentCompletionPoller timed = new IntentCompletionPoller(statusStore, queue, settlementClient, properties, later);

        timed.pollAwaitingIntents();

        assertEquals(IntentState.FAILED, current().getState());
        assertEquals("Settlement timed out after 3600s", current().getError());
        assertEquals(IntentCompletionPoller.TIMEOUT_DETAIL, current().getDetail());
        verifyNoInteractions(settlementClient);
    }

    @Test
    @DisplayName("Should do nothing when disabled")
    void shouldDoNothingWhenDisabled() {
        properties.getPoller().setEnabled(false);
        park(IntentState.AWAITING_INTENTS, intent, Instant.now());

        poller.pollAwaitingIntents();

        verifyNoInteractions(settlementClient, queue);
    }
}

package com.flagship.split_ledger.reconciliation;

import com.flagship.split_ledger.config.JacksonConfig;
import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.group.NotAGroupMemberException;
import com.flagship.split_ledger.mirror.MirrorSettlementEvent;
import com.flagship.split_ledger.money.Money;
import com.flagship.split_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for MirrorEventConsumer.
 *
 * Verifies that:
 * 1. DebtSettled events reach the reconciler and are acknowledged afterwards
 * 2. Unknown and malformed messages are acknowledged and skipped
 * 3. Failures leave the message unacknowledged for redelivery
 */
@ExtendWith(MockitoExtension.class)
class MirrorEventConsumerTest {

    private static final String DEBTOR = "0x000000000000000000000000000000000000000b";
    private static final String CREDITOR = "0x000000000000000000000000000000000000000a";

    @Mock
    private SettlementReconciler settlementReconciler;

    @Mock
    private Acknowledgment ack;

    private SimpleMeterRegistry meterRegistry;
    private MirrorEventConsumer consumer;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        consumer = new MirrorEventConsumer(settlementReconciler, new JacksonConfig().objectMapper(),
            new LedgerMetrics(meterRegistry));
    }

    private static ConsumerRecord<String, String> record(String json) {
        return new ConsumerRecord<>("mirror-events", 0, 0L, "1", json);
    }

    private static String debtSettled(String reference) {
        return String.format("""
            {"eventType":"DebtSettled","groupId":1,"debtor":"%s","creditor":"%s",
             "amount":"50000000000000000000","transferReference":"%s",
             "occurredAt":"2024-05-01T10:15:30Z","blockNumber":19000000}
            """, DEBTOR, CREDITOR, reference);
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("DebtSettled payload maps onto a settlement event")
        void parsesDebtSettled() {
            printTestHeader("Parse DebtSettled");

            MirrorEventConsumer.ParsedEvent parsed = consumer.parseEvent(debtSettled("0x01"));

            assertNotNull(parsed);
            assertEquals("DebtSettled", parsed.eventType());
            MirrorSettlementEvent event = parsed.event();
            assertEquals(1L, event.getGroupId());
            assertEquals(Member.of(DEBTOR), event.getDebtor());
            assertEquals(Member.of(CREDITOR), event.getCreditor());
            assertEquals(Money.parseUnits("50000000000000000000"), event.getAmount());
            assertEquals("0x01", event.getTransferReference());
            assertEquals(Instant.parse("2024-05-01T10:15:30Z"), event.getOccurredAt());
            printSuccess("Unknown fields ignored, amount kept exact");
        }

        @Test
        @DisplayName("Other event types carry no settlement")
        void otherEventType() {
            MirrorEventConsumer.ParsedEvent parsed =
                consumer.parseEvent("{\"eventType\":\"ExpenseAdded\",\"groupId\":1}");

            assertNotNull(parsed);
            assertEquals("ExpenseAdded", parsed.eventType());
            assertNull(parsed.event());
        }

        @Test
        @DisplayName("Malformed JSON and incomplete payloads are unparseable")
        void malformed() {
            assertNull(consumer.parseEvent("not json"));
            assertNull(consumer.parseEvent("{\"eventType\":\"DebtSettled\",\"groupId\":1}"));
            assertNull(consumer.parseEvent(debtSettled("0x01").replace(DEBTOR, "alice")));
        }
    }

    @Nested
    @DisplayName("Consuming")
    class Consuming {

        @Test
        @DisplayName("DebtSettled is reconciled, then acknowledged")
        void reconcilesAndAcknowledges() {
            printTestHeader("Consume DebtSettled");
            when(settlementReconciler.apply(any())).thenReturn(SettlementReconciler.Outcome.RECORDED);

            consumer.consume(record(debtSettled("0x01")), ack);

            ArgumentCaptor<MirrorSettlementEvent> captor = ArgumentCaptor.forClass(MirrorSettlementEvent.class);
            verify(settlementReconciler).apply(captor.capture());
            assertEquals("0x01", captor.getValue().getTransferReference());
            verify(ack).acknowledge();
            printSuccess("Acknowledged after reconciliation");
        }

        @Test
        @DisplayName("Redelivered event is acknowledged as already recorded")
        void redelivery() {
            when(settlementReconciler.apply(any())).thenReturn(SettlementReconciler.Outcome.ALREADY_RECORDED);

            consumer.consume(record(debtSettled("0x01")), ack);

            verify(ack).acknowledge();
        }

        @Test
        @DisplayName("Unknown event types are skipped")
        void skipsUnknownType() {
            consumer.consume(record("{\"eventType\":\"GroupCreated\",\"groupId\":7}"), ack);

            verifyNoInteractions(settlementReconciler);
            verify(ack).acknowledge();
        }

        @Test
        @DisplayName("Malformed messages are skipped rather than redelivered forever")
        void skipsMalformed() {
            consumer.consume(record("{{{"), ack);

            verifyNoInteractions(settlementReconciler);
            verify(ack).acknowledge();
        }

        @Test
        @DisplayName("A failing event is not acknowledged and the error propagates")
        void failureLeavesMessageUnacknowledged() {
            printTestHeader("Consume failure");
            when(settlementReconciler.apply(any()))
                .thenThrow(new NotAGroupMemberException(1L, Member.of(DEBTOR)));

            assertThrows(NotAGroupMemberException.class,
                () -> consumer.consume(record(debtSettled("0x02")), ack));

            verify(ack, never()).acknowledge();
            assertEquals(1.0, meterRegistry.counter("event.processing.failure",
                "event_type", "DebtSettled", "error", "NotAGroupMemberException").count());
            printSuccess("Left for redelivery");
        }
    }
}

package com.flagship.split_ledger.reconciliation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.mirror.MirrorSettlementEvent;
import com.flagship.split_ledger.money.Money;
import com.flagship.split_ledger.observability.CorrelationContext;
import com.flagship.split_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Kafka consumer for mirror contract events.
 *
 * This consumer:
 * 1. Receives events from the mirror-events topic
 * 2. Parses the JSON payload
 * 3. Hands DebtSettled events to the {@link SettlementReconciler}
 * 4. Acknowledges only after the settlement is on the ledger
 *
 * Redelivery is safe: the reconciler records each transfer reference once, so a replayed
 * message resolves to ALREADY_RECORDED. Messages that cannot be parsed are acknowledged
 * and skipped, since redelivering them can never succeed.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MirrorEventConsumer {

    private final SettlementReconciler settlementReconciler;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics ledgerMetrics;

    @KafkaListener(
        topics = "${kafka.topic.mirror-events:mirror-events}",
        groupId = "${spring.kafka.consumer.group-id:split-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        try (CorrelationContext.Scope ignored = CorrelationContext.open(correlationIdOf(record))) {
            handle(record, ack);
        }
    }

    private void handle(ConsumerRecord<String, String> record, Acknowledgment ack) {
        try {
            ParsedEvent parsed = parseEvent(record.value());

            if (parsed == null) {
                log.warn("Could not parse event, acknowledging to skip: offset={}", record.offset());
                ack.acknowledge();
                return;
            }

            if (!MirrorSettlementEvent.EVENT_TYPE.equals(parsed.eventType())) {
                log.debug("Ignoring mirror event type: {}", parsed.eventType());
                ack.acknowledge();
                return;
            }

            SettlementReconciler.Outcome outcome = settlementReconciler.apply(parsed.event());
            ack.acknowledge();

            log.info("Processed mirror event: type={}, reference={}, outcome={}",
                    parsed.eventType(), parsed.event().getTransferReference(), outcome);

        } catch (RuntimeException e) {
            ledgerMetrics.recordEventProcessingFailure(MirrorSettlementEvent.EVENT_TYPE, e.getClass().getSimpleName());
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            // Not acknowledged: the message will be redelivered
            throw e;
        }
    }

    /**
     * Parses a mirror event. Returns {@code null} if the payload is malformed or a
     * DebtSettled payload is missing fields.
     */
    ParsedEvent parseEvent(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            String eventType = node.path("eventType").asText("Unknown");
            if (!MirrorSettlementEvent.EVENT_TYPE.equals(eventType)) {
                return new ParsedEvent(eventType, null);
            }

            MirrorSettlementEvent event = new MirrorSettlementEvent(
                node.get("groupId").asLong(),
                Member.of(node.get("debtor").asText()),
                Member.of(node.get("creditor").asText()),
                Money.parseUnits(node.get("amount").asText()),
                node.get("transferReference").asText(),
                node.hasNonNull("occurredAt") ? Instant.parse(node.get("occurredAt").asText()) : Instant.now()
            );
            return new ParsedEvent(eventType, event);

        } catch (Exception e) {
            log.error("Failed to parse mirror event: {}", e.getMessage());
            return null;
        }
    }

    private static String correlationIdOf(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        if (header == null || header.value() == null) {
            return null;
        }
        return new String(header.value(), StandardCharsets.UTF_8);
    }

    record ParsedEvent(String eventType, MirrorSettlementEvent event) {}
}

package com.flagship.split_ledger.settlement;

import com.flagship.split_ledger.expense.ExpenseService;
import com.flagship.split_ledger.group.GroupService;
import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.ledger.BalanceQueryService;
import com.flagship.split_ledger.ledger.BalanceSnapshot;
import com.flagship.split_ledger.money.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Settlement recording against a real PostgreSQL database.
 *
 * These tests verify:
 * - A transfer reference is recorded at most once, also under concurrent reports
 * - Settlements reduce debt in the computed balances
 * - Stored settlements cannot be changed or removed
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class SettlementLedgerIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("test_split_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No Kafka or Redis for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("kafka.topic.auto-create", () -> "false");
        registry.add("ledger.reference-cache.enabled", () -> "false");
    }

    @Autowired
    private SettlementLedgerService settlementLedgerService;

    @Autowired
    private SettlementRepository settlementRepository;

    @Autowired
    private GroupService groupService;

    @Autowired
    private ExpenseService expenseService;

    @Autowired
    private BalanceQueryService balanceQueryService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final Member alice = randomMember();
    private final Member bob = randomMember();
    private final Member charlie = randomMember();
    private long groupId;

    private static Member randomMember() {
        String hex = UUID.randomUUID().toString().replace("-", "");
        return Member.of("0x" + hex + hex.substring(0, 8));
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        groupId = groupService.createGroup("Trip", alice, List.of(bob, charlie));
    }

    @Test
    @DisplayName("Re-recording a reference fails and leaves one stored settlement")
    void replayedReferenceIsDuplicate() {
        printTestHeader("Replayed transfer reference");
        String ref = "tx-" + UUID.randomUUID();
        expenseService.addExpense(groupId, alice, Money.ofUnits(150), "Dinner", List.of(alice, bob, charlie));

        Settlement first = settlementLedgerService.recordSettlement(groupId, bob, alice, Money.ofUnits(50), ref);

        DuplicateReferenceException e = assertThrows(DuplicateReferenceException.class,
            () -> settlementLedgerService.recordSettlement(groupId, bob, alice, Money.ofUnits(50), ref));
        assertEquals(Optional.of(first.getId()), e.getExistingSettlementId());
        assertEquals(1L, settlementRepository.countByGroupId(groupId));

        BalanceSnapshot balances = balanceQueryService.getBalances(groupId);
        printOutput("Balances", balances);
        assertEquals(Money.ofUnits(50), balances.balanceOf(alice));
        assertEquals(Money.ZERO, balances.balanceOf(bob));
        assertEquals(Money.ofUnits(-50), balances.balanceOf(charlie));
        assertEquals(Money.ZERO, balances.total());
        printSuccess("Settlement applied once");
    }

    @Test
    @DisplayName("Concurrent reports of one transfer record exactly one settlement")
    void concurrentReportsRecordOnce() throws Exception {
        printTestHeader("Concurrent reports of one transfer");
        String ref = "tx-" + UUID.randomUUID();
        int threads = 8;

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger recorded = new AtomicInteger();
        AtomicInteger duplicates = new AtomicInteger();
        AtomicInteger errors = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    settlementLedgerService.recordSettlement(groupId, bob, alice, Money.ofUnits(10), ref);
                    recorded.incrementAndGet();
                } catch (DuplicateReferenceException e) {
                    duplicates.incrementAndGet();
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Recorded", recorded.get());
        printOutput("Duplicates", duplicates.get());
        assertEquals(1, recorded.get());
        assertEquals(threads - 1, duplicates.get());
        assertEquals(0, errors.get());
        assertEquals(1L, settlementRepository.countByGroupId(groupId));
        assertTrue(settlementLedgerService.findByExternalRef(ref).isPresent());
        printSuccess("Exactly one settlement stored");
    }

    @Test
    @DisplayName("Settlements without a reference are recorded every time")
    void unreferencedSettlementsAreNotDeduplicated() {
        settlementLedgerService.recordSettlement(groupId, bob, alice, Money.ofUnits(5), null);
        settlementLedgerService.recordSettlement(groupId, bob, alice, Money.ofUnits(5), "");

        assertEquals(2L, settlementRepository.countByGroupId(groupId));
        assertEquals(2, settlementLedgerService.listSettlements(groupId).size());
    }

    @Test
    @DisplayName("Stored settlements can be neither updated nor deleted")
    void settlementsAreAppendOnly() {
        Settlement stored = settlementLedgerService.recordSettlement(
            groupId, bob, alice, Money.ofUnits(5), "tx-" + UUID.randomUUID());

        assertThrows(DataAccessException.class, () ->
            jdbcTemplate.update("UPDATE settlements SET amount = 1 WHERE id = ?", stored.getId()));
        assertThrows(DataAccessException.class, () ->
            jdbcTemplate.update("DELETE FROM settlements WHERE id = ?", stored.getId()));

        assertEquals(Money.ofUnits(5), settlementLedgerService.listSettlements(groupId).get(0).getAmount());
    }
}

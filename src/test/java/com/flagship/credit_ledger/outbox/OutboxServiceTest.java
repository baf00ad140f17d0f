package com.flagship.credit_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.ledger.AccountService;
import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.ledger.LedgerEventKind;
import com.flagship.credit_ledger.ledger.LedgerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.IllegalTransactionStateException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox rows are written with the ledger change that causes them.
 */
@SpringBootTest
class OutboxServiceTest {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("A ledger credit writes one BalanceChanged event for the account")
    void creditWritesOutboxEvent() throws Exception {
        UUID accountId = accountService.getOrCreate("outbox-" + UUID.randomUUID()).getId();
        String reference = "outbox-tx-" + accountId;

        ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal("12.50"), LedgerEventKind.DEPOSIT_CREDIT, reference);
        ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal("12.50"), LedgerEventKind.DEPOSIT_CREDIT, reference);

        List<OutboxEvent> events = outboxService.getEventsForAggregate("Account", accountId);
        assertEquals(1, events.size(), "Repeated posting must not publish again");

        OutboxEvent event = events.get(0);
        assertEquals("BalanceChanged", event.getEventType());
        assertFalse(event.isPublished());
        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertEquals(reference, payload.path("externalReference").asText());
        assertEquals("DEPOSIT_CREDIT", payload.path("kind").asText());
    }

    @Test
    @DisplayName("Failures increment the retry count, publishing stamps the event")
    void markFailedThenPublished() {
        UUID accountId = accountService.getOrCreate("outbox-" + UUID.randomUUID()).getId();
        ledgerService.credit(accountId, Asset.CREDITS, BigDecimal.TEN, LedgerEventKind.VOUCHER_CREDIT, "outbox-v-" + accountId);
        UUID eventId = outboxService.getEventsForAggregate("Account", accountId).get(0).getId();

        outboxService.markFailed(eventId, "broker down");
        outboxService.markFailed(eventId, "broker down");
        OutboxEvent failed = outboxService.getEventsForAggregate("Account", accountId).get(0);
        assertEquals(2, failed.getRetryCount());
        assertEquals("broker down", failed.getLastError());

        outboxService.markPublished(eventId);
        assertTrue(outboxService.getEventsForAggregate("Account", accountId).get(0).isPublished());
    }

    @Test
    @DisplayName("Saving an event outside a transaction is refused")
    void saveRequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class, () ->
                outboxService.saveEvent("Account", UUID.randomUUID(), "BalanceChanged", Map.of("k", "v")));
    }
}

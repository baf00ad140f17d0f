package com.flagship.credit_ledger.coordinator;

import com.flagship.credit_ledger.conversion.ConversionDebit;
import com.flagship.credit_ledger.conversion.ConversionDebitRepository;
import com.flagship.credit_ledger.conversion.ConversionDebitService;
import com.flagship.credit_ledger.conversion.ConversionDebitStatus;
import com.flagship.credit_ledger.conversion.ConversionProvider;
import com.flagship.credit_ledger.conversion.IdempotencyKeyConflictException;
import com.flagship.credit_ledger.conversion.InvalidInstallationIdException;
import com.flagship.credit_ledger.conversion.ProviderUnavailableException;
import com.flagship.credit_ledger.conversion.ReservationExpiredException;
import com.flagship.credit_ledger.ledger.AccountService;
import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.ledger.InsufficientFundsException;
import com.flagship.credit_ledger.ledger.LedgerEvent;
import com.flagship.credit_ledger.ledger.LedgerEventKind;
import com.flagship.credit_ledger.ledger.LedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Reserve, call the provider, then finalize or release.
 */
@SpringBootTest
class ConversionCoordinatorTest {

    private static final String INSTALLATION_ID = "1234567".repeat(9);
    private static final String CONFIRMATION_ID = "111111-222222-333333-444444";

    @Autowired
    private ConversionCoordinator coordinator;

    @Autowired
    private ConversionDebitService debitService;

    @Autowired
    private ConversionDebitRepository debitRepository;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private ConversionProvider provider;

    private String userKey;
    private UUID accountId;
    private String idempotencyKey;

    @BeforeEach
    void setUp() {
        userKey = "converter-" + UUID.randomUUID();
        accountId = accountService.getOrCreate(userKey).getId();
        ledgerService.credit(accountId, Asset.CREDITS, new BigDecimal("3"), LedgerEventKind.PACKAGE_CREDIT,
                "seed-" + accountId);
        idempotencyKey = UUID.randomUUID().toString();
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private BigDecimal credits() {
        return ledgerService.balance(accountId, Asset.CREDITS);
    }

    @Nested
    @DisplayName("1. Outcomes")
    class Outcomes {

        @Test
        @DisplayName("1.1 Successful conversion finalizes the reservation and keeps the debit")
        void successFinalizes() {
            when(provider.convert(INSTALLATION_ID)).thenReturn(CONFIRMATION_ID);

            ConversionDebit debit = coordinator.convert(userKey, INSTALLATION_ID, idempotencyKey);

            printOutput("Debit", debit);
            assertEquals(ConversionDebitStatus.FINALIZED, debit.getStatus());
            assertEquals(CONFIRMATION_ID, debit.getConfirmationId());
            assertEquals(0, credits().compareTo(new BigDecimal("2")));
            assertTrue(ledgerService.isConserved(accountId, Asset.CREDITS));
        }

        @Test
        @DisplayName("1.2 Provider unavailable after retries releases the reservation")
        void providerUnavailableReleases() {
            when(provider.convert(anyString())).thenThrow(new ProviderUnavailableException("HTTP 503"));

            ConversionDebit debit = coordinator.convert(userKey, INSTALLATION_ID, idempotencyKey);

            assertEquals(ConversionDebitStatus.RELEASED, debit.getStatus());
            assertNotNull(debit.getFailureReason());
            assertEquals(0, credits().compareTo(new BigDecimal("3")), "Reserved credit must be refunded");
            assertTrue(ledgerService.findEvent(LedgerEventKind.REFUND, debit.ledgerReference()).isPresent());
            verify(provider, times(3)).convert(INSTALLATION_ID);
        }

        @Test
        @DisplayName("1.3 Provider refusing the id releases without retrying")
        void providerRefusalReleases() {
            when(provider.convert(anyString())).thenThrow(new InvalidInstallationIdException("blocked"));

            ConversionDebit debit = coordinator.convert(userKey, INSTALLATION_ID, idempotencyKey);

            assertEquals(ConversionDebitStatus.RELEASED, debit.getStatus());
            assertEquals(0, credits().compareTo(new BigDecimal("3")));
            verify(provider, times(1)).convert(INSTALLATION_ID);
        }

        @Test
        @DisplayName("1.4 Unexpected failure releases and propagates")
        void unexpectedFailureReleases() {
            when(provider.convert(anyString())).thenThrow(new IllegalStateException("boom"));

            assertThrows(IllegalStateException.class, () -> coordinator.convert(userKey, INSTALLATION_ID, idempotencyKey));

            ConversionDebit debit = debitRepository.findByIdempotencyKey(idempotencyKey).orElseThrow().toDomain();
            assertEquals(ConversionDebitStatus.RELEASED, debit.getStatus());
            assertEquals(0, credits().compareTo(new BigDecimal("3")));
        }
    }

    @Nested
    @DisplayName("2. Input and balance checks")
    class Checks {

        @Test
        @DisplayName("2.1 Malformed installation id reserves nothing")
        void malformedIdReservesNothing() {
            assertThrows(InvalidInstallationIdException.class, () ->
                    coordinator.convert(userKey, "12345", idempotencyKey));

            assertTrue(debitRepository.findByIdempotencyKey(idempotencyKey).isEmpty());
            assertEquals(0, credits().compareTo(new BigDecimal("3")));
            verifyNoInteractions(provider);
        }

        @Test
        @DisplayName("2.2 Conversion without credits fails before calling the provider")
        void noCreditsNoConversion() {
            String broke = "broke-" + UUID.randomUUID();

            assertThrows(InsufficientFundsException.class, () ->
                    coordinator.convert(broke, INSTALLATION_ID, UUID.randomUUID().toString()));
            verifyNoInteractions(provider);
        }
    }

    @Test
    @DisplayName("Replaying an idempotency key returns the original result without a second debit")
    void idempotentReplay() {
        when(provider.convert(INSTALLATION_ID)).thenReturn(CONFIRMATION_ID);

        ConversionDebit first = coordinator.convert(userKey, INSTALLATION_ID, idempotencyKey);
        ConversionDebit replay = coordinator.convert(userKey, INSTALLATION_ID, idempotencyKey);

        assertEquals(first.getRequestId(), replay.getRequestId());
        assertEquals(ConversionDebitStatus.FINALIZED, replay.getStatus());
        assertEquals(0, credits().compareTo(new BigDecimal("2")));
        verify(provider, times(1)).convert(INSTALLATION_ID);
    }

    @Test
    @DisplayName("Provider answering after the reservation was released is reported, not charged")
    void answerAfterReleaseIsNotCharged() {
        when(provider.convert(INSTALLATION_ID)).thenAnswer(invocation -> {
            UUID requestId = debitRepository.findByIdempotencyKey(idempotencyKey).orElseThrow().getRequestId();
            debitService.release(requestId, "reservation timed out");
            return CONFIRMATION_ID;
        });

        assertThrows(ReservationExpiredException.class, () ->
                coordinator.convert(userKey, INSTALLATION_ID, idempotencyKey));

        ConversionDebit debit = debitRepository.findByIdempotencyKey(idempotencyKey).orElseThrow().toDomain();
        assertEquals(ConversionDebitStatus.RELEASED, debit.getStatus());
        assertEquals(0, credits().compareTo(new BigDecimal("3")));
    }

    @Test
    @DisplayName("Finalize and release are idempotent on terminal debits")
    void terminalTransitionsAreIdempotent() {
        when(provider.convert(INSTALLATION_ID)).thenReturn(CONFIRMATION_ID);
        ConversionDebit finalized = coordinator.convert(userKey, INSTALLATION_ID, idempotencyKey);

        ConversionDebit again = debitService.finalizeDebit(finalized.getRequestId(), "other");
        assertEquals(CONFIRMATION_ID, again.getConfirmationId());
        assertThrows(IllegalStateException.class, () -> debitService.release(finalized.getRequestId(), "late"));
        assertEquals(0, credits().compareTo(new BigDecimal("2")));
    }

    @Test
    @DisplayName("Another account replaying an idempotency key is refused and is not shown the original result")
    void keyReplayedByAnotherAccountConflicts() {
        when(provider.convert(INSTALLATION_ID)).thenReturn(CONFIRMATION_ID);
        coordinator.convert(userKey, INSTALLATION_ID, idempotencyKey);

        String other = "other-converter-" + UUID.randomUUID();
        UUID otherId = accountService.getOrCreate(other).getId();
        ledgerService.credit(otherId, Asset.CREDITS, new BigDecimal("3"), LedgerEventKind.PACKAGE_CREDIT,
                "seed-" + otherId);

        assertThrows(IdempotencyKeyConflictException.class, () ->
                coordinator.convert(other, INSTALLATION_ID, idempotencyKey));
        assertThrows(IdempotencyKeyConflictException.class, () ->
                coordinator.convert("unknown-" + UUID.randomUUID(), INSTALLATION_ID, idempotencyKey));

        assertEquals(0, ledgerService.balance(otherId, Asset.CREDITS).compareTo(new BigDecimal("3")));
        assertEquals(0, credits().compareTo(new BigDecimal("2")));
        verify(provider, times(1)).convert(INSTALLATION_ID);
    }

    @Test
    @DisplayName("Sweep releases a timed-out reservation and restores it exactly despite unrelated postings")
    void sweepReleasesStaleReservation() {
        UUID requestId = UUID.randomUUID();
        debitService.reserve(requestId, accountId, INSTALLATION_ID, BigDecimal.ONE, idempotencyKey);
        assertEquals(0, credits().compareTo(new BigDecimal("2")));

        ledgerService.credit(accountId, Asset.CREDITS, new BigDecimal("10"), LedgerEventKind.PACKAGE_CREDIT,
                "unrelated-credit-" + requestId);
        ledgerService.debit(accountId, Asset.CREDITS, new BigDecimal("4"), LedgerEventKind.DEBIT,
                "unrelated-debit-" + requestId);
        jdbcTemplate.update("UPDATE conversion_debits SET created_at = ? WHERE request_id = ?",
                Timestamp.from(Instant.now().minus(Duration.ofHours(1))), requestId);

        int released = coordinator.releaseStaleReservations(1000);

        ConversionDebit debit = debitService.find(requestId).orElseThrow();
        printOutput("Swept debit", debit);
        assertTrue(released >= 1);
        assertEquals(ConversionDebitStatus.RELEASED, debit.getStatus());
        LedgerEvent refund = ledgerService.findEvent(LedgerEventKind.REFUND, debit.ledgerReference()).orElseThrow();
        assertEquals(0, refund.getAmount().compareTo(BigDecimal.ONE));
        assertEquals(0, credits().compareTo(new BigDecimal("9")), "3 seeded + 10 credited - 4 debited");
        assertTrue(ledgerService.isConserved(accountId, Asset.CREDITS));

        assertEquals(0, coordinator.releaseStaleReservations(1000), "Nothing left to release");
        verifyNoInteractions(provider);
    }
}

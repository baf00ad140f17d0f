package com.flagship.credit_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class AccountServiceTest {

    @Autowired
    private AccountService accountService;

    @Test
    @DisplayName("Concurrent first interactions create a single account")
    void concurrentGetOrCreateYieldsOneAccount() throws InterruptedException {
        String userKey = "first-contact-" + UUID.randomUUID();
        int threadCount = 8;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        Set<UUID> ids = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    ids.add(accountService.getOrCreate(userKey).getId());
                } catch (Exception e) {
                    System.out.println("Unexpected failure: " + e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, ids.size(), "Every caller should see the same account");
    }

    @Test
    @DisplayName("New accounts start active with zero balances")
    void newAccountStartsEmpty() {
        Account account = accountService.getOrCreate("  fresh-" + UUID.randomUUID() + "  ");

        assertEquals(AccountStatus.ACTIVE, account.getStatus());
        assertEquals(0, account.getFundsBalance().signum());
        assertEquals(0, account.getCreditBalance().signum());
        assertFalse(account.getUserKey().startsWith(" "));
    }

    @Test
    @DisplayName("Looking up an unknown user key fails with AccountNotFoundException")
    void unknownUserKey() {
        assertThrows(AccountNotFoundException.class, () -> accountService.require("missing-" + UUID.randomUUID()));
    }
}

package com.tidewaysystems.test;

import com.tidewaysystems.message.MessageMetadata;
import com.tidewaysystems.test.Ledger.Account;
import com.tidewaysystems.test.Ledger.AccountOpened;
import com.tidewaysystems.test.Ledger.Deposit;
import com.tidewaysystems.test.Ledger.Deposited;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AggregateFixtureTest {

    private static AccountOpened opened() {
        return new AccountOpened(MessageMetadata.create(), "acc-1");
    }

    private static Deposit deposit(long amount) {
        return new Deposit(MessageMetadata.create(), "acc-1", amount);
    }

    @Test
    void testGivenWhenExpectEvents() {
        AggregateFixture<Account> fixture = AggregateFixture.of(Account::new, "acc-1")
            .given(opened(), new Deposited(MessageMetadata.create(), "acc-1", 5))
            .when(account -> account.deposit(deposit(10)))
            .expectEventTypes(Deposited.class);

        assertEquals(15, fixture.aggregate().balance());
        assertEquals(2, fixture.aggregate().persistedVersion());
        assertEquals(2, fixture.history().size());
        assertEquals(10, ((Deposited) fixture.pendingEvents().get(0)).amount());
    }

    @Test
    void testExpectNoEvents() {
        AggregateFixture.of(Account::new, "acc-1")
            .given(opened())
            .when(account -> account.deposit(deposit(0)))
            .expectNoEvents();
    }

    @Test
    void testExpectException() {
        IllegalStateException e = AggregateFixture.of(Account::new, "acc-1")
            .when(account -> account.deposit(deposit(10)))
            .expectException(IllegalStateException.class);

        assertTrue(e.getMessage().contains("not open"));
    }

    @Test
    void testMismatchesReported() {
        AggregateFixture<Account> succeeded = AggregateFixture.of(Account::new, "acc-1")
            .given(opened())
            .when(account -> account.deposit(deposit(10)));
        assertThrows(AssertionError.class, succeeded::expectNoEvents);
        assertThrows(AssertionError.class, () -> succeeded.expectException(IllegalStateException.class));

        AggregateFixture<Account> failed = AggregateFixture.of(Account::new, "acc-1")
            .when(account -> account.deposit(deposit(10)));
        assertThrows(AssertionError.class, () -> failed.expectEventTypes(Deposited.class));
        assertThrows(AssertionError.class, () -> failed.expectException(IllegalArgumentException.class));
    }

    @Test
    void testGivenAfterWhenRejected() {
        AggregateFixture<Account> fixture = AggregateFixture.of(Account::new, "acc-1")
            .when(account -> { });

        assertThrows(IllegalStateException.class, () -> fixture.given(opened()));
    }
}

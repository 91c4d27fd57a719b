package com.flagship.payment_processor.ledger;

import com.flagship.payment_processor.event.Event;
import com.flagship.payment_processor.store.InMemoryTransactionStore;
import com.flagship.payment_processor.store.TransactionStore;
import com.flagship.payment_processor.store.TxState;
import com.flagship.payment_processor.store.TxStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Client state machine tests.
 *
 * These tests verify that:
 * - each event type moves balances as expected
 * - every guard rejects with the right error and leaves no partial state
 * - a transaction id owned by one client is invisible to every other client
 * - a frozen account rejects everything
 */
class ClientTest {

    private static final int CLIENT_ID = 1337;
    private static final int OTHER_CLIENT_ID = 1234;

    private TransactionStore store;
    private Client client;

    @BeforeEach
    void setUp() {
        store = new InMemoryTransactionStore();
        client = new Client(CLIENT_ID, store);
    }

    private static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }

    private static Event deposit(long tx, String amount) {
        return Event.deposit(CLIENT_ID, tx, amount(amount));
    }

    private static Event withdrawal(long tx, String amount) {
        return Event.withdrawal(CLIENT_ID, tx, amount(amount));
    }

    private void assertBalances(String available, String held, String total, boolean locked) {
        assertEquals(0, amount(available).compareTo(client.getAvailable()),
            "available expected " + available + " but was " + client.getAvailable());
        assertEquals(0, amount(held).compareTo(client.getHeld()),
            "held expected " + held + " but was " + client.getHeld());
        assertEquals(0, amount(total).compareTo(client.getTotal()),
            "total expected " + total + " but was " + client.getTotal());
        assertEquals(locked, client.isLocked());
    }

    private LedgerError rejected(Client target, Event event) {
        return assertThrows(LedgerException.class, () -> target.apply(event)).getError();
    }

    private LedgerError rejected(Event event) {
        return rejected(client, event);
    }

    private void freeze() {
        client.apply(deposit(1, "5.0"));
        client.apply(deposit(2, "6.0"));
        client.apply(Event.dispute(CLIENT_ID, 1));
        client.apply(withdrawal(3, "5.0"));
        client.apply(Event.chargeback(CLIENT_ID, 1));
    }

    @Test
    @DisplayName("New client starts empty and unlocked")
    void testNewClient() {
        assertEquals(CLIENT_ID, client.getId());
        assertBalances("0", "0", "0", false);
    }

    @Test
    @DisplayName("Event for another client is a programming error")
    void testEventForOtherClient() {
        assertThrows(IllegalArgumentException.class,
            () -> client.apply(Event.deposit(OTHER_CLIENT_ID, 1, BigDecimal.ONE)));
    }

    @Nested
    @DisplayName("Deposit")
    class DepositTests {

        @Test
        @DisplayName("Deposits add to available and total")
        void testDeposit() {
            client.apply(deposit(1, "1.0"));
            assertBalances("1.0", "0.0", "1.0", false);

            client.apply(deposit(2, "10.0"));
            assertBalances("11.0", "0.0", "11.0", false);
        }

        @Test
        @DisplayName("Reusing a transaction id fails every time, whatever the amount")
        void testDuplicateDeposit() {
            client.apply(deposit(1, "10.0"));

            assertEquals(LedgerError.DUPLICATE_TRANSACTION, rejected(deposit(1, "5.0")));
            assertEquals(LedgerError.DUPLICATE_TRANSACTION, rejected(deposit(1, "10.0")));
            assertEquals(LedgerError.DUPLICATE_TRANSACTION, rejected(deposit(1, "10.0")));
            assertBalances("10.0", "0", "10.0", false);
        }

        @Test
        @DisplayName("Deposit under another client's transaction id fails")
        void testHijackDeposit() {
            client.apply(deposit(1, "10.0"));
            Client other = new Client(OTHER_CLIENT_ID, store);

            LedgerError error = rejected(other, Event.deposit(OTHER_CLIENT_ID, 1, amount("10.0")));

            assertEquals(LedgerError.TRANSACTION_NOT_FOUND, error);
            assertEquals(0, other.getTotal().signum());
            assertEquals(TxStatus.DEPOSIT, store.get(CLIENT_ID, 1).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("Deposit to a frozen account fails")
        void testDepositFrozen() {
            freeze();

            assertEquals(LedgerError.ACCOUNT_FROZEN, rejected(deposit(4, "10.0")));
            assertTrue(store.get(CLIENT_ID, 4).isEmpty(), "Frozen account must not write to the store");
        }
    }

    @Nested
    @DisplayName("Withdrawal")
    class WithdrawalTests {

        @Test
        @DisplayName("Withdrawals subtract from available and total")
        void testWithdrawal() {
            client.apply(deposit(1, "10.0"));
            client.apply(withdrawal(2, "9.5"));
            assertBalances("0.5", "0.0", "0.5", false);

            client.apply(withdrawal(3, "0.5"));
            assertBalances("0.0", "0.0", "0.0", false);
        }

        @Test
        @DisplayName("Overdraft fails with INSUFFICIENT_FUNDS and changes nothing")
        void testWithdrawalInsufficient() {
            client.apply(deposit(1, "10.0"));

            assertEquals(LedgerError.INSUFFICIENT_FUNDS, rejected(withdrawal(2, "11.0")));
            assertBalances("10.0", "0", "10.0", false);
            assertTrue(store.get(CLIENT_ID, 2).isEmpty());
        }

        @Test
        @DisplayName("Withdrawal reusing a deposit's id fails")
        void testWithdrawalSameTx() {
            client.apply(deposit(1, "10.0"));

            assertEquals(LedgerError.DUPLICATE_TRANSACTION, rejected(withdrawal(1, "5.0")));
            assertBalances("10.0", "0", "10.0", false);
        }

        @Test
        @DisplayName("Withdrawal under another client's transaction id fails")
        void testWithdrawalUnownedTx() {
            client.apply(deposit(1, "10.0"));
            Client other = new Client(OTHER_CLIENT_ID, store);
            other.apply(Event.deposit(OTHER_CLIENT_ID, 2, amount("20.0")));

            LedgerError error = rejected(other, Event.withdrawal(OTHER_CLIENT_ID, 1, amount("10.0")));

            assertEquals(LedgerError.TRANSACTION_NOT_FOUND, error);
            assertEquals(0, amount("20.0").compareTo(other.getAvailable()));
        }

        @Test
        @DisplayName("Held funds cannot be withdrawn")
        void testWithdrawalInsufficientHeld() {
            client.apply(deposit(1, "10.0"));
            client.apply(Event.dispute(CLIENT_ID, 1));

            assertEquals(LedgerError.INSUFFICIENT_FUNDS, rejected(withdrawal(2, "5.0")));
        }

        @Test
        @DisplayName("Funds outside the dispute can still be withdrawn")
        void testWithdrawalPartialHeld() {
            client.apply(deposit(1, "5.0"));
            client.apply(deposit(2, "6.0"));
            client.apply(Event.dispute(CLIENT_ID, 1));
            client.apply(withdrawal(3, "5.0"));

            assertBalances("1.0", "5.0", "6.0", false);
        }

        @Test
        @DisplayName("Withdrawal from a frozen account fails")
        void testWithdrawalFrozen() {
            freeze();

            assertEquals(LedgerError.ACCOUNT_FROZEN, rejected(withdrawal(4, "1.0")));
            assertBalances("1.0", "0", "1.0", true);
        }

        @Test
        @DisplayName("A withdrawal can never be disputed and its id cannot be reused")
        void testWithdrawalIsTerminal() {
            client.apply(deposit(1, "10.0"));
            client.apply(withdrawal(2, "4.0"));

            assertEquals(LedgerError.TRANSACTION_CANNOT_BE_DISPUTED, rejected(Event.dispute(CLIENT_ID, 2)));
            assertEquals(LedgerError.TRANSACTION_NOT_DISPUTED, rejected(Event.resolve(CLIENT_ID, 2)));
            assertEquals(LedgerError.TRANSACTION_NOT_DISPUTED, rejected(Event.chargeback(CLIENT_ID, 2)));
            assertEquals(LedgerError.DUPLICATE_TRANSACTION, rejected(deposit(2, "1.0")));
            assertBalances("6.0", "0", "6.0", false);
        }
    }

    @Nested
    @DisplayName("Dispute")
    class DisputeTests {

        @Test
        @DisplayName("Dispute moves the deposit from available to held")
        void testDispute() {
            client.apply(deposit(1, "10.0"));
            client.apply(deposit(2, "5.0"));
            client.apply(Event.dispute(CLIENT_ID, 1));

            assertBalances("5.0", "10.0", "15.0", false);
            assertEquals(TxStatus.DISPUTE, store.get(CLIENT_ID, 1).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("Disputing twice fails with TRANSACTION_ALREADY_DISPUTED")
        void testDoubleDispute() {
            client.apply(deposit(1, "10.0"));
            client.apply(Event.dispute(CLIENT_ID, 1));

            assertEquals(LedgerError.TRANSACTION_ALREADY_DISPUTED, rejected(Event.dispute(CLIENT_ID, 1)));
            assertBalances("0", "10.0", "10.0", false);
        }

        @Test
        @DisplayName("Dispute of an unknown transaction fails")
        void testDisputeMissing() {
            assertEquals(LedgerError.TRANSACTION_NOT_FOUND, rejected(Event.dispute(CLIENT_ID, 99)));
        }

        @Test
        @DisplayName("Dispute exceeding available funds fails and keeps the deposit undisputed")
        void testDisputeInsufficient() {
            client.apply(deposit(1, "10.0"));
            client.apply(withdrawal(2, "6.0"));

            assertEquals(LedgerError.INSUFFICIENT_FUNDS, rejected(Event.dispute(CLIENT_ID, 1)));
            assertBalances("4.0", "0", "4.0", false);
            assertEquals(TxStatus.DEPOSIT, store.get(CLIENT_ID, 1).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("Dispute of another client's transaction fails and leaves the owner untouched")
        void testDisputeUnownedTx() {
            client.apply(deposit(1, "10.0"));
            Client other = new Client(OTHER_CLIENT_ID, store);

            assertEquals(LedgerError.TRANSACTION_NOT_FOUND, rejected(other, Event.dispute(OTHER_CLIENT_ID, 1)));
            assertBalances("10.0", "0", "10.0", false);
        }

        @Test
        @DisplayName("Dispute on a frozen account fails")
        void testDisputeFrozen() {
            freeze();

            assertEquals(LedgerError.ACCOUNT_FROZEN, rejected(Event.dispute(CLIENT_ID, 2)));
            assertEquals(TxStatus.DEPOSIT, store.get(CLIENT_ID, 2).orElseThrow().getStatus());
        }
    }

    @Nested
    @DisplayName("Resolve")
    class ResolveTests {

        @Test
        @DisplayName("Resolve releases held funds; resolving again fails")
        void testResolve() {
            client.apply(deposit(1, "10.0"));
            client.apply(Event.dispute(CLIENT_ID, 1));
            client.apply(Event.resolve(CLIENT_ID, 1));

            assertBalances("10.0", "0.0", "10.0", false);
            assertEquals(LedgerError.TRANSACTION_NOT_DISPUTED, rejected(Event.resolve(CLIENT_ID, 1)));
            assertBalances("10.0", "0.0", "10.0", false);
        }

        @Test
        @DisplayName("A resolved deposit can be disputed again")
        void testDisputeAfterResolve() {
            client.apply(deposit(1, "10.0"));
            client.apply(Event.dispute(CLIENT_ID, 1));
            client.apply(Event.resolve(CLIENT_ID, 1));
            client.apply(Event.dispute(CLIENT_ID, 1));

            assertBalances("0", "10.0", "10.0", false);
        }

        @Test
        @DisplayName("Resolve of an undisputed deposit fails")
        void testResolveUndisputed() {
            client.apply(deposit(1, "10.0"));

            assertEquals(LedgerError.TRANSACTION_NOT_DISPUTED, rejected(Event.resolve(CLIENT_ID, 1)));
        }

        @Test
        @DisplayName("Resolve of another client's dispute fails")
        void testResolveUnownedTx() {
            client.apply(deposit(1, "10.0"));
            client.apply(Event.dispute(CLIENT_ID, 1));
            Client other = new Client(OTHER_CLIENT_ID, store);

            assertEquals(LedgerError.TRANSACTION_NOT_FOUND, rejected(other, Event.resolve(OTHER_CLIENT_ID, 1)));
            assertBalances("0", "10.0", "10.0", false);
        }

        @Test
        @DisplayName("Resolve on a frozen account fails")
        void testResolveFrozen() {
            freeze();

            assertEquals(LedgerError.ACCOUNT_FROZEN, rejected(Event.resolve(CLIENT_ID, 1)));
        }
    }

    @Nested
    @DisplayName("Chargeback")
    class ChargebackTests {

        @Test
        @DisplayName("Chargeback removes held funds and freezes the account")
        void testChargeback() {
            client.apply(deposit(1, "10.0"));
            client.apply(Event.dispute(CLIENT_ID, 1));
            client.apply(Event.chargeback(CLIENT_ID, 1));

            assertBalances("0.0", "0.0", "0.0", true);
        }

        @Test
        @DisplayName("Chargeback of one of two deposits keeps the rest available")
        void testPartialChargeback() {
            client.apply(deposit(1, "5.0"));
            client.apply(deposit(2, "6.0"));
            client.apply(Event.dispute(CLIENT_ID, 1));
            assertBalances("6.0", "5.0", "11.0", false);

            client.apply(withdrawal(3, "5.0"));
            assertBalances("1.0", "5.0", "6.0", false);

            client.apply(Event.chargeback(CLIENT_ID, 1));
            assertBalances("1.0", "0.0", "1.0", true);
        }

        @Test
        @DisplayName("Second chargeback fails because the account is frozen")
        void testDoubleChargeback() {
            client.apply(deposit(1, "10.0"));
            client.apply(Event.dispute(CLIENT_ID, 1));
            client.apply(Event.chargeback(CLIENT_ID, 1));

            assertEquals(LedgerError.ACCOUNT_FROZEN, rejected(Event.chargeback(CLIENT_ID, 1)));
            assertBalances("0.0", "0.0", "0.0", true);
        }

        @Test
        @DisplayName("Chargeback of an undisputed deposit fails")
        void testChargebackUndisputed() {
            client.apply(deposit(1, "10.0"));

            assertEquals(LedgerError.TRANSACTION_NOT_DISPUTED, rejected(Event.chargeback(CLIENT_ID, 1)));
            assertBalances("10.0", "0", "10.0", false);
        }

        @Test
        @DisplayName("Chargeback of another client's dispute fails")
        void testChargebackUnownedTx() {
            client.apply(deposit(1, "10.0"));
            client.apply(Event.dispute(CLIENT_ID, 1));
            Client other = new Client(OTHER_CLIENT_ID, store);

            assertEquals(LedgerError.TRANSACTION_NOT_FOUND, rejected(other, Event.chargeback(OTHER_CLIENT_ID, 1)));
            assertFalse(other.isLocked());
            assertFalse(client.isLocked());
        }

        @Test
        @DisplayName("Frozen account rejects events that would otherwise succeed")
        void testFreezingIsAbsorbing() {
            freeze();

            assertEquals(LedgerError.ACCOUNT_FROZEN, rejected(deposit(10, "1.0")));
            assertEquals(LedgerError.ACCOUNT_FROZEN, rejected(withdrawal(11, "0.5")));
            assertEquals(LedgerError.ACCOUNT_FROZEN, rejected(Event.dispute(CLIENT_ID, 2)));
            assertBalances("1.0", "0.0", "1.0", true);
        }
    }

    @Test
    @DisplayName("A failing store write leaves the balances untouched")
    void testFailedWriteLeavesBalances() {
        FailingStore failing = new FailingStore();
        Client target = new Client(CLIENT_ID, failing);
        target.apply(deposit(1, "10.0"));
        failing.failWrites = true;

        assertThrows(IllegalStateException.class, () -> target.apply(deposit(2, "5.0")));
        assertThrows(IllegalStateException.class, () -> target.apply(withdrawal(3, "4.0")));
        assertThrows(IllegalStateException.class, () -> target.apply(Event.dispute(CLIENT_ID, 1)));

        assertEquals(0, amount("10.0").compareTo(target.getAvailable()));
        assertEquals(0, amount("10.0").compareTo(target.getTotal()));
        assertEquals(1, failing.size());
    }

    private static class FailingStore extends InMemoryTransactionStore {
        private boolean failWrites;

        @Override
        public void upsert(int clientId, long txId, TxState state) {
            if (failWrites) {
                throw new IllegalStateException("store unavailable");
            }
            super.upsert(clientId, txId, state);
        }
    }
}

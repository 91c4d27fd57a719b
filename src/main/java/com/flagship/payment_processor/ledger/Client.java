package com.flagship.payment_processor.ledger;

import com.flagship.payment_processor.event.Event;
import com.flagship.payment_processor.store.OwnershipConflictException;
import com.flagship.payment_processor.store.TransactionStore;
import com.flagship.payment_processor.store.TxState;
import com.flagship.payment_processor.store.TxStatus;
import lombok.AccessLevel;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * A client account and the state machine that applies payment events to it.
 *
 * Key invariants, after every successful update:
 * - available <= total (held funds are never negative)
 * - once locked, the account stays locked and rejects every event
 *
 * Every guard for an event is evaluated and the new balances are computed before anything
 * is mutated. The store write, if any, is the last step that can fail; the balances are
 * committed only after it succeeds, so a rejected event leaves both untouched.
 *
 * Not thread-safe: events for one client must be applied one at a time, in order.
 * The {@link TransactionStore} is shared with every other client and handles its own
 * synchronization.
 */
@Getter
public class Client {

    private final int id;
    private BigDecimal available = BigDecimal.ZERO;
    private BigDecimal total = BigDecimal.ZERO;
    private boolean locked;

    @Getter(AccessLevel.NONE)
    private final TransactionStore store;

    public Client(int id, TransactionStore store) {
        this.id = id;
        this.store = Objects.requireNonNull(store);
    }

    /**
     * Funds held under dispute. Derived, never stored.
     */
    public BigDecimal getHeld() {
        return total.subtract(available);
    }

    /**
     * Applies a payment event to this account.
     *
     * @param event a validated event addressed to this client
     * @throws LedgerException if the event breaks a ledger rule; no state is changed
     * @throws IllegalArgumentException if the event belongs to a different client
     */
    public void apply(Event event) {
        if (event.getClientId() != id) {
            throw new IllegalArgumentException(
                String.format("Event for client %d applied to client %d", event.getClientId(), id));
        }
        if (locked) {
            throw new LedgerException(LedgerError.ACCOUNT_FROZEN, event);
        }

        switch (event.getType()) {
            case DEPOSIT -> deposit(event);
            case WITHDRAWAL -> withdraw(event);
            case DISPUTE -> dispute(event);
            case RESOLVE -> resolve(event);
            case CHARGEBACK -> chargeback(event);
        }
    }

    private void deposit(Event event) {
        BigDecimal amount = event.getAmount();
        if (store.get(id, event.getTxId()).isPresent()) {
            throw new LedgerException(LedgerError.DUPLICATE_TRANSACTION, event);
        }

        BigDecimal newAvailable = available.add(amount);
        BigDecimal newTotal = total.add(amount);
        write(event, TxState.deposit(amount));
        available = newAvailable;
        total = newTotal;
    }

    private void withdraw(Event event) {
        BigDecimal amount = event.getAmount();
        if (available.compareTo(amount) < 0) {
            throw new LedgerException(LedgerError.INSUFFICIENT_FUNDS, event);
        }
        if (store.get(id, event.getTxId()).isPresent()) {
            throw new LedgerException(LedgerError.DUPLICATE_TRANSACTION, event);
        }

        BigDecimal newAvailable = available.subtract(amount);
        BigDecimal newTotal = total.subtract(amount);
        write(event, TxState.withdrawal(amount));
        available = newAvailable;
        total = newTotal;
    }

    private void dispute(Event event) {
        TxState tx = find(event);
        if (tx.getStatus() == TxStatus.DISPUTE) {
            throw new LedgerException(LedgerError.TRANSACTION_ALREADY_DISPUTED, event);
        }
        if (tx.getStatus() == TxStatus.WITHDRAWAL) {
            throw new LedgerException(LedgerError.TRANSACTION_CANNOT_BE_DISPUTED, event);
        }
        if (tx.getAmount().compareTo(available) > 0) {
            throw new LedgerException(LedgerError.INSUFFICIENT_FUNDS, event);
        }

        BigDecimal newAvailable = available.subtract(tx.getAmount());
        write(event, tx.dispute());
        available = newAvailable;
    }

    private void resolve(Event event) {
        TxState tx = find(event);
        if (!tx.isDisputed()) {
            throw new LedgerException(LedgerError.TRANSACTION_NOT_DISPUTED, event);
        }

        BigDecimal newAvailable = available.add(tx.getAmount());
        write(event, tx.resolve());
        available = newAvailable;
    }

    private void chargeback(Event event) {
        TxState tx = find(event);
        if (!tx.isDisputed()) {
            throw new LedgerException(LedgerError.TRANSACTION_NOT_DISPUTED, event);
        }

        // The transaction stays in DISPUTE; the frozen account can never touch it again.
        total = total.subtract(tx.getAmount());
        locked = true;
    }

    private TxState find(Event event) {
        Optional<TxState> tx = store.get(id, event.getTxId());
        return tx.orElseThrow(() -> new LedgerException(LedgerError.TRANSACTION_NOT_FOUND, event));
    }

    private void write(Event event, TxState state) {
        try {
            store.upsert(id, event.getTxId(), state);
        } catch (OwnershipConflictException e) {
            // Someone else's transaction is indistinguishable from a missing one
            throw new LedgerException(LedgerError.TRANSACTION_NOT_FOUND, event);
        }
    }
}

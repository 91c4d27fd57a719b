package com.flagship.payment_processor.ledger;

import com.flagship.payment_processor.event.Event;
import com.flagship.payment_processor.store.TransactionStore;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * All client accounts of one run, sharing a single {@link TransactionStore}.
 *
 * Clients are created lazily the first time an event names them and live for the rest of
 * the run. Events for different clients may be applied from different threads; events
 * for the same client must be applied sequentially by the caller.
 */
public class Ledger {

    private final TransactionStore store;
    private final ConcurrentMap<Integer, Client> clients = new ConcurrentHashMap<>();

    public Ledger(TransactionStore store) {
        this.store = Objects.requireNonNull(store);
    }

    /**
     * Applies an event to the client it names, creating the client if needed.
     *
     * @return the client the event was applied to
     * @throws LedgerException if the event breaks a ledger rule
     */
    public Client apply(Event event) {
        Client client = clients.computeIfAbsent(event.getClientId(), id -> new Client(id, store));
        client.apply(event);
        return client;
    }

    /**
     * Snapshot of every client seen so far, ordered by client id.
     */
    public List<ClientBalance> balances() {
        return clients.values().stream()
            .sorted(Comparator.comparingInt(Client::getId))
            .map(ClientBalance::of)
            .toList();
    }

    public int clientCount() {
        return clients.size();
    }

    public int transactionCount() {
        return store.size();
    }
}

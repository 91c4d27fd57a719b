package com.flagship.payment_processor.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Read-only snapshot of one client's balances, as written to the report.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class ClientBalance {
    @JsonProperty("client")
    int clientId;
    BigDecimal available;
    BigDecimal held;
    BigDecimal total;
    boolean locked;

    public static ClientBalance of(Client client) {
        return new ClientBalance(
            client.getId(),
            client.getAvailable(),
            client.getHeld(),
            client.getTotal(),
            client.isLocked()
        );
    }

    /**
     * Returns a copy with every amount rounded to {@code scale} decimal places.
     */
    public ClientBalance withScale(int scale) {
        return new ClientBalance(
            clientId,
            available.setScale(scale, RoundingMode.HALF_EVEN),
            held.setScale(scale, RoundingMode.HALF_EVEN),
            total.setScale(scale, RoundingMode.HALF_EVEN),
            locked
        );
    }
}

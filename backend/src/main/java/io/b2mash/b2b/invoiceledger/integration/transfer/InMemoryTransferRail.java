package io.b2mash.b2b.invoiceledger.integration.transfer;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default transfer adapter keeping party balances in memory. Parties start at zero and are funded
 * with {@link #deposit}; a transfer larger than the payer's balance fails without moving anything.
 */
@Component
@ConditionalOnProperty(
    name = "ledger.transfer.provider",
    havingValue = "in-memory",
    matchIfMissing = true)
public class InMemoryTransferRail implements TransferRail {

  private static final Logger log = LoggerFactory.getLogger(InMemoryTransferRail.class);

  private final Map<UUID, BigDecimal> balances = new HashMap<>();

  @Override
  public String providerId() {
    return "in-memory";
  }

  @Override
  public synchronized TransferResult transfer(TransferRequest request) {
    BigDecimal available = balanceOf(request.from());
    if (available.compareTo(request.amount()) < 0) {
      log.warn(
          "In-memory transfer declined: invoice={}, from={}, amount={}, available={}",
          request.invoiceId(),
          request.from(),
          request.amount(),
          available);
      return TransferResult.failed(
          "Insufficient balance: available " + available + ", required " + request.amount());
    }
    balances.put(request.from(), available.subtract(request.amount()));
    balances.merge(request.to(), request.amount(), BigDecimal::add);

    String reference = "XFER-" + UUID.randomUUID().toString().substring(0, 8);
    log.info(
        "In-memory transfer completed: invoice={}, from={}, to={}, amount={}, reference={}",
        request.invoiceId(),
        request.from(),
        request.to(),
        request.amount(),
        reference);
    return TransferResult.completed(reference);
  }

  /** Credits {@code amount} to {@code party}. */
  public synchronized void deposit(UUID party, BigDecimal amount) {
    Objects.requireNonNull(party, "party");
    if (amount == null || amount.signum() < 0) {
      throw new IllegalArgumentException("Deposit amount must be zero or positive: " + amount);
    }
    balances.merge(party, amount, BigDecimal::add);
  }

  public synchronized BigDecimal balanceOf(UUID party) {
    return balances.getOrDefault(party, BigDecimal.ZERO);
  }
}

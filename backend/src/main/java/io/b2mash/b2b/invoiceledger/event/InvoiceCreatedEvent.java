package io.b2mash.b2b.invoiceledger.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record InvoiceCreatedEvent(
    long invoiceId,
    UUID issuer,
    UUID recipient,
    BigDecimal amount,
    Instant dueDate,
    Instant occurredAt)
    implements LedgerEvent {

  @Override
  public String eventType() {
    return "invoice.created";
  }
}

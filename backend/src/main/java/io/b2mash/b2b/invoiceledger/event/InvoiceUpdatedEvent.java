package io.b2mash.b2b.invoiceledger.event;

import io.b2mash.b2b.invoiceledger.invoice.IssuerStatus;
import io.b2mash.b2b.invoiceledger.invoice.RecipientStatus;
import java.time.Instant;

public record InvoiceUpdatedEvent(
    long invoiceId,
    IssuerStatus issuerStatus,
    RecipientStatus recipientStatus,
    Instant occurredAt)
    implements LedgerEvent {

  @Override
  public String eventType() {
    return "invoice.updated";
  }
}

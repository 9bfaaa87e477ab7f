package io.b2mash.b2b.invoiceledger.invoice.dto;

import io.b2mash.b2b.invoiceledger.event.InvoiceCreatedEvent;
import io.b2mash.b2b.invoiceledger.event.InvoiceUpdatedEvent;
import io.b2mash.b2b.invoiceledger.event.LedgerEvent;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record LedgerEventResponse(
    String eventType, long invoiceId, Instant occurredAt, Map<String, Object> details) {

  public static LedgerEventResponse from(LedgerEvent event) {
    var details = new LinkedHashMap<String, Object>();
    if (event instanceof InvoiceCreatedEvent created) {
      details.put("issuer", created.issuer());
      details.put("recipient", created.recipient());
      details.put("amount", created.amount());
      details.put("dueDate", created.dueDate());
    } else if (event instanceof InvoiceUpdatedEvent updated) {
      details.put("issuerStatus", updated.issuerStatus());
      details.put("recipientStatus", updated.recipientStatus());
    }
    return new LedgerEventResponse(
        event.eventType(), event.invoiceId(), event.occurredAt(), details);
  }
}

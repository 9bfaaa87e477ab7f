package io.b2mash.b2b.invoiceledger.event;

import java.time.Instant;

/**
 * Base interface for notifications published via Spring ApplicationEventPublisher at the end of
 * each successful ledger mutation. Implementations are records holding values only, never a live
 * {@code Invoice}, so an observer can keep them after the store moves on.
 */
public sealed interface LedgerEvent permits InvoiceCreatedEvent, InvoiceUpdatedEvent {

  String eventType();

  long invoiceId();

  Instant occurredAt();
}

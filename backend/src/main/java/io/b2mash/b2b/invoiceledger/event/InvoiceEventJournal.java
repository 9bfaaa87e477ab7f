package io.b2mash.b2b.invoiceledger.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Append-only record of every ledger notification, in publication order. Events are published
 * while the store's write lock is held, so the journal order is the mutation order.
 */
@Component
public class InvoiceEventJournal {

  private static final Logger log = LoggerFactory.getLogger(InvoiceEventJournal.class);

  private final List<LedgerEvent> events = new CopyOnWriteArrayList<>();

  @EventListener
  public void onLedgerEvent(LedgerEvent event) {
    events.add(event);
    log.debug("Journaled {} for invoice={}", event.eventType(), event.invoiceId());
  }

  public List<LedgerEvent> events() {
    return List.copyOf(events);
  }

  public List<LedgerEvent> eventsFor(long invoiceId) {
    return events.stream().filter(e -> e.invoiceId() == invoiceId).toList();
  }
}

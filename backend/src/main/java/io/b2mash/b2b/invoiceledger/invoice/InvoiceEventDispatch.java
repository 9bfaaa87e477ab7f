package io.b2mash.b2b.invoiceledger.invoice;

import io.b2mash.b2b.invoiceledger.event.LedgerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Publishes ledger events once the mutation they describe has been applied. A subscriber failure is
 * logged and does not reach the caller; the mutation stands.
 */
final class InvoiceEventDispatch {

  private static final Logger log = LoggerFactory.getLogger(InvoiceEventDispatch.class);

  private InvoiceEventDispatch() {}

  static void publish(ApplicationEventPublisher publisher, LedgerEvent event) {
    try {
      publisher.publishEvent(event);
    } catch (RuntimeException e) {
      log.error(
          "Event subscriber failed: type={}, invoice={}",
          event.eventType(),
          event.invoiceId(),
          e);
    }
  }
}

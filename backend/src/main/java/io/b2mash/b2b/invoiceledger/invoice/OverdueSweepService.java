package io.b2mash.b2b.invoiceledger.invoice;

import io.b2mash.b2b.invoiceledger.config.LedgerProperties;
import io.b2mash.b2b.invoiceledger.event.InvoiceUpdatedEvent;
import io.b2mash.b2b.invoiceledger.exception.LedgerErrorCode;
import io.b2mash.b2b.invoiceledger.exception.LedgerException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Administrative pass marking lapsed invoices OVERDUE on the recipient's side. Runs as a single
 * write unit over every invoice in ascending id order.
 */
@Service
public class OverdueSweepService {

  private static final Logger log = LoggerFactory.getLogger(OverdueSweepService.class);

  private final InvoiceStore store;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;
  private final UUID adminParty;
  private final OverdueSweepPolicy policy;

  public OverdueSweepService(
      InvoiceStore store,
      ApplicationEventPublisher eventPublisher,
      Clock clock,
      LedgerProperties properties) {
    this.store = store;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
    this.adminParty = properties.adminParty();
    this.policy = properties.overdueSweep().policy();
  }

  /**
   * Marks every past-due invoice selected by the configured policy as OVERDUE.
   *
   * @return ids of the invoices marked by this sweep, ascending
   * @throws LedgerException UNAUTHORIZED unless {@code caller} is the administrative party
   */
  public List<Long> sweepOverdue(UUID caller) {
    if (caller == null || !caller.equals(adminParty)) {
      throw new LedgerException(
          LedgerErrorCode.UNAUTHORIZED, "Only the administrative party can run the overdue sweep");
    }
    return store.write(
        () -> {
          Instant now = clock.instant();
          List<Long> marked = new ArrayList<>();
          for (Invoice invoice : store.allForUpdate()) {
            if (invoice.isPastDue(now) && policy.appliesTo(invoice.getRecipientStatus())) {
              invoice.markOverdue(now);
              marked.add(invoice.getId());
              InvoiceEventDispatch.publish(
                  eventPublisher,
                  new InvoiceUpdatedEvent(
                      invoice.getId(),
                      invoice.getIssuerStatus(),
                      invoice.getRecipientStatus(),
                      now));
            }
          }
          log.info(
              "Overdue sweep completed: policy={}, marked={}, invoices={}",
              policy,
              marked.size(),
              marked);
          return List.copyOf(marked);
        });
  }
}

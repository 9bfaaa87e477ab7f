package io.b2mash.b2b.invoiceledger.invoice;

import io.b2mash.b2b.invoiceledger.event.InvoiceCreatedEvent;
import io.b2mash.b2b.invoiceledger.event.InvoiceUpdatedEvent;
import io.b2mash.b2b.invoiceledger.exception.LedgerErrorCode;
import io.b2mash.b2b.invoiceledger.exception.LedgerException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Creation, queries and the per-party approval workflow (approve, reject, modify).
 *
 * <p>Each mutating method runs as one {@link InvoiceStore#write} unit: preconditions are checked
 * before anything changes, so a rejected call leaves the store untouched and publishes nothing.
 */
@Service
public class InvoiceService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceService.class);

  private static final UUID NIL_PARTY = new UUID(0L, 0L);

  private final InvoiceStore store;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public InvoiceService(InvoiceStore store, ApplicationEventPublisher eventPublisher, Clock clock) {
    this.store = store;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Creates an invoice issued by {@code caller} to {@code recipient}. The issuer's side starts
   * APPROVED, since issuing is itself acceptance of the terms; the recipient's side starts PENDING.
   *
   * @return a detached copy of the created invoice
   */
  public Invoice createInvoice(
      String issuerName,
      String clientName,
      UUID recipient,
      BigDecimal amount,
      Instant dueDate,
      String message,
      UUID caller) {
    Objects.requireNonNull(caller, "caller");
    return store.write(
        () -> {
          Instant now = clock.instant();
          if (recipient == null || NIL_PARTY.equals(recipient)) {
            throw new LedgerException(
                LedgerErrorCode.INVALID_RECIPIENT, "Recipient must be a non-zero party id");
          }
          if (recipient.equals(caller)) {
            throw new LedgerException(
                LedgerErrorCode.SELF_ASSIGNMENT, "Issuer " + caller + " cannot invoice itself");
          }
          requireFutureDueDate(dueDate, now);
          requireValidAmount(amount);

          Invoice invoice =
              store.insert(
                  id ->
                      new Invoice(
                          id,
                          issuerName,
                          clientName,
                          caller,
                          recipient,
                          amount,
                          dueDate,
                          message,
                          now));

          log.info(
              "Invoice created: invoice={}, issuer={}, recipient={}, amount={}, dueDate={}",
              invoice.getId(),
              caller,
              recipient,
              amount,
              dueDate);
          InvoiceEventDispatch.publish(
              eventPublisher,
              new InvoiceCreatedEvent(invoice.getId(), caller, recipient, amount, dueDate, now));
          return invoice.copy();
        });
  }

  /** Returns the invoice, or empty if the id has never been assigned. */
  public Optional<Invoice> findInvoice(long id) {
    return store.findById(id);
  }

  /**
   * Returns the invoice.
   *
   * @throws LedgerException INVOICE_NOT_FOUND if the id has never been assigned
   */
  public Invoice getInvoice(long id) {
    return store
        .findById(id)
        .orElseThrow(
            () ->
                new LedgerException(
                    LedgerErrorCode.INVOICE_NOT_FOUND, "No invoice found with id " + id));
  }

  /** Ids of the invoices the party takes part in, in creation order. */
  public List<Long> listInvoiceIds(UUID party) {
    return store.listFor(party);
  }

  /** Approves the invoice on the caller's own side. */
  public Invoice approveInvoice(long id, UUID caller) {
    return store.write(
        () -> {
          Instant now = clock.instant();
          Invoice invoice = store.requireForUpdate(id);
          PartyRole actor = requireParty(invoice, caller);
          invoice.approve(actor, now);

          log.info("Invoice approved: invoice={}, caller={}, role={}", id, caller, actor);
          publishUpdated(invoice, now);
          return invoice.copy();
        });
  }

  /** Rejects the invoice on both sides, provided the caller's own side is still undecided. */
  public Invoice rejectInvoice(long id, UUID caller) {
    return store.write(
        () -> {
          Instant now = clock.instant();
          Invoice invoice = store.requireForUpdate(id);
          PartyRole actor = requireParty(invoice, caller);
          invoice.reject(actor, now);

          log.info("Invoice rejected: invoice={}, caller={}, role={}", id, caller, actor);
          publishUpdated(invoice, now);
          return invoice.copy();
        });
  }

  /**
   * Revises client name, amount, due date and message. The caller's side becomes APPROVED and the
   * other side is re-opened to PENDING.
   */
  public Invoice modifyInvoice(
      long id,
      String clientName,
      BigDecimal amount,
      Instant dueDate,
      String message,
      UUID caller) {
    return store.write(
        () -> {
          Instant now = clock.instant();
          Invoice invoice = store.requireForUpdate(id);
          PartyRole actor = requireParty(invoice, caller);
          requireFutureDueDate(dueDate, now);
          requireValidAmount(amount);
          invoice.modify(actor, clientName, amount, dueDate, message, now);

          log.info(
              "Invoice modified: invoice={}, caller={}, role={}, amount={}, dueDate={}",
              id,
              caller,
              actor,
              amount,
              dueDate);
          publishUpdated(invoice, now);
          return invoice.copy();
        });
  }

  private void publishUpdated(Invoice invoice, Instant now) {
    InvoiceEventDispatch.publish(
        eventPublisher,
        new InvoiceUpdatedEvent(
            invoice.getId(), invoice.getIssuerStatus(), invoice.getRecipientStatus(), now));
  }

  static PartyRole requireParty(Invoice invoice, UUID caller) {
    return invoice
        .roleOf(caller)
        .orElseThrow(
            () ->
                new LedgerException(
                    LedgerErrorCode.UNAUTHORIZED,
                    "Caller " + caller + " is not a party to invoice " + invoice.getId()));
  }

  private static void requireFutureDueDate(Instant dueDate, Instant now) {
    if (dueDate == null || !dueDate.isAfter(now)) {
      throw new LedgerException(
          LedgerErrorCode.DUE_DATE_IN_PAST,
          "Due date " + dueDate + " must be later than " + now);
    }
  }

  private static void requireValidAmount(BigDecimal amount) {
    if (amount == null || amount.signum() < 0) {
      throw new LedgerException(
          LedgerErrorCode.INVALID_AMOUNT, "Amount must be zero or positive, got " + amount);
    }
  }
}

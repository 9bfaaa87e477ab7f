package io.b2mash.b2b.invoiceledger.invoice;

import io.b2mash.b2b.invoiceledger.exception.LedgerErrorCode;
import io.b2mash.b2b.invoiceledger.exception.LedgerException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Invoice between an issuer and a recipient, each holding an independent view of its status.
 *
 * <p>Lifecycle: created with the issuer APPROVED and the recipient PENDING. Each side moves its own
 * status from PENDING to APPROVED; either side may veto while its own status is PENDING, which
 * rejects the invoice on both sides. Once both sides are APPROVED the recipient settles, ending in
 * PAYMENT_RECEIVED / PAID.
 *
 * <p>Instances are owned by {@link InvoiceStore}. Mutators are package-private and are only called
 * by the ledger services while the store's write lock is held; callers outside the store only ever
 * see detached copies.
 */
public class Invoice {

  private final long id;
  private final String issuerName;
  private final UUID issuer;
  private final UUID recipient;
  private final Instant creationDate;

  private String clientName;
  private BigDecimal amount;
  private Instant dueDate;
  private String message;
  private IssuerStatus issuerStatus;
  private RecipientStatus recipientStatus;
  private Instant lastModifiedDate;

  Invoice(
      long id,
      String issuerName,
      String clientName,
      UUID issuer,
      UUID recipient,
      BigDecimal amount,
      Instant dueDate,
      String message,
      Instant now) {
    this.id = id;
    this.issuerName = issuerName;
    this.clientName = clientName;
    this.issuer = issuer;
    this.recipient = recipient;
    this.amount = amount;
    this.dueDate = dueDate;
    this.message = message;
    this.issuerStatus = IssuerStatus.APPROVED;
    this.recipientStatus = RecipientStatus.PENDING;
    this.creationDate = now;
    this.lastModifiedDate = now;
  }

  private Invoice(Invoice source) {
    this.id = source.id;
    this.issuerName = source.issuerName;
    this.clientName = source.clientName;
    this.issuer = source.issuer;
    this.recipient = source.recipient;
    this.amount = source.amount;
    this.dueDate = source.dueDate;
    this.message = source.message;
    this.issuerStatus = source.issuerStatus;
    this.recipientStatus = source.recipientStatus;
    this.creationDate = source.creationDate;
    this.lastModifiedDate = source.lastModifiedDate;
  }

  /** Returns a detached copy that does not observe later mutations of this record. */
  Invoice copy() {
    return new Invoice(this);
  }

  /**
   * Resolves which side of the invoice the caller acts for.
   *
   * @return the caller's role, or empty if the caller is neither issuer nor recipient
   */
  public Optional<PartyRole> roleOf(UUID caller) {
    if (caller == null) {
      return Optional.empty();
    }
    if (caller.equals(recipient)) {
      return Optional.of(PartyRole.RECIPIENT);
    }
    if (caller.equals(issuer)) {
      return Optional.of(PartyRole.ISSUER);
    }
    return Optional.empty();
  }

  /**
   * Moves the acting party's own status from PENDING to APPROVED. The counterparty's status is
   * neither checked nor changed.
   *
   * @throws LedgerException INVALID_TRANSITION if the acting party's status is not PENDING
   */
  void approve(PartyRole actor, Instant now) {
    requireAwaitingDecision(actor, "approve");
    markApproved(actor);
    this.lastModifiedDate = now;
  }

  /**
   * Vetoes the invoice: both statuses become REJECTED regardless of the counterparty's status.
   *
   * @throws LedgerException INVALID_TRANSITION if the acting party's status is not PENDING
   */
  void reject(PartyRole actor, Instant now) {
    requireAwaitingDecision(actor, "reject");
    this.issuerStatus = IssuerStatus.REJECTED;
    this.recipientStatus = RecipientStatus.REJECTED;
    this.lastModifiedDate = now;
  }

  /**
   * Revises the mutable terms. The acting party approves the new terms and approval is re-opened on
   * the other side. Issuer name, parties and creation date never change.
   *
   * @throws LedgerException INVALID_TRANSITION if the acting party's status is not PENDING
   */
  void modify(
      PartyRole actor,
      String clientName,
      BigDecimal amount,
      Instant dueDate,
      String message,
      Instant now) {
    requireAwaitingDecision(actor, "modify");
    markApproved(actor);
    markPending(actor.counterparty());
    this.clientName = clientName;
    this.amount = amount;
    this.dueDate = dueDate;
    this.message = message;
    this.lastModifiedDate = now;
  }

  /** Whether both sides currently hold APPROVED, the precondition for settlement. */
  public boolean isApprovedByBoth() {
    return issuerStatus == IssuerStatus.APPROVED && recipientStatus == RecipientStatus.APPROVED;
  }

  /** Marks the invoice settled. Callers validate dual approval and the tendered amount first. */
  void settle(Instant now) {
    this.issuerStatus = IssuerStatus.PAYMENT_RECEIVED;
    this.recipientStatus = RecipientStatus.PAID;
    this.lastModifiedDate = now;
  }

  /** Undoes {@link #settle} when the transfer backing it did not go through. */
  void revertSettlement(Invoice before) {
    this.issuerStatus = before.issuerStatus;
    this.recipientStatus = before.recipientStatus;
    this.lastModifiedDate = before.lastModifiedDate;
  }

  /** Whether the due date has lapsed at {@code now}. */
  public boolean isPastDue(Instant now) {
    return now.isAfter(dueDate);
  }

  /** Sets the recipient's status to OVERDUE. The issuer's status is left alone. */
  void markOverdue(Instant now) {
    this.recipientStatus = RecipientStatus.OVERDUE;
    this.lastModifiedDate = now;
  }

  private void requireAwaitingDecision(PartyRole actor, String action) {
    boolean awaiting =
        actor == PartyRole.ISSUER
            ? issuerStatus.isAwaitingDecision()
            : recipientStatus.isAwaitingDecision();
    if (!awaiting) {
      Object current = actor == PartyRole.ISSUER ? issuerStatus : recipientStatus;
      throw new LedgerException(
          LedgerErrorCode.INVALID_TRANSITION,
          "Cannot "
              + action
              + " invoice "
              + id
              + " as "
              + actor
              + " in status "
              + current
              + ". Must be PENDING.");
    }
  }

  private void markApproved(PartyRole role) {
    if (role == PartyRole.ISSUER) {
      this.issuerStatus = IssuerStatus.APPROVED;
    } else {
      this.recipientStatus = RecipientStatus.APPROVED;
    }
  }

  private void markPending(PartyRole role) {
    if (role == PartyRole.ISSUER) {
      this.issuerStatus = IssuerStatus.PENDING;
    } else {
      this.recipientStatus = RecipientStatus.PENDING;
    }
  }

  // --- Getters ---

  public long getId() {
    return id;
  }

  public String getIssuerName() {
    return issuerName;
  }

  public String getClientName() {
    return clientName;
  }

  public UUID getIssuer() {
    return issuer;
  }

  public UUID getRecipient() {
    return recipient;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public Instant getDueDate() {
    return dueDate;
  }

  public String getMessage() {
    return message;
  }

  public IssuerStatus getIssuerStatus() {
    return issuerStatus;
  }

  public RecipientStatus getRecipientStatus() {
    return recipientStatus;
  }

  public Instant getCreationDate() {
    return creationDate;
  }

  public Instant getLastModifiedDate() {
    return lastModifiedDate;
  }
}

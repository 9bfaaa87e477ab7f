package io.b2mash.b2b.invoiceledger.invoice;

/**
 * The recipient's view of an invoice.
 *
 * <p>Transitions the recipient makes itself:
 *
 * <ul>
 *   <li>PENDING → APPROVED (approve, or modify by the recipient)
 *   <li>PENDING → REJECTED (reject by the recipient)
 *   <li>APPROVED → PAID (settlement)
 * </ul>
 *
 * <p>The issuer can force PENDING (by modifying) or REJECTED (by rejecting). The overdue sweep sets
 * OVERDUE.
 */
public enum RecipientStatus {
  /** Terms not yet accepted by the recipient. Set at creation. */
  PENDING,

  /** Recipient accepts the current terms. */
  APPROVED,

  /** Settled; terminal. */
  PAID,

  /** Past its due date at the last overdue sweep. */
  OVERDUE,

  /** Vetoed by either party; terminal. */
  REJECTED;

  /** Whether the recipient may still approve, reject or modify. */
  public boolean isAwaitingDecision() {
    return this == PENDING;
  }
}

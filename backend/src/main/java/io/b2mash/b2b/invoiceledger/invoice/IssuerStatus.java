package io.b2mash.b2b.invoiceledger.invoice;

/**
 * The issuer's view of an invoice.
 *
 * <p>Transitions the issuer makes itself:
 *
 * <ul>
 *   <li>PENDING → APPROVED (approve, or modify by the issuer)
 *   <li>PENDING → REJECTED (reject by the issuer)
 * </ul>
 *
 * <p>Transitions driven by the recipient: APPROVED → PENDING when the recipient modifies the
 * terms, any → REJECTED when the recipient rejects, APPROVED → PAYMENT_RECEIVED on settlement.
 */
public enum IssuerStatus {
  /** Terms not yet accepted by the issuer. */
  PENDING,

  /** Issuer accepts the current terms. Set at creation. */
  APPROVED,

  /** Settlement completed; terminal. */
  PAYMENT_RECEIVED,

  /** Vetoed by either party; terminal. */
  REJECTED;

  /** Whether the issuer may still approve, reject or modify. */
  public boolean isAwaitingDecision() {
    return this == PENDING;
  }
}

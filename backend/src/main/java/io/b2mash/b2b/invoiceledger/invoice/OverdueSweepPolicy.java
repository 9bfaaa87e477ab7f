package io.b2mash.b2b.invoiceledger.invoice;

/** Decides which past-due invoices the overdue sweep marks as OVERDUE. */
public enum OverdueSweepPolicy {

  /**
   * Every past-due invoice is marked, whatever the recipient's status: PAID, REJECTED and already
   * OVERDUE invoices are overwritten too (and re-notified on every sweep).
   */
  ALL_PAST_DUE {
    @Override
    public boolean appliesTo(RecipientStatus status) {
      return true;
    }
  },

  /** Only past-due invoices that are not PAID, REJECTED or already OVERDUE are marked. */
  OPEN_ONLY {
    @Override
    public boolean appliesTo(RecipientStatus status) {
      return status != RecipientStatus.PAID
          && status != RecipientStatus.REJECTED
          && status != RecipientStatus.OVERDUE;
    }
  };

  public abstract boolean appliesTo(RecipientStatus status);
}

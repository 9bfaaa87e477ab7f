package io.b2mash.b2b.invoiceledger.invoice;

/** The side of an invoice a caller acts for. */
public enum PartyRole {
  ISSUER,
  RECIPIENT;

  public PartyRole counterparty() {
    return this == ISSUER ? RECIPIENT : ISSUER;
  }
}

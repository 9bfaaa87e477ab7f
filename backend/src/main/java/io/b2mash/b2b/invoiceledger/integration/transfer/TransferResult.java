package io.b2mash.b2b.invoiceledger.integration.transfer;

/** Result of a {@link TransferRail#transfer(TransferRequest)} call. */
public record TransferResult(boolean success, String reference, String errorMessage) {

  public static TransferResult completed(String reference) {
    return new TransferResult(true, reference, null);
  }

  public static TransferResult failed(String errorMessage) {
    return new TransferResult(false, null, errorMessage);
  }
}

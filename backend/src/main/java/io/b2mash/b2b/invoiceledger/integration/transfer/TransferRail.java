package io.b2mash.b2b.invoiceledger.integration.transfer;

/**
 * Port to the value-transfer rail used by settlement. An adapter moves the whole amount from the
 * payer to the payee or nothing at all; a partial transfer is never reported as success.
 */
public interface TransferRail {

  /** Unique adapter identifier (e.g., "in-memory"). */
  String providerId();

  /**
   * Moves {@code request.amount()} from {@code request.from()} to {@code request.to()}.
   *
   * @return a successful result carrying a transfer reference, or an unsuccessful one carrying the
   *     reason; adapters may also throw, which callers treat as failure
   */
  TransferResult transfer(TransferRequest request);
}

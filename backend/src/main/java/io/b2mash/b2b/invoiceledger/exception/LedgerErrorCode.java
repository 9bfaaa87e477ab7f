package io.b2mash.b2b.invoiceledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Reason tags for rejected ledger operations. Every code is a precondition violation: the operation
 * that reports it has no persisted effect.
 */
public enum LedgerErrorCode {
  UNAUTHORIZED(HttpStatus.FORBIDDEN, "Caller not authorized"),
  INVALID_RECIPIENT(HttpStatus.BAD_REQUEST, "Invalid recipient"),
  SELF_ASSIGNMENT(HttpStatus.BAD_REQUEST, "Invoice cannot be issued to its issuer"),
  DUE_DATE_IN_PAST(HttpStatus.BAD_REQUEST, "Due date must be in the future"),
  INVALID_AMOUNT(HttpStatus.BAD_REQUEST, "Invalid amount"),
  INVALID_TRANSITION(HttpStatus.CONFLICT, "Invalid invoice status"),
  NOT_APPROVED(HttpStatus.CONFLICT, "Invoice not approved by both parties"),
  AMOUNT_MISMATCH(HttpStatus.UNPROCESSABLE_ENTITY, "Tendered amount does not match invoice"),
  TRANSFER_FAILED(HttpStatus.BAD_GATEWAY, "Transfer failed"),
  INVOICE_NOT_FOUND(HttpStatus.NOT_FOUND, "Invoice not found");

  private final HttpStatus status;
  private final String title;

  LedgerErrorCode(HttpStatus status, String title) {
    this.status = status;
    this.title = title;
  }

  public HttpStatus getStatus() {
    return status;
  }

  public String getTitle() {
    return title;
  }
}

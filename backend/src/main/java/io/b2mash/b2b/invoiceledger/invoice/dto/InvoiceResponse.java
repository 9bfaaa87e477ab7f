package io.b2mash.b2b.invoiceledger.invoice.dto;

import io.b2mash.b2b.invoiceledger.invoice.Invoice;
import io.b2mash.b2b.invoiceledger.invoice.IssuerStatus;
import io.b2mash.b2b.invoiceledger.invoice.RecipientStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record InvoiceResponse(
    long id,
    String issuerName,
    String clientName,
    UUID issuer,
    UUID recipient,
    BigDecimal amount,
    Instant dueDate,
    IssuerStatus issuerStatus,
    RecipientStatus recipientStatus,
    Instant creationDate,
    Instant lastModifiedDate,
    String message) {

  public static InvoiceResponse from(Invoice invoice) {
    return new InvoiceResponse(
        invoice.getId(),
        invoice.getIssuerName(),
        invoice.getClientName(),
        invoice.getIssuer(),
        invoice.getRecipient(),
        invoice.getAmount(),
        invoice.getDueDate(),
        invoice.getIssuerStatus(),
        invoice.getRecipientStatus(),
        invoice.getCreationDate(),
        invoice.getLastModifiedDate(),
        invoice.getMessage());
  }
}

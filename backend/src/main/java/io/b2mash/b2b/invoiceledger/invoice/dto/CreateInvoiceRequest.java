package io.b2mash.b2b.invoiceledger.invoice.dto;

import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record CreateInvoiceRequest(
    @Size(max = 255) String issuerName,
    @Size(max = 255) String clientName,
    UUID recipient,
    BigDecimal amount,
    Instant dueDate,
    String message) {}

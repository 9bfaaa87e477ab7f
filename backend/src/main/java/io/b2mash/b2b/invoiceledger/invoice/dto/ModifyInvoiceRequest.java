package io.b2mash.b2b.invoiceledger.invoice.dto;

import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;

public record ModifyInvoiceRequest(
    @Size(max = 255) String clientName,
    BigDecimal amount,
    Instant dueDate,
    String message) {}

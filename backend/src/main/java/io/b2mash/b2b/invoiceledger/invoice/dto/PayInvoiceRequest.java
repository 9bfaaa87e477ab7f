package io.b2mash.b2b.invoiceledger.invoice.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record PayInvoiceRequest(@NotNull BigDecimal tenderedAmount) {}

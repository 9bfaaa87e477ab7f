package io.b2mash.b2b.invoiceledger.invoice.dto;

import java.util.List;
import java.util.UUID;

public record InvoiceIdsResponse(UUID party, List<Long> invoiceIds) {}

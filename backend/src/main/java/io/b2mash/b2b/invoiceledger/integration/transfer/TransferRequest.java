package io.b2mash.b2b.invoiceledger.integration.transfer;

import java.math.BigDecimal;
import java.util.UUID;

public record TransferRequest(long invoiceId, UUID from, UUID to, BigDecimal amount) {}

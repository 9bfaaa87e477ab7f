package io.b2mash.b2b.invoiceledger.invoice.dto;

import java.util.List;

public record OverdueSweepResponse(int markedCount, List<Long> markedInvoiceIds) {

  public static OverdueSweepResponse of(List<Long> marked) {
    return new OverdueSweepResponse(marked.size(), marked);
  }
}

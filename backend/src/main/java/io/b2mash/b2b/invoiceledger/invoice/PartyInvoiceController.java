package io.b2mash.b2b.invoiceledger.invoice;

import io.b2mash.b2b.invoiceledger.invoice.dto.InvoiceIdsResponse;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/parties")
public class PartyInvoiceController {

  private final InvoiceService invoiceService;

  public PartyInvoiceController(InvoiceService invoiceService) {
    this.invoiceService = invoiceService;
  }

  @GetMapping("/{partyId}/invoices")
  public ResponseEntity<InvoiceIdsResponse> listPartyInvoices(@PathVariable UUID partyId) {
    return ResponseEntity.ok(
        new InvoiceIdsResponse(partyId, invoiceService.listInvoiceIds(partyId)));
  }
}

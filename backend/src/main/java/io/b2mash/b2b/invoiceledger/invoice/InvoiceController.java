package io.b2mash.b2b.invoiceledger.invoice;

import io.b2mash.b2b.invoiceledger.event.InvoiceEventJournal;
import io.b2mash.b2b.invoiceledger.invoice.dto.CreateInvoiceRequest;
import io.b2mash.b2b.invoiceledger.invoice.dto.InvoiceIdsResponse;
import io.b2mash.b2b.invoiceledger.invoice.dto.InvoiceResponse;
import io.b2mash.b2b.invoiceledger.invoice.dto.LedgerEventResponse;
import io.b2mash.b2b.invoiceledger.invoice.dto.ModifyInvoiceRequest;
import io.b2mash.b2b.invoiceledger.invoice.dto.OverdueSweepResponse;
import io.b2mash.b2b.invoiceledger.invoice.dto.PayInvoiceRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the invoice ledger. The calling party is identified by the {@value
 * #PARTY_HEADER} header, which an upstream gateway is trusted to set; authorization against the
 * invoice's parties happens in the service layer.
 */
@RestController
@RequestMapping("/api/invoices")
public class InvoiceController {

  public static final String PARTY_HEADER = "X-Party-Id";

  private final InvoiceService invoiceService;
  private final InvoiceSettlementService settlementService;
  private final OverdueSweepService sweepService;
  private final InvoiceEventJournal eventJournal;

  public InvoiceController(
      InvoiceService invoiceService,
      InvoiceSettlementService settlementService,
      OverdueSweepService sweepService,
      InvoiceEventJournal eventJournal) {
    this.invoiceService = invoiceService;
    this.settlementService = settlementService;
    this.sweepService = sweepService;
    this.eventJournal = eventJournal;
  }

  /**
   * Issues a new invoice from the caller to the recipient.
   *
   * @return 201 Created with the invoice
   */
  @PostMapping
  public ResponseEntity<InvoiceResponse> createInvoice(
      @RequestHeader(PARTY_HEADER) UUID caller, @Valid @RequestBody CreateInvoiceRequest request) {
    Invoice invoice =
        invoiceService.createInvoice(
            request.issuerName(),
            request.clientName(),
            request.recipient(),
            request.amount(),
            request.dueDate(),
            request.message(),
            caller);
    return ResponseEntity.created(URI.create("/api/invoices/" + invoice.getId()))
        .body(InvoiceResponse.from(invoice));
  }

  @GetMapping("/{id}")
  public ResponseEntity<InvoiceResponse> getInvoice(@PathVariable long id) {
    return ResponseEntity.ok(InvoiceResponse.from(invoiceService.getInvoice(id)));
  }

  /** Lists the ids of the caller's invoices, as issuer or recipient, in creation order. */
  @GetMapping
  public ResponseEntity<InvoiceIdsResponse> listMyInvoices(
      @RequestHeader(PARTY_HEADER) UUID caller) {
    return ResponseEntity.ok(new InvoiceIdsResponse(caller, invoiceService.listInvoiceIds(caller)));
  }

  @PostMapping("/{id}/approve")
  public ResponseEntity<InvoiceResponse> approveInvoice(
      @PathVariable long id, @RequestHeader(PARTY_HEADER) UUID caller) {
    return ResponseEntity.ok(InvoiceResponse.from(invoiceService.approveInvoice(id, caller)));
  }

  @PostMapping("/{id}/reject")
  public ResponseEntity<InvoiceResponse> rejectInvoice(
      @PathVariable long id, @RequestHeader(PARTY_HEADER) UUID caller) {
    return ResponseEntity.ok(InvoiceResponse.from(invoiceService.rejectInvoice(id, caller)));
  }

  /**
   * Revises the invoice terms on behalf of the caller, re-opening approval for the other party.
   *
   * @return 200 OK with the revised invoice
   */
  @PutMapping("/{id}")
  public ResponseEntity<InvoiceResponse> modifyInvoice(
      @PathVariable long id,
      @RequestHeader(PARTY_HEADER) UUID caller,
      @Valid @RequestBody ModifyInvoiceRequest request) {
    Invoice invoice =
        invoiceService.modifyInvoice(
            id,
            request.clientName(),
            request.amount(),
            request.dueDate(),
            request.message(),
            caller);
    return ResponseEntity.ok(InvoiceResponse.from(invoice));
  }

  @PostMapping("/{id}/payment")
  public ResponseEntity<InvoiceResponse> payInvoice(
      @PathVariable long id,
      @RequestHeader(PARTY_HEADER) UUID caller,
      @Valid @RequestBody PayInvoiceRequest request) {
    Invoice invoice = settlementService.payInvoice(id, caller, request.tenderedAmount());
    return ResponseEntity.ok(InvoiceResponse.from(invoice));
  }

  @PostMapping("/overdue-sweep")
  public ResponseEntity<OverdueSweepResponse> sweepOverdue(
      @RequestHeader(PARTY_HEADER) UUID caller) {
    return ResponseEntity.ok(OverdueSweepResponse.of(sweepService.sweepOverdue(caller)));
  }

  /** Notification history of one invoice, oldest first. */
  @GetMapping("/{id}/events")
  public ResponseEntity<List<LedgerEventResponse>> getInvoiceEvents(@PathVariable long id) {
    invoiceService.getInvoice(id);
    List<LedgerEventResponse> events =
        eventJournal.eventsFor(id).stream().map(LedgerEventResponse::from).toList();
    return ResponseEntity.ok(events);
  }
}

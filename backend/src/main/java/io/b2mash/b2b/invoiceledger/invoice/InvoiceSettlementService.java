package io.b2mash.b2b.invoiceledger.invoice;

import io.b2mash.b2b.invoiceledger.event.InvoiceUpdatedEvent;
import io.b2mash.b2b.invoiceledger.exception.LedgerErrorCode;
import io.b2mash.b2b.invoiceledger.exception.LedgerException;
import io.b2mash.b2b.invoiceledger.integration.transfer.TransferRail;
import io.b2mash.b2b.invoiceledger.integration.transfer.TransferRequest;
import io.b2mash.b2b.invoiceledger.integration.transfer.TransferResult;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Settles dual-approved invoices. The status change and the transfer form one unit: if the rail
 * declines or throws, the statuses are restored before the failure is reported.
 */
@Service
public class InvoiceSettlementService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceSettlementService.class);

  private final InvoiceStore store;
  private final TransferRail transferRail;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public InvoiceSettlementService(
      InvoiceStore store,
      TransferRail transferRail,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.store = store;
    this.transferRail = transferRail;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Pays the invoice in full from the recipient to the issuer.
   *
   * @param tenderedAmount must equal the invoice amount exactly; partial and over-payment are
   *     refused
   * @return a detached copy of the settled invoice
   */
  public Invoice payInvoice(long id, UUID caller, BigDecimal tenderedAmount) {
    return store.write(
        () -> {
          Instant now = clock.instant();
          Invoice invoice = store.requireForUpdate(id);
          if (caller == null || !caller.equals(invoice.getRecipient())) {
            throw new LedgerException(
                LedgerErrorCode.UNAUTHORIZED,
                "Only the recipient of invoice " + id + " can pay it");
          }
          if (!invoice.isApprovedByBoth()) {
            throw new LedgerException(
                LedgerErrorCode.NOT_APPROVED,
                "Invoice "
                    + id
                    + " requires approval by both parties, current statuses: issuer="
                    + invoice.getIssuerStatus()
                    + ", recipient="
                    + invoice.getRecipientStatus());
          }
          if (tenderedAmount == null || tenderedAmount.compareTo(invoice.getAmount()) != 0) {
            throw new LedgerException(
                LedgerErrorCode.AMOUNT_MISMATCH,
                "Tendered amount " + tenderedAmount + " does not equal " + invoice.getAmount());
          }

          Invoice before = invoice.copy();
          invoice.settle(now);
          TransferResult result = transfer(invoice, tenderedAmount, before);

          log.info(
              "Invoice paid: invoice={}, from={}, to={}, amount={}, rail={}, reference={}",
              id,
              caller,
              invoice.getIssuer(),
              tenderedAmount,
              transferRail.providerId(),
              result.reference());
          InvoiceEventDispatch.publish(
              eventPublisher,
              new InvoiceUpdatedEvent(
                  id, invoice.getIssuerStatus(), invoice.getRecipientStatus(), now));
          return invoice.copy();
        });
  }

  private TransferResult transfer(Invoice invoice, BigDecimal amount, Invoice before) {
    var request =
        new TransferRequest(invoice.getId(), invoice.getRecipient(), invoice.getIssuer(), amount);
    TransferResult result;
    try {
      result = transferRail.transfer(request);
    } catch (RuntimeException e) {
      invoice.revertSettlement(before);
      throw new LedgerException(
          LedgerErrorCode.TRANSFER_FAILED,
          "Transfer for invoice " + invoice.getId() + " failed: " + e.getMessage(),
          e);
    }
    if (result == null || !result.success()) {
      invoice.revertSettlement(before);
      String reason = result != null ? result.errorMessage() : "no result from transfer rail";
      throw new LedgerException(
          LedgerErrorCode.TRANSFER_FAILED,
          "Transfer for invoice " + invoice.getId() + " failed: " + reason);
    }
    return result;
  }
}

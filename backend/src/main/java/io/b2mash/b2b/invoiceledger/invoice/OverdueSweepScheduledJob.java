package io.b2mash.b2b.invoiceledger.invoice;

import io.b2mash.b2b.invoiceledger.config.LedgerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job running the overdue sweep as the administrative party. Enabled with {@code
 * ledger.overdue-sweep.enabled=true}; the schedule comes from {@code ledger.overdue-sweep.cron},
 * hourly when unset.
 */
@Component
@ConditionalOnProperty(name = "ledger.overdue-sweep.enabled", havingValue = "true")
public class OverdueSweepScheduledJob {

  private static final Logger log = LoggerFactory.getLogger(OverdueSweepScheduledJob.class);

  private final OverdueSweepService sweepService;
  private final LedgerProperties properties;

  public OverdueSweepScheduledJob(OverdueSweepService sweepService, LedgerProperties properties) {
    this.sweepService = sweepService;
    this.properties = properties;
  }

  @Scheduled(cron = "${ledger.overdue-sweep.cron:0 0 * * * *}")
  public void runSweep() {
    log.info("Overdue sweep job started");
    try {
      var marked = sweepService.sweepOverdue(properties.adminParty());
      log.info("Overdue sweep job completed: {} invoices marked overdue", marked.size());
    } catch (Exception e) {
      log.error("Overdue sweep job failed", e);
    }
  }
}

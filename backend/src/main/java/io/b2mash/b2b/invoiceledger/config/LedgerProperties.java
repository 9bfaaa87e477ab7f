package io.b2mash.b2b.invoiceledger.config;

import io.b2mash.b2b.invoiceledger.invoice.OverdueSweepPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the invoice ledger.
 *
 * @param adminParty the administrative identity, fixed for the lifetime of the process; the only
 *     caller allowed to run the overdue sweep
 * @param overdueSweep scheduling and policy of the overdue sweep
 */
@Validated
@ConfigurationProperties(prefix = "ledger")
public record LedgerProperties(@NotNull UUID adminParty, @Valid OverdueSweep overdueSweep) {

  public LedgerProperties {
    if (overdueSweep == null) {
      overdueSweep = new OverdueSweep(false, OverdueSweepPolicy.ALL_PAST_DUE);
    }
  }

  /**
   * @param enabled whether the scheduled sweep job runs; its schedule is {@code
   *     ledger.overdue-sweep.cron}, read by the job itself
   * @param policy which past-due invoices the sweep marks as overdue
   */
  public record OverdueSweep(
      @DefaultValue("false") boolean enabled,
      @DefaultValue("ALL_PAST_DUE") @NotNull OverdueSweepPolicy policy) {}
}

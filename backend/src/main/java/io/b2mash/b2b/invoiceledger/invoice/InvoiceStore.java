package io.b2mash.b2b.invoiceledger.invoice;

import io.b2mash.b2b.invoiceledger.exception.LedgerErrorCode;
import io.b2mash.b2b.invoiceledger.exception.LedgerException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongFunction;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Process-wide owner of all invoice records and the per-party index.
 *
 * <ul>
 *   <li>Ids start at 1, increase in creation order and are never reused
 *   <li>Each party's index is append-only: a new invoice id is appended once under the issuer and
 *       once under the recipient, and never removed
 *   <li>Every mutating operation runs inside {@link #write}, which holds a single write lock for
 *       the whole read-modify-write sequence
 * </ul>
 */
@Component
public class InvoiceStore {

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final TreeMap<Long, Invoice> invoices = new TreeMap<>();
  private final Map<UUID, List<Long>> partyIndex = new HashMap<>();
  private long lastId;

  /** Runs {@code work} as one indivisible unit with respect to every other store operation. */
  public <T> T write(Supplier<T> work) {
    lock.writeLock().lock();
    try {
      return work.get();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Runs {@code work} against a consistent view of the store; never overlaps a writer. */
  public <T> T read(Supplier<T> work) {
    lock.readLock().lock();
    try {
      return work.get();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Allocates the next id, stores the record built by {@code factory} and indexes it under both
   * parties. Must run inside {@link #write}.
   *
   * @return the stored (live) record
   */
  Invoice insert(LongFunction<Invoice> factory) {
    requireWriteLock();
    long id = lastId + 1;
    Invoice invoice = factory.apply(id);
    lastId = id;
    invoices.put(id, invoice);
    partyIndex.computeIfAbsent(invoice.getIssuer(), k -> new ArrayList<>()).add(id);
    partyIndex.computeIfAbsent(invoice.getRecipient(), k -> new ArrayList<>()).add(id);
    return invoice;
  }

  /** Returns the live record for mutation. Must run inside {@link #write}. */
  Optional<Invoice> findForUpdate(long id) {
    requireWriteLock();
    return Optional.ofNullable(invoices.get(id));
  }

  /**
   * Returns the live record for mutation. Must run inside {@link #write}.
   *
   * @throws LedgerException INVOICE_NOT_FOUND if the id has never been assigned
   */
  Invoice requireForUpdate(long id) {
    return findForUpdate(id)
        .orElseThrow(
            () ->
                new LedgerException(
                    LedgerErrorCode.INVOICE_NOT_FOUND, "No invoice found with id " + id));
  }

  /** Live records in ascending id order. Must run inside {@link #write}. */
  List<Invoice> allForUpdate() {
    requireWriteLock();
    return new ArrayList<>(invoices.values());
  }

  /** Returns a detached copy of the invoice, or empty if the id has never been assigned. */
  public Optional<Invoice> findById(long id) {
    return read(() -> Optional.ofNullable(invoices.get(id)).map(Invoice::copy));
  }

  /**
   * Ids of every invoice the party takes part in, as issuer or recipient, in the order they were
   * created. Empty if the party has none.
   */
  public List<Long> listFor(UUID party) {
    return read(() -> List.copyOf(partyIndex.getOrDefault(party, List.of())));
  }

  long count() {
    return read(() -> (long) invoices.size());
  }

  private void requireWriteLock() {
    if (!lock.isWriteLockedByCurrentThread()) {
      throw new IllegalStateException("Invoice store mutation outside of a write operation");
    }
  }
}

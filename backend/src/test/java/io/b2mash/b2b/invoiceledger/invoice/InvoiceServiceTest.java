package io.b2mash.b2b.invoiceledger.invoice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import io.b2mash.b2b.invoiceledger.event.InvoiceCreatedEvent;
import io.b2mash.b2b.invoiceledger.event.InvoiceUpdatedEvent;
import io.b2mash.b2b.invoiceledger.exception.LedgerErrorCode;
import io.b2mash.b2b.invoiceledger.exception.LedgerException;
import io.b2mash.b2b.invoiceledger.testutil.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class InvoiceServiceTest {

  private static final UUID ISSUER = UUID.randomUUID();
  private static final UUID RECIPIENT = UUID.randomUUID();
  private static final UUID STRANGER = UUID.randomUUID();
  private static final Instant START = Instant.parse("2026-04-01T12:00:00Z");

  @Mock private ApplicationEventPublisher eventPublisher;

  private InvoiceStore store;
  private MutableClock clock;
  private InvoiceService service;

  @BeforeEach
  void setUp() {
    store = new InvoiceStore();
    clock = new MutableClock(START);
    service = new InvoiceService(store, eventPublisher, clock);
  }

  private Invoice createDefault() {
    return service.createInvoice(
        "Acme",
        "Globex",
        RECIPIENT,
        new BigDecimal("100"),
        START.plus(Duration.ofDays(1)),
        "March retainer",
        ISSUER);
  }

  private static void assertRejected(ThrowingCallable call, LedgerErrorCode code) {
    assertThatThrownBy(call)
        .isInstanceOfSatisfying(
            LedgerException.class, e -> assertThat(e.getCode()).isEqualTo(code));
  }

  @Test
  void createInvoice_sets_initial_state_and_indexes_both_parties() {
    var invoice = createDefault();

    assertThat(invoice.getId()).isEqualTo(1L);
    assertThat(invoice.getIssuer()).isEqualTo(ISSUER);
    assertThat(invoice.getRecipient()).isEqualTo(RECIPIENT);
    assertThat(invoice.getIssuerStatus()).isEqualTo(IssuerStatus.APPROVED);
    assertThat(invoice.getRecipientStatus()).isEqualTo(RecipientStatus.PENDING);
    assertThat(invoice.getCreationDate()).isEqualTo(START);
    assertThat(invoice.getLastModifiedDate()).isEqualTo(START);
    assertThat(service.listInvoiceIds(ISSUER)).containsExactly(1L);
    assertThat(service.listInvoiceIds(RECIPIENT)).containsExactly(1L);

    verify(eventPublisher)
        .publishEvent(
            new InvoiceCreatedEvent(
                1L,
                ISSUER,
                RECIPIENT,
                new BigDecimal("100"),
                START.plus(Duration.ofDays(1)),
                START));
  }

  @Test
  void createInvoice_returns_strictly_increasing_ids() {
    long previous = 0;
    for (int i = 0; i < 5; i++) {
      long id = createDefault().getId();
      assertThat(id).isGreaterThan(previous);
      previous = id;
    }
    assertThat(service.listInvoiceIds(ISSUER)).containsExactly(1L, 2L, 3L, 4L, 5L);
  }

  @Test
  void createInvoice_stands_when_event_subscriber_fails() {
    doThrow(new IllegalStateException("subscriber down"))
        .when(eventPublisher)
        .publishEvent(any(Object.class));

    var invoice = createDefault();

    assertThat(invoice.getId()).isEqualTo(1L);
    assertThat(store.count()).isEqualTo(1L);
    assertThat(service.listInvoiceIds(ISSUER)).containsExactly(1L);
    assertThat(service.listInvoiceIds(RECIPIENT)).containsExactly(1L);
    assertThat(service.findInvoice(1L)).isPresent();
  }

  @Test
  void approveInvoice_stands_when_event_subscriber_fails() {
    createDefault();
    doThrow(new IllegalStateException("subscriber down"))
        .when(eventPublisher)
        .publishEvent(any(Object.class));

    var invoice = service.approveInvoice(1L, RECIPIENT);

    assertThat(invoice.getRecipientStatus()).isEqualTo(RecipientStatus.APPROVED);
    assertThat(service.getInvoice(1L).isApprovedByBoth()).isTrue();
  }

  @Test
  void createInvoice_rejects_zero_and_null_recipient() {
    var due = START.plus(Duration.ofDays(1));

    assertRejected(
        () -> service.createInvoice("a", "b", null, BigDecimal.ONE, due, null, ISSUER),
        LedgerErrorCode.INVALID_RECIPIENT);
    assertRejected(
        () -> service.createInvoice("a", "b", new UUID(0, 0), BigDecimal.ONE, due, null, ISSUER),
        LedgerErrorCode.INVALID_RECIPIENT);

    assertThat(store.count()).isZero();
    verifyNoInteractions(eventPublisher);
  }

  @Test
  void createInvoice_rejects_self_assignment() {
    assertRejected(
        () ->
            service.createInvoice(
                "a", "b", ISSUER, BigDecimal.ONE, START.plusSeconds(10), null, ISSUER),
        LedgerErrorCode.SELF_ASSIGNMENT);

    assertThat(service.listInvoiceIds(ISSUER)).isEmpty();
    verifyNoInteractions(eventPublisher);
  }

  @Test
  void createInvoice_requires_due_date_strictly_in_future() {
    assertRejected(
        () -> service.createInvoice("a", "b", RECIPIENT, BigDecimal.ONE, START, null, ISSUER),
        LedgerErrorCode.DUE_DATE_IN_PAST);
    assertRejected(
        () ->
            service.createInvoice(
                "a", "b", RECIPIENT, BigDecimal.ONE, START.minusSeconds(1), null, ISSUER),
        LedgerErrorCode.DUE_DATE_IN_PAST);

    assertThat(store.count()).isZero();
    assertThat(service.listInvoiceIds(RECIPIENT)).isEmpty();
  }

  @Test
  void createInvoice_rejects_negative_amount() {
    assertRejected(
        () ->
            service.createInvoice(
                "a", "b", RECIPIENT, new BigDecimal("-1"), START.plusSeconds(10), null, ISSUER),
        LedgerErrorCode.INVALID_AMOUNT);
  }

  @Test
  void failed_create_does_not_consume_an_id() {
    assertRejected(
        () -> service.createInvoice("a", "b", RECIPIENT, BigDecimal.ONE, START, null, ISSUER),
        LedgerErrorCode.DUE_DATE_IN_PAST);

    assertThat(createDefault().getId()).isEqualTo(1L);
  }

  @Test
  void findInvoice_is_empty_for_unassigned_id() {
    createDefault();

    assertThat(service.findInvoice(0L)).isEmpty();
    assertThat(service.findInvoice(7L)).isEmpty();
    assertRejected(() -> service.getInvoice(7L), LedgerErrorCode.INVOICE_NOT_FOUND);
  }

  @Test
  void approveInvoice_by_recipient_updates_status_and_notifies() {
    createDefault();
    clock.advance(Duration.ofMinutes(5));

    var invoice = service.approveInvoice(1L, RECIPIENT);

    assertThat(invoice.getRecipientStatus()).isEqualTo(RecipientStatus.APPROVED);
    assertThat(invoice.getIssuerStatus()).isEqualTo(IssuerStatus.APPROVED);
    assertThat(invoice.getLastModifiedDate()).isEqualTo(START.plus(Duration.ofMinutes(5)));
    verify(eventPublisher)
        .publishEvent(
            new InvoiceUpdatedEvent(
                1L,
                IssuerStatus.APPROVED,
                RecipientStatus.APPROVED,
                START.plus(Duration.ofMinutes(5))));
  }

  @Test
  void approveInvoice_twice_by_recipient_fails_without_changes() {
    createDefault();
    service.approveInvoice(1L, RECIPIENT);
    var before = service.getInvoice(1L);
    clock.advance(Duration.ofMinutes(1));

    assertRejected(() -> service.approveInvoice(1L, RECIPIENT), LedgerErrorCode.INVALID_TRANSITION);

    var after = service.getInvoice(1L);
    assertThat(after).usingRecursiveComparison().isEqualTo(before);
  }

  @Test
  void approveInvoice_by_stranger_is_unauthorized() {
    createDefault();

    assertRejected(() -> service.approveInvoice(1L, STRANGER), LedgerErrorCode.UNAUTHORIZED);
    assertRejected(() -> service.rejectInvoice(1L, STRANGER), LedgerErrorCode.UNAUTHORIZED);
    assertThat(service.getInvoice(1L).getRecipientStatus()).isEqualTo(RecipientStatus.PENDING);
  }

  @Test
  void mutations_on_unknown_invoice_report_not_found() {
    assertRejected(() -> service.approveInvoice(9L, ISSUER), LedgerErrorCode.INVOICE_NOT_FOUND);
    assertRejected(() -> service.rejectInvoice(9L, ISSUER), LedgerErrorCode.INVOICE_NOT_FOUND);
    verifyNoInteractions(eventPublisher);
  }

  @Test
  void rejectInvoice_by_recipient_rejects_both_sides() {
    createDefault();

    var invoice = service.rejectInvoice(1L, RECIPIENT);

    assertThat(invoice.getIssuerStatus()).isEqualTo(IssuerStatus.REJECTED);
    assertThat(invoice.getRecipientStatus()).isEqualTo(RecipientStatus.REJECTED);
  }

  @Test
  void rejectInvoice_by_issuer_requires_issuer_pending() {
    createDefault();

    assertRejected(() -> service.rejectInvoice(1L, ISSUER), LedgerErrorCode.INVALID_TRANSITION);
  }

  @Test
  void issuer_can_reject_after_recipient_modified_terms() {
    createDefault();
    service.modifyInvoice(
        1L, "Globex", new BigDecimal("90"), START.plus(Duration.ofDays(2)), "counter", RECIPIENT);

    var invoice = service.rejectInvoice(1L, ISSUER);

    assertThat(invoice.getIssuerStatus()).isEqualTo(IssuerStatus.REJECTED);
    assertThat(invoice.getRecipientStatus()).isEqualTo(RecipientStatus.REJECTED);
  }

  @Test
  void modifyInvoice_by_recipient_reopens_issuer_approval() {
    createDefault();
    clock.advance(Duration.ofHours(1));
    var newDue = START.plus(Duration.ofDays(10));

    var invoice =
        service.modifyInvoice(
            1L, "Globex EU", new BigDecimal("75.50"), newDue, "revised", RECIPIENT);

    assertThat(invoice.getRecipientStatus()).isEqualTo(RecipientStatus.APPROVED);
    assertThat(invoice.getIssuerStatus()).isEqualTo(IssuerStatus.PENDING);
    assertThat(invoice.getAmount()).isEqualByComparingTo("75.50");
    assertThat(invoice.getDueDate()).isEqualTo(newDue);
    assertThat(invoice.getClientName()).isEqualTo("Globex EU");
    assertThat(invoice.getMessage()).isEqualTo("revised");
    assertThat(invoice.getIssuerName()).isEqualTo("Acme");
    assertThat(invoice.getCreationDate()).isEqualTo(START);
    assertThat(invoice.getLastModifiedDate()).isEqualTo(START.plus(Duration.ofHours(1)));
  }

  @Test
  void modifyInvoice_back_and_forth_alternates_pending_side() {
    createDefault();
    var due = START.plus(Duration.ofDays(3));
    service.modifyInvoice(1L, "c", new BigDecimal("90"), due, "m1", RECIPIENT);

    var invoice = service.modifyInvoice(1L, "c", new BigDecimal("95"), due, "m2", ISSUER);

    assertThat(invoice.getIssuerStatus()).isEqualTo(IssuerStatus.APPROVED);
    assertThat(invoice.getRecipientStatus()).isEqualTo(RecipientStatus.PENDING);
    assertThat(invoice.getAmount()).isEqualByComparingTo("95");
  }

  @Test
  void modifyInvoice_checks_due_date_before_transition() {
    createDefault();

    assertRejected(
        () -> service.modifyInvoice(1L, "c", BigDecimal.ONE, START, "m", ISSUER),
        LedgerErrorCode.DUE_DATE_IN_PAST);
    assertRejected(
        () ->
            service.modifyInvoice(1L, "c", BigDecimal.ONE, START.plusSeconds(60), "m", ISSUER),
        LedgerErrorCode.INVALID_TRANSITION);
    assertRejected(
        () ->
            service.modifyInvoice(1L, "c", BigDecimal.ONE, START.plusSeconds(60), "m", STRANGER),
        LedgerErrorCode.UNAUTHORIZED);
  }

  @Test
  void modifyInvoice_after_full_rejection_is_refused_for_both_parties() {
    createDefault();
    service.rejectInvoice(1L, RECIPIENT);
    var due = START.plus(Duration.ofDays(5));

    assertRejected(
        () -> service.modifyInvoice(1L, "c", BigDecimal.ONE, due, "m", ISSUER),
        LedgerErrorCode.INVALID_TRANSITION);
    assertRejected(
        () -> service.modifyInvoice(1L, "c", BigDecimal.ONE, due, "m", RECIPIENT),
        LedgerErrorCode.INVALID_TRANSITION);
  }

  @Test
  void notifications_follow_mutation_order() {
    createDefault();
    service.approveInvoice(1L, RECIPIENT);

    var inOrder = Mockito.inOrder(eventPublisher);
    var captor = ArgumentCaptor.forClass(Object.class);
    inOrder.verify(eventPublisher, Mockito.times(2)).publishEvent(captor.capture());
    assertThat(captor.getAllValues())
        .hasExactlyElementsOfTypes(InvoiceCreatedEvent.class, InvoiceUpdatedEvent.class);
    verifyNoMoreInteractions(eventPublisher);
  }
}

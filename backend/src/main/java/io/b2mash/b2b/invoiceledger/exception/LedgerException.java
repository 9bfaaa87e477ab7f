package io.b2mash.b2b.invoiceledger.exception;

import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Rejection of a ledger operation. The {@link LedgerErrorCode} is exposed both programmatically and
 * as the {@code reason} property of the problem body.
 */
public class LedgerException extends ErrorResponseException {

  private final LedgerErrorCode code;

  public LedgerException(LedgerErrorCode code, String detail) {
    this(code, detail, null);
  }

  public LedgerException(LedgerErrorCode code, String detail, Throwable cause) {
    super(code.getStatus(), createProblem(code, detail), cause);
    this.code = code;
  }

  public LedgerErrorCode getCode() {
    return code;
  }

  @Override
  public String getMessage() {
    return code + ": " + getBody().getDetail();
  }

  private static ProblemDetail createProblem(LedgerErrorCode code, String detail) {
    var problem = ProblemDetail.forStatus(code.getStatus());
    problem.setTitle(code.getTitle());
    problem.setDetail(detail);
    problem.setProperty("reason", code.name());
    return problem;
  }
}

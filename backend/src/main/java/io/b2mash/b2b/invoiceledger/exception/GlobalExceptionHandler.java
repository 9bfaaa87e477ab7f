package io.b2mash.b2b.invoiceledger.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(LedgerException.class)
  public ResponseEntity<ProblemDetail> handleLedgerException(
      LedgerException ex, HttpServletRequest request) {
    if (ex.getCode() == LedgerErrorCode.TRANSFER_FAILED) {
      log.error(
          "Ledger operation failed: path={}, method={}, reason={}, detail={}",
          request.getRequestURI(),
          request.getMethod(),
          ex.getCode(),
          ex.getBody().getDetail(),
          ex.getCause());
    } else {
      log.warn(
          "Ledger operation rejected: path={}, method={}, reason={}, detail={}",
          request.getRequestURI(),
          request.getMethod(),
          ex.getCode(),
          ex.getBody().getDetail());
    }
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }
}

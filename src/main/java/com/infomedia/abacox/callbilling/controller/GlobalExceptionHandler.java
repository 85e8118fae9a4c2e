package com.infomedia.abacox.callbilling.controller;

import com.infomedia.abacox.callbilling.exception.*;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps ledger and argument failures to problem details. Bean validation and binding errors are
 * handled by the inherited handlers.
 */
@RestControllerAdvice
@Log4j2
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(AccountNotFoundException.class)
    public ProblemDetail handleAccountNotFound(AccountNotFoundException ex) {
        return ErrorController.problem(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(ReservationNotFoundException.class)
    public ProblemDetail handleReservationNotFound(ReservationNotFoundException ex) {
        return ErrorController.problem(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler({InsufficientBalanceException.class, AccountNotActiveException.class,
            ConcurrentCallLimitException.class})
    public ProblemDetail handleRefused(LedgerException ex) {
        return ErrorController.problem(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    }

    @ExceptionHandler(DuplicateReservationException.class)
    public ProblemDetail handleDuplicate(DuplicateReservationException ex) {
        return ErrorController.problem(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(LedgerWriteException.class)
    public ProblemDetail handleWriteFailure(LedgerWriteException ex) {
        log.error("Ledger write failed", ex);
        return ErrorController.problem(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        return ErrorController.problem(HttpStatus.BAD_REQUEST, ex.getMessage());
    }
}

package com.demo.coffeeshop.web;

import com.myorg.cafe.eventstore.exception.AggregateNotFoundException;
import com.myorg.cafe.eventstore.exception.ConcurrencyConflictException;
import com.myorg.cafe.eventstore.exception.InvalidStateTransitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import javax.money.MonetaryException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ProblemDetail invalidTransition(InvalidStateTransitionException e) {
        log.warn("Command rejected: {}", e.getMessage());
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
        pd.setProperty("reason", e.getReason());
        pd.setProperty("command", e.getCommand());
        pd.setProperty("currentState", e.getCurrentState());
        return pd;
    }

    @ExceptionHandler(AggregateNotFoundException.class)
    public ProblemDetail notFound(AggregateNotFoundException e) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, e.getMessage());
        pd.setProperty("reason", e.getReason());
        return pd;
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ProblemDetail conflict(ConcurrencyConflictException e) {
        log.warn("Concurrent modification: {}", e.getMessage());
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, e.getMessage());
        pd.setProperty("expectedSequence", e.getExpectedSequence());
        pd.setProperty("actualSequence", e.getActualSequence());
        return pd;
    }

    @ExceptionHandler({IllegalArgumentException.class, MonetaryException.class})
    public ProblemDetail badRequest(RuntimeException e) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
    }
}

package com.jamcycle.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class BallotRejectedExceptionHandler {

    @ExceptionHandler(BallotRejectedException.class)
    public ResponseEntity<BallotRejectedErrorResponse> handle(BallotRejectedException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new BallotRejectedErrorResponse(ex.getCode(), ex.getMessage()));
    }

    public record BallotRejectedErrorResponse(
            String code,
            String message
    ) {
    }
}

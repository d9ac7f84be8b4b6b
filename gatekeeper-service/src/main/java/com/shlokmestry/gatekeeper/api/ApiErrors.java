package com.shlokmestry.gatekeeper.api;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.shlokmestry.gatekeeper.net.InvalidRangeException;

@RestControllerAdvice
public class ApiErrors {

    @ExceptionHandler(InvalidRangeException.class)
    public ResponseEntity<ErrorBody> invalidRange(InvalidRangeException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorBody("invalid_range", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> badArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorBody("bad_request", e.getMessage()));
    }
}

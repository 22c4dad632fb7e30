package com.calibrationplatform.calibration.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;

@RestControllerAdvice
public class CalibrationErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(CalibrationErrorHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidRequest(IllegalArgumentException ex) {
        log.warn("[CalibrationApi] rejected request: {}", ex.getMessage());
        return body(ex.getMessage());
    }

    /** Body decoding failures, including range checks thrown from record constructors. */
    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadableRequest(ServerWebInputException ex) {
        String message = NestedExceptionUtils.getMostSpecificCause(ex).getMessage();
        log.warn("[CalibrationApi] unreadable request: {}", message);
        return body(message);
    }

    private static Map<String, Object> body(String message) {
        return Map.of(
            "code", "INVALID_CALIBRATION_REQUEST",
            "message", String.valueOf(message)
        );
    }
}

package com.bank.billshock.controller;

import com.bank.billshock.model.ErrorKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Maps pipeline failures onto HTTP responses with an {"error", "message"} body.
 */
final class FailureResponses {

    private FailureResponses() {}

    static ResponseEntity<Map<String, Object>> of(ErrorKind kind, String message) {
        return ResponseEntity.status(statusOf(kind))
                .body(Map.of("error", kind.name(), "message", message != null ? message : kind.name()));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        if (kind.isNotFound()) return HttpStatus.NOT_FOUND;
        if (kind.isInternal()) return HttpStatus.INTERNAL_SERVER_ERROR;
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }
}

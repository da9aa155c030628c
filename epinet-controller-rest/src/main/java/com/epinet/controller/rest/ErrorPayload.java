package com.epinet.controller.rest;

import java.time.Instant;
import org.springframework.http.HttpStatus;

/** JSON body of every error returned by the epinet endpoints. */
public record ErrorPayload(Instant timestamp, int status, String error, String message, String path) {

    static ErrorPayload of(HttpStatus status, String message, String path) {
        return new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), message, path);
    }
}

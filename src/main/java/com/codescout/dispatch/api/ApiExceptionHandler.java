package com.codescout.dispatch.api;

import com.codescout.core.CodescoutException;
import com.codescout.core.ratelimit.RateLimitExceededException;
import com.codescout.core.review.InvalidProjectRootException;
import com.codescout.core.sandbox.OutsideSandboxException;
import com.codescout.core.session.IncompatibleSessionException;
import com.codescout.core.session.SessionBusyException;
import com.codescout.core.session.SessionExistsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps core failures raised outside a review to {@code {"error", "message"}} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({InvalidProjectRootException.class, OutsideSandboxException.class})
    public ResponseEntity<Map<String, String>> badRequest(CodescoutException e) {
        return body(HttpStatus.BAD_REQUEST, e.kind(), e.getMessage());
    }

    @ExceptionHandler({SessionBusyException.class, IncompatibleSessionException.class, SessionExistsException.class})
    public ResponseEntity<Map<String, String>> conflict(CodescoutException e) {
        log.warn("Request rejected ({}): {}", e.kind(), e.getMessage());
        return body(HttpStatus.CONFLICT, e.kind(), e.getMessage());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, String>> tooManyRequests(RateLimitExceededException e) {
        return body(HttpStatus.TOO_MANY_REQUESTS, e.kind(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> invalidArgument(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, "invalid_argument", e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String kind, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", kind);
        body.put("message", message != null ? message : "");
        return ResponseEntity.status(status).body(body);
    }
}

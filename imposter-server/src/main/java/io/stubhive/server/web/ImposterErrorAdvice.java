package io.stubhive.server.web;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.error.ImposterException;
import io.stubhive.imposter.error.ImposterNotFoundException;
import io.stubhive.imposter.error.PortInUseException;
import io.stubhive.imposter.model.ImposterJson;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Renders failures as {@code {"errors": [{"code": ..., "message": ...}]}}.
 */
@RestControllerAdvice
public class ImposterErrorAdvice {
    private static final Logger log = LoggerFactory.getLogger(ImposterErrorAdvice.class);

    @ExceptionHandler(ImposterException.class)
    ResponseEntity<ObjectNode> imposterFailure(ImposterException ex) {
        HttpStatus status = statusOf(ex);
        log.warn("[REST] -> status={} code={} message={}", status.value(), ex.code(), ex.getMessage());
        return errors(status, ex.code(), ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ObjectNode> unreadable(Exception ex) {
        log.warn("[REST] -> status=400 unreadable request: {}", ex.getMessage());
        return errors(HttpStatus.BAD_REQUEST, "bad data", "request could not be read: " + ex.getMessage());
    }

    @ExceptionHandler(IOException.class)
    ResponseEntity<ObjectNode> ioFailure(IOException ex) {
        log.error("[REST] -> status=500 I/O failure", ex);
        return errors(HttpStatus.INTERNAL_SERVER_ERROR, "io error", ex.getMessage());
    }

    static HttpStatus statusOf(ImposterException ex) {
        if (ex instanceof PortInUseException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof ImposterNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private static ResponseEntity<ObjectNode> errors(HttpStatus status, String code, String message) {
        ObjectNode body = ImposterJson.objectNode();
        ObjectNode error = body.putArray("errors").addObject();
        error.put("code", code);
        error.put("message", message);
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }
}

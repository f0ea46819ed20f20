package com.coderelay.engine.api;

import com.coderelay.engine.error.LeaseExpiredException;
import com.coderelay.engine.error.NotFoundException;
import com.coderelay.engine.error.StaleStateException;
import com.coderelay.engine.tree.TreeConflictException;
import com.coderelay.engine.tree.TreeIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine exceptions to HTTP statuses.
 *
 *   404  unknown task / proposal / workspace
 *   409  lost CAS race, wrong state, lost claim
 *   422  conflicting paths
 *   503  backend failures that outlasted the retry budget
 *   400  malformed input
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(NotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({StaleStateException.class, IllegalStateException.class, LeaseExpiredException.class})
    public ResponseEntity<Map<String, Object>> conflict(RuntimeException e) {
        log.debug("Rejected with 409: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(TreeConflictException.class)
    public ResponseEntity<Map<String, Object>> treeConflict(TreeConflictException e) {
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
        response.getBody().put("conflictingPaths", e.getConflictingPaths());
        return response;
    }

    @ExceptionHandler(TreeIOException.class)
    public ResponseEntity<Map<String, Object>> unavailable(TreeIOException e) {
        log.error("Versioned tree unavailable", e);
        return body(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}

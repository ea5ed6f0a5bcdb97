package com.skillbridge.rootbot.api;

import com.skillbridge.rootbot.bot.TurnFailedException;
import com.skillbridge.rootbot.connector.ConnectorException;
import com.skillbridge.rootbot.skill.SkillInvocationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Maps exceptions escaping the controllers to HTTP statuses.
 *
 * 400 malformed or incomplete activity
 * 404 unknown skill conversation (ResponseStatusException)
 * 500 the turn failed; already reported to the user by BotAdapter
 * 502 a skill or the channel failed outside a turn
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> handleResponseStatus(ResponseStatusException e) {
        return ResponseEntity.status(e.getStatusCode())
                .body(Map.of("error", String.valueOf(e.getReason())));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(TurnFailedException.class)
    public ResponseEntity<Map<String, String>> handleTurnFailed(TurnFailedException e) {
        // BotAdapter has already logged the cause with its stack trace.
        return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler({SkillInvocationException.class, ConnectorException.class})
    public ResponseEntity<Map<String, String>> handleUpstream(RuntimeException e) {
        log.error("Upstream call failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneral(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity.internalServerError()
                .body(Map.of("error", "Internal server error: " + e.getMessage()));
    }
}

package org.app.challenge.controller;

import lombok.extern.slf4j.Slf4j;
import org.app.challenge.exception.ConfigException;
import org.app.challenge.exception.ScenarioNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ChallengeExceptionHandler {

    @ExceptionHandler(ScenarioNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(ScenarioNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "scenario_not_found", "message", e.getMessage()));
    }

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<Map<String, String>> badConfig(ConfigException e) {
        log.warn("Configuration error while serving request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "invalid_configuration", "message", e.getMessage()));
    }
}

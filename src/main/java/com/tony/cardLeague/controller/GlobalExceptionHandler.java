package com.tony.cardLeague.controller;

import com.tony.cardLeague.exception.*;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Traduction des erreurs métier en réponses HTTP.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({LobbyNotFoundException.class, MatchNotFoundException.class, TeamNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(LeagueException e) {
        return buildErrorResponse(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({MatchAlreadyPlayedException.class, LeagueAlreadyScheduledException.class,
            ScheduleAlreadyExistsException.class, RewardsAlreadyIssuedException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(LeagueException e) {
        return buildErrorResponse(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler({LobbyNotFullException.class, IncompleteMatchdayException.class, IncompleteTeamException.class})
    public ResponseEntity<Map<String, Object>> handleUnprocessable(LeagueException e) {
        return buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler(InvalidChemistryException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidChemistry(InvalidChemistryException e) {
        ResponseEntity<Map<String, Object>> response = buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
        response.getBody().put("violations", e.getViolations());
        return response;
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e) {
        log.error("❌ Erreur inattendue", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred: " + e.getMessage());
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(HttpStatus status, String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("error", message);
        error.put("status", status.value());
        return ResponseEntity.status(status).body(error);
    }
}

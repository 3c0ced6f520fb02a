package com.imperialduel.duel.api;

import com.imperialduel.duel.engine.DuelRuleException;
import com.imperialduel.duel.engine.DuplicateMatchException;
import com.imperialduel.duel.engine.IllegalTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);
  private static final String CODE_PREFIX = "DUEL_";

  @ExceptionHandler({DuplicateMatchException.class, IllegalTransitionException.class})
  public ResponseEntity<ApiErrorResponse> handleConflict(DuelRuleException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(CODE_PREFIX + ex.code(), ex.getMessage()));
  }

  @ExceptionHandler(DuelRuleException.class)
  public ResponseEntity<ApiErrorResponse> handleRuleViolation(DuelRuleException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(CODE_PREFIX + ex.code(), ex.getMessage()));
  }

  @ExceptionHandler(InvalidDuelRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidDuelRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("DUEL_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("DUEL_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(MatchNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(MatchNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("DUEL_MATCH_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(NotParticipantException.class)
  public ResponseEntity<ApiErrorResponse> handleNotParticipant(NotParticipantException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse("DUEL_NOT_PARTICIPANT", ex.getMessage()));
  }

  @ExceptionHandler(ModeratorAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleModeratorDenied(
      ModeratorAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse("DUEL_MODERATOR_REQUIRED", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled duel api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("DUEL_INTERNAL_ERROR", ex.getMessage()));
  }
}

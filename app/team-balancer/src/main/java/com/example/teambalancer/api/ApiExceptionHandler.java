package com.example.teambalancer.api;

import com.example.teambalancer.model.SessionErrorCode;
import com.example.teambalancer.repository.SessionPersistenceException;
import com.example.teambalancer.service.RatingLookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(SessionOperationException.class)
  public ResponseEntity<ApiErrorResponse> handleSessionOperation(SessionOperationException ex) {
    return ResponseEntity.status(statusOf(ex.error()))
        .body(new ApiErrorResponse(ex.error().name(), ex.getMessage(), ex.failedParticipants()));
  }

  @ExceptionHandler(InvalidBalancerRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(
      InvalidBalancerRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BALANCER_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BALANCER_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(IdentityNotLinkedException.class)
  public ResponseEntity<ApiErrorResponse> handleNotLinked(IdentityNotLinkedException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("IDENTITY_NOT_LINKED", ex.getMessage()));
  }

  @ExceptionHandler(PlayerProfileNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleProfileNotFound(
      PlayerProfileNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("PLAYER_PROFILE_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(MissingGameStatsException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingGameStats(MissingGameStatsException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ApiErrorResponse("NO_GAME_STATS", ex.getMessage()));
  }

  @ExceptionHandler(RatingLookupException.class)
  public ResponseEntity<ApiErrorResponse> handleRatingLookup(RatingLookupException ex) {
    logger.warn("rating lookup failed reason={}", ex.reason(), ex);
    if (ex.reason() == RatingLookupException.Reason.TIMEOUT) {
      return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
          .body(new ApiErrorResponse("RATING_LOOKUP_TIMEOUT", ex.getMessage()));
    }
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ApiErrorResponse("RATING_LOOKUP_FAILED", ex.getMessage()));
  }

  @ExceptionHandler({DataAccessException.class, SessionPersistenceException.class})
  public ResponseEntity<ApiErrorResponse> handleDataAccess(RuntimeException ex) {
    logger.warn("dependency unavailable", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("BALANCER_DEPENDENCY_UNAVAILABLE", "storage unavailable"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("BALANCER_INTERNAL_ERROR", ex.getMessage()));
  }

  static HttpStatus statusOf(SessionErrorCode error) {
    return switch (error) {
      case NOT_LINKED -> HttpStatus.PRECONDITION_FAILED;
      case ALREADY_JOINED, FULL, WRONG_SIZE, ALREADY_BALANCED, INVALID_STATE, SESSION_TERMINAL ->
          HttpStatus.CONFLICT;
      case NOT_MEMBER, PLAYER_NOT_FOUND, SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
      case SESSION_UNAVAILABLE -> HttpStatus.GONE;
      case PARTIAL_FAILURE -> HttpStatus.BAD_GATEWAY;
    };
  }
}

package com.scholary.recipe.media.api;

import com.scholary.recipe.media.asset.AssetNotFoundException;
import com.scholary.recipe.media.asset.IllegalAssetTransitionException;
import com.scholary.recipe.media.provider.ProviderException;
import com.scholary.recipe.media.service.AssetAccessDeniedException;
import com.scholary.recipe.media.service.AssetTypeMismatchException;
import com.scholary.recipe.media.service.InvalidUploadRequestException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps media pipeline exceptions to HTTP responses.
 *
 * <p>Every error body has the shape {@code {"error": "..."}}; validation failures add per-field
 * {@code details}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(AssetNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(AssetNotFoundException ex) {
    LOGGER.debug("Asset not found: {}", ex.getAssetId());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("Media not found"));
  }

  @ExceptionHandler(AssetAccessDeniedException.class)
  public ResponseEntity<ErrorResponse> handleAccessDenied(AssetAccessDeniedException ex) {
    LOGGER.warn("Access denied: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ErrorResponse.of("Forbidden"));
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    if (MediaController.USER_HEADER.equals(ex.getHeaderName())) {
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorResponse.of("Unauthorized"));
    }
    return ResponseEntity.badRequest()
        .body(ErrorResponse.of("Missing header " + ex.getHeaderName()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    Map<String, List<String>> details = new LinkedHashMap<>();
    for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
      details
          .computeIfAbsent(fieldError.getField(), field -> new ArrayList<>())
          .add(fieldError.getDefaultMessage());
    }
    LOGGER.debug("Invalid request: {}", details);
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request", details));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.debug("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(ErrorResponse.of("Invalid request"));
  }

  @ExceptionHandler(InvalidUploadRequestException.class)
  public ResponseEntity<ErrorResponse> handleInvalidUpload(InvalidUploadRequestException ex) {
    return ResponseEntity.badRequest().body(ErrorResponse.of(ex.getMessage()));
  }

  @ExceptionHandler(AssetTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(AssetTypeMismatchException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of(ex.getMessage()));
  }

  @ExceptionHandler(IllegalAssetTransitionException.class)
  public ResponseEntity<ErrorResponse> handleIllegalTransition(IllegalAssetTransitionException ex) {
    LOGGER.warn("Rejected asset transition: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of(ex.getMessage()));
  }

  @ExceptionHandler(ProviderException.class)
  public ResponseEntity<ErrorResponse> handleProvider(ProviderException ex) {
    LOGGER.error("Media provider failure: status={}", ex.getStatusCode(), ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(ErrorResponse.of("Media provider error: " + ex.getMessage()));
  }
}

package com.brandpulse.api.controller;

import com.brandpulse.api.service.BrandNotFoundException;
import com.brandpulse.processing.classifier.ModelLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice(basePackages = "com.brandpulse.api.controller")
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(BrandNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleBrandNotFound(BrandNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "BRAND_NOT_FOUND", ex.getMessage());
  }

  @ExceptionHandler({
      IllegalArgumentException.class,
      HttpMessageNotReadableException.class,
      MissingServletRequestParameterException.class,
      MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
    log.debug("Rejected request: {}", ex.getMessage());
    String message = ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage();
    return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", message);
  }

  @ExceptionHandler(ModelLoadException.class)
  public ResponseEntity<Map<String, Object>> handleModelLoad(ModelLoadException ex) {
    log.error("Classifiers unavailable: {}", ex.getMessage(), ex);
    return error(HttpStatus.SERVICE_UNAVAILABLE, "MODELS_UNAVAILABLE", "Classifiers could not be loaded");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
    log.error("Unexpected error: {}", ex.getMessage(), ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
  }

  private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", code);
    body.put("message", message);
    body.put("status", status.value());
    body.put("timestamp", Instant.now().toString());
    return ResponseEntity.status(status).body(body);
  }
}

package com.helpline.crm.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ResponseEntity<?> validation(MethodArgumentNotValidException ex){
    var fieldError = ex.getBindingResult().getFieldError();
    String message = fieldError == null
        ? "Validation error"
        : fieldError.getField() + ": " + Objects.toString(fieldError.getDefaultMessage(), "invalid");
    return ResponseEntity.badRequest().body(body("VALIDATION_ERROR", message));
  }

  @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
  ResponseEntity<?> unreadable(Exception ex){
    return ResponseEntity.badRequest().body(body("VALIDATION_ERROR", "Malformed request"));
  }

  @ExceptionHandler(ApiException.class)
  ResponseEntity<?> api(ApiException ex) {
    return ResponseEntity.status(ex.status()).body(body(ex.code(), ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  ResponseEntity<?> generic(Exception ex){
    if (ex instanceof ErrorResponse) {
      ErrorResponse framework = (ErrorResponse) ex;
      return ResponseEntity.status(framework.getStatusCode())
          .body(body("BAD_REQUEST", Objects.toString(ex.getMessage(), framework.getStatusCode().toString())));
    }
    log.error("Unhandled error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(body("INTERNAL_ERROR", Objects.toString(ex.getMessage(), ex.getClass().getSimpleName())));
  }

  public static Map<String, Object> body(String code, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", code);
    body.put("message", message);
    return body;
  }
}

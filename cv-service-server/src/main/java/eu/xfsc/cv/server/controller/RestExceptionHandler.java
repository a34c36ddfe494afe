package eu.xfsc.cv.server.controller;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import eu.xfsc.cv.core.exception.ClientException;
import eu.xfsc.cv.core.exception.ServiceException;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps request failures to JSON error bodies.
 */
@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

  @ExceptionHandler({ClientException.class, MissingServletRequestParameterException.class,
      HttpMessageNotReadableException.class})
  public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
    log.info("handleBadRequest; {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<Map<String, String>> handleMediaType(HttpMediaTypeNotSupportedException ex) {
    return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ex.getMessage());
  }

  @ExceptionHandler(ServiceException.class)
  public ResponseEntity<Map<String, String>> handleServiceException(ServiceException ex) {
    log.error("handleServiceException; unexpected failure", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
  }

  private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(Map.of("message", message == null ? status.getReasonPhrase() : message));
  }
}

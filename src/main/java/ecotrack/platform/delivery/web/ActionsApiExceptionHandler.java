package ecotrack.platform.delivery.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import ecotrack.core.actions.ActionNotFoundException;
import ecotrack.core.actions.ActionStorageException;
import ecotrack.core.actions.ActionValidationException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps action store failures to HTTP responses: 400 for bad input, 404 for unknown ids, 500 for storage. */
@RestControllerAdvice
public class ActionsApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ActionsApiExceptionHandler.class);

  @ExceptionHandler(ActionValidationException.class)
  public ResponseEntity<ErrorResponse> handleValidation(ActionValidationException e) {
    log.warn("Rejected action fields: {}", e.fieldErrors());
    return ResponseEntity.badRequest().body(new ErrorResponse("Validation failed.", e.fieldErrors()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    log.warn("Unreadable request body: {}", e.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("Request body must be a JSON object."));
  }

  @ExceptionHandler(ActionNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(ActionNotFoundException e) {
    log.warn(e.getMessage());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage()));
  }

  // Ids too large for a long still match the numeric route.
  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleBadId(MethodArgumentTypeMismatchException e) {
    log.warn("Unparsable {}: {}", e.getName(), e.getValue());
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ErrorResponse("Action " + e.getValue() + " not found."));
  }

  @ExceptionHandler(ActionStorageException.class)
  public ResponseEntity<ErrorResponse> handleStorage(ActionStorageException e) {
    log.error("Action storage failure at {}", e.file(), e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse("Action storage is unavailable."));
  }

  @JsonInclude(Include.NON_NULL)
  public record ErrorResponse(String error, Map<String, List<String>> fields) {
    public ErrorResponse(String error) {
      this(error, null);
    }
  }
}

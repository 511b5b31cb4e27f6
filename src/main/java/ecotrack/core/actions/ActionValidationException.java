package ecotrack.core.actions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ActionValidationException extends RuntimeException {
  private final List<FieldError> errors;

  public ActionValidationException(List<FieldError> errors) {
    super("Invalid action fields: " + String.join(", ", groupMessages(errors).keySet()));
    this.errors = List.copyOf(errors);
  }

  public List<FieldError> errors() {
    return errors;
  }

  /** Messages keyed by field name, in {@link ActionField} order. */
  public Map<String, List<String>> fieldErrors() {
    return groupMessages(errors);
  }

  private static Map<String, List<String>> groupMessages(List<FieldError> errors) {
    Map<String, List<String>> grouped = new LinkedHashMap<>();
    for (FieldError error : errors) {
      grouped.computeIfAbsent(error.field(), k -> new ArrayList<>()).add(error.message());
    }
    return Collections.unmodifiableMap(grouped);
  }
}

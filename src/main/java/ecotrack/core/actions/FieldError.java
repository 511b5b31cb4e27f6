package ecotrack.core.actions;

/** One rejected field value, e.g. {@code ("action", "action.empty", "Action cannot be empty.")}. */
public record FieldError(String field, String code, String message) {}

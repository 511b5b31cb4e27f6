package ecotrack.core.actions;

import java.util.Optional;

public enum ActionField {
  ACTION("action"),
  DATE("date"),
  POINTS("points");

  private final String key;

  ActionField(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  public static Optional<ActionField> fromKey(String key) {
    if (key == null) {
      return Optional.empty();
    }
    for (ActionField field : values()) {
      if (field.key.equals(key)) {
        return Optional.of(field);
      }
    }
    return Optional.empty();
  }
}

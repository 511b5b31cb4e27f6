package ecotrack.core.actions;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Client-supplied values for an action, as decoded from a request body.
 *
 * <p>A field is either absent, present with {@code null}, or present with a raw value (a string,
 * a number, or whatever else the client sent). Keys that do not name an {@link ActionField},
 * {@code id} included, are dropped.
 */
public final class ActionFields {
  private final Map<ActionField, Object> values;

  private ActionFields(Map<ActionField, Object> values) {
    this.values = values;
  }

  public static ActionFields empty() {
    return new ActionFields(new EnumMap<>(ActionField.class));
  }

  public static ActionFields of(Object action, Object date, Object points) {
    return empty().with(ActionField.ACTION, action).with(ActionField.DATE, date).with(ActionField.POINTS, points);
  }

  public static ActionFields fromMap(Map<String, ?> raw) {
    ActionFields fields = empty();
    if (raw == null) {
      return fields;
    }
    for (Map.Entry<String, ?> entry : raw.entrySet()) {
      ActionField.fromKey(entry.getKey()).ifPresent(field -> fields.values.put(field, entry.getValue()));
    }
    return fields;
  }

  public ActionFields with(ActionField field, Object value) {
    EnumMap<ActionField, Object> copy = new EnumMap<>(ActionField.class);
    copy.putAll(values);
    copy.put(field, value);
    return new ActionFields(copy);
  }

  public boolean has(ActionField field) {
    return values.containsKey(field);
  }

  public Object get(ActionField field) {
    return values.get(field);
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public Map<ActionField, Object> asMap() {
    return Collections.unmodifiableMap(values);
  }

  @Override
  public String toString() {
    return "ActionFields" + values;
  }
}

package ecotrack.core.actions;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks client-supplied fields against the action constraints and converts them to typed values.
 *
 * <p>Every field is checked before failing, so one {@link ActionValidationException} carries all
 * messages. "Today" is read from the clock on each call.
 */
public class ActionValidator {
  public static final int MAX_ACTION_LENGTH = 255;

  static final String REQUIRED = "This field is required.";
  static final String NOT_NULL = "This field may not be null.";
  static final String NOT_A_STRING = "Not a valid string.";
  static final String ACTION_EMPTY = "Action cannot be empty.";
  static final String ACTION_TOO_LONG =
      "Ensure this field has no more than " + MAX_ACTION_LENGTH + " characters.";
  static final String DATE_FORMAT = "Date has wrong format. Use YYYY-MM-DD.";
  static final String DATE_IN_FUTURE = "Date cannot be in the future.";
  static final String POINTS_NOT_INTEGER = "A valid integer is required.";
  static final String POINTS_NOT_POSITIVE = "Points must be a positive integer.";

  private static final Pattern DATE_TEXT = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
  private static final Pattern INTEGER_TEXT = Pattern.compile("[-+]?\\d+(\\.0+)?");

  private final Clock clock;

  public ActionValidator(Clock clock) {
    this.clock = clock;
  }

  /**
   * Validates {@code fields}. With {@code partial} false every field is required; with it true only
   * the supplied fields are checked and the rest come back {@code null}.
   */
  public ActionChanges validate(ActionFields fields, boolean partial) {
    List<FieldError> errors = new ArrayList<>();
    LocalDate today = LocalDate.now(clock);

    String action = null;
    LocalDate date = null;
    Integer points = null;

    for (ActionField field : ActionField.values()) {
      if (!fields.has(field)) {
        if (!partial) {
          reject(errors, field, "required", REQUIRED);
        }
        continue;
      }

      Object raw = fields.get(field);
      if (raw == null) {
        reject(errors, field, "null", NOT_NULL);
        continue;
      }

      switch (field) {
        case ACTION -> action = validateAction(raw, errors);
        case DATE -> date = validateDate(raw, today, errors);
        case POINTS -> points = validatePoints(raw, errors);
      }
    }

    if (!errors.isEmpty()) {
      throw new ActionValidationException(errors);
    }
    return new ActionChanges(action, date, points);
  }

  private static String validateAction(Object raw, List<FieldError> errors) {
    if (!(raw instanceof CharSequence) && !(raw instanceof Number)) {
      reject(errors, ActionField.ACTION, "invalid", NOT_A_STRING);
      return null;
    }
    String value = raw.toString().trim();
    if (value.isEmpty()) {
      reject(errors, ActionField.ACTION, "empty", ACTION_EMPTY);
      return null;
    }
    if (value.length() > MAX_ACTION_LENGTH) {
      reject(errors, ActionField.ACTION, "tooLong", ACTION_TOO_LONG);
      return null;
    }
    return value;
  }

  private static LocalDate validateDate(Object raw, LocalDate today, List<FieldError> errors) {
    LocalDate value;
    if (raw instanceof LocalDate localDate) {
      value = localDate;
    } else if (raw instanceof CharSequence text) {
      String trimmed = text.toString().trim();
      if (!DATE_TEXT.matcher(trimmed).matches()) {
        reject(errors, ActionField.DATE, "format", DATE_FORMAT);
        return null;
      }
      try {
        value = LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE);
      } catch (DateTimeParseException e) {
        reject(errors, ActionField.DATE, "format", DATE_FORMAT);
        return null;
      }
    } else {
      reject(errors, ActionField.DATE, "format", DATE_FORMAT);
      return null;
    }

    // Persisted with a four-digit year; year 0 and earlier cannot be written back.
    if (value.getYear() < 1) {
      reject(errors, ActionField.DATE, "format", DATE_FORMAT);
      return null;
    }
    if (value.isAfter(today)) {
      reject(errors, ActionField.DATE, "future", DATE_IN_FUTURE);
      return null;
    }
    return value;
  }

  private static Integer validatePoints(Object raw, List<FieldError> errors) {
    Integer value = parseInteger(raw);
    if (value == null) {
      reject(errors, ActionField.POINTS, "invalid", POINTS_NOT_INTEGER);
      return null;
    }
    if (value <= 0) {
      reject(errors, ActionField.POINTS, "notPositive", POINTS_NOT_POSITIVE);
      return null;
    }
    return value;
  }

  private static Integer parseInteger(Object raw) {
    BigDecimal decimal;
    try {
      if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
        decimal = BigDecimal.valueOf(((Number) raw).longValue());
      } else if (raw instanceof BigInteger bigInteger) {
        decimal = new BigDecimal(bigInteger);
      } else if (raw instanceof BigDecimal bigDecimal) {
        decimal = bigDecimal;
      } else if (raw instanceof Double || raw instanceof Float) {
        double d = ((Number) raw).doubleValue();
        if (!Double.isFinite(d)) {
          return null;
        }
        decimal = BigDecimal.valueOf(d);
      } else if (raw instanceof CharSequence text) {
        String trimmed = text.toString().trim();
        if (!INTEGER_TEXT.matcher(trimmed).matches()) {
          return null;
        }
        decimal = new BigDecimal(trimmed);
      } else {
        return null;
      }
      return decimal.stripTrailingZeros().intValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      return null;
    }
  }

  private static void reject(
      List<FieldError> errors, ActionField field, String reason, String message) {
    errors.add(new FieldError(field.key(), field.key() + "." + reason, message));
  }
}

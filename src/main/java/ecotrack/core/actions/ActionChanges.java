package ecotrack.core.actions;

import java.time.LocalDate;

/** Validated field values; a {@code null} component leaves the stored value untouched. */
public record ActionChanges(String action, LocalDate date, Integer points) {
  public Action toAction(long id) {
    if (action == null || date == null || points == null) {
      throw new IllegalStateException("Incomplete changes cannot create an action: " + this);
    }
    return new Action(id, action, date, points);
  }

  public Action applyTo(Action existing) {
    return new Action(
        existing.id(),
        action == null ? existing.action() : action,
        date == null ? existing.date() : date,
        points == null ? existing.points() : points);
  }
}

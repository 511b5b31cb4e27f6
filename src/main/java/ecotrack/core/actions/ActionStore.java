package ecotrack.core.actions;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

public class ActionStore {
  private final ActionRecordsPort records;
  private final ActionValidator validator;
  private final AtomicLong highestIssuedId = new AtomicLong();

  public ActionStore(ActionRecordsPort records, Clock clock) {
    this(records, new ActionValidator(clock));
  }

  public ActionStore(ActionRecordsPort records, ActionValidator validator) {
    this.records = records;
    this.validator = validator;
  }

  public List<Action> list() {
    return List.copyOf(records.load());
  }

  public Action get(long id) {
    return records.load().stream()
        .filter(action -> action.id() == id)
        .findFirst()
        .orElseThrow(() -> new ActionNotFoundException(id));
  }

  public Action create(ActionFields fields) {
    ActionChanges changes = validator.validate(fields, false);
    return records.modify(
        actions -> {
          Action created = changes.toAction(nextId(actions));
          actions.add(created);
          return created;
        });
  }

  public Action update(long id, ActionFields fields, boolean partial) {
    return records.modify(
        actions -> {
          int index = indexOf(actions, id);
          if (index < 0) {
            throw new ActionNotFoundException(id);
          }
          Action updated = validator.validate(fields, partial).applyTo(actions.get(index));
          actions.set(index, updated);
          return updated;
        });
  }

  public void delete(long id) {
    records.modify(
        actions -> {
          if (!actions.removeIf(action -> action.id() == id)) {
            throw new ActionNotFoundException(id);
          }
          return null;
        });
  }

  // Runs under the port's write lock. The high-water mark keeps ids unique for the life of the
  // process even after the current maximum is deleted.
  private long nextId(List<Action> actions) {
    long maxStored = actions.stream().mapToLong(Action::id).max().orElse(0L);
    long next = Math.max(maxStored, highestIssuedId.get()) + 1;
    highestIssuedId.set(next);
    return next;
  }

  private static int indexOf(List<Action> actions, long id) {
    for (int i = 0; i < actions.size(); i++) {
      if (actions.get(i).id() == id) {
        return i;
      }
    }
    return -1;
  }
}

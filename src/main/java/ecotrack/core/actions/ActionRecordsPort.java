package ecotrack.core.actions;

import java.util.List;

/**
 * Owner of the persisted action collection.
 *
 * <p>{@link #load()} never observes a half-written collection. {@link #modify(ActionsMutation)} runs
 * one read-modify-write cycle while holding an exclusive lock: the mutation edits a copy of the
 * collection, which is written back only if the mutation returns normally.
 */
public interface ActionRecordsPort {
  List<Action> load();

  <T> T modify(ActionsMutation<T> mutation);
}

package ecotrack.core.actions;

import java.util.List;

@FunctionalInterface
public interface ActionsMutation<T> {
  T apply(List<Action> actions);
}

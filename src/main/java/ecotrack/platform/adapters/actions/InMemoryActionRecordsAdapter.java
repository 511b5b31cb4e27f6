package ecotrack.platform.adapters.actions;

import ecotrack.core.actions.Action;
import ecotrack.core.actions.ActionRecordsPort;
import ecotrack.core.actions.ActionsMutation;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Profile("test")
public class InMemoryActionRecordsAdapter implements ActionRecordsPort {
  private final AtomicReference<List<Action>> actions = new AtomicReference<>(List.of());
  private final ReentrantLock writeLock = new ReentrantLock();

  @Override
  public List<Action> load() {
    return actions.get();
  }

  @Override
  public <T> T modify(ActionsMutation<T> mutation) {
    writeLock.lock();
    try {
      List<Action> copy = new ArrayList<>(actions.get());
      T result = mutation.apply(copy);
      actions.set(List.copyOf(copy));
      return result;
    } finally {
      writeLock.unlock();
    }
  }
}

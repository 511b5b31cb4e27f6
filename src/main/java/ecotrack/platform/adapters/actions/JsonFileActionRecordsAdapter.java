package ecotrack.platform.adapters.actions;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import ecotrack.core.actions.Action;
import ecotrack.core.actions.ActionRecordsPort;
import ecotrack.core.actions.ActionStorageException;
import ecotrack.core.actions.ActionsMutation;
import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the actions as a single JSON array in one UTF-8 file.
 *
 * <p>Every write goes to a temp file in the same directory and is then renamed over the target, so
 * readers see either the old or the new array. Mutations hold the in-process write lock and an OS
 * lock on {@code <file>.lock} for the whole read-modify-write cycle, which also serializes writers
 * in other processes sharing the file. Use one adapter per file within a JVM: a second adapter
 * contending for the same lock file fails with {@link ActionStorageException}.
 *
 * <p>A file that parses but does not hold a well-formed action array (null entries, missing fields,
 * duplicate ids) is reported as {@link ActionStorageException} rather than repaired.
 */
public class JsonFileActionRecordsAdapter implements ActionRecordsPort, Closeable {
  private static final Logger log = LoggerFactory.getLogger(JsonFileActionRecordsAdapter.class);

  private static final TypeReference<List<Action>> ACTION_LIST = new TypeReference<>() {};

  private final ObjectMapper objectMapper;
  private final Path file;
  private final Path lockFile;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  private FileChannel lockChannel;

  public JsonFileActionRecordsAdapter(ObjectMapper objectMapper, String filePath) {
    this.objectMapper = objectMapper;
    this.file = Path.of(filePath).toAbsolutePath();
    this.lockFile = file.resolveSibling(file.getFileName() + ".lock");
  }

  public Path file() {
    return file;
  }

  public void open() {
    lock.writeLock().lock();
    try {
      if (lockChannel != null) {
        return;
      }
      Files.createDirectories(file.getParent());
      lockChannel =
          FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      try (FileLock ignored = acquireFileLock()) {
        if (!Files.exists(file)) {
          write(List.of());
        }
        log.info("Opened action store at {} ({} actions)", file, read().size());
      }
    } catch (IOException e) {
      closeQuietly();
      throw new ActionStorageException("Failed to open action store at", file, e);
    } catch (RuntimeException e) {
      closeQuietly();
      throw e;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public void close() {
    lock.writeLock().lock();
    try {
      if (lockChannel == null) {
        return;
      }
      lockChannel.close();
      log.info("Closed action store at {}", file);
    } catch (IOException e) {
      throw new ActionStorageException("Failed to release lock for", file, e);
    } finally {
      lockChannel = null;
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<Action> load() {
    lock.readLock().lock();
    try {
      return read();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public <T> T modify(ActionsMutation<T> mutation) {
    lock.writeLock().lock();
    try {
      if (lockChannel == null) {
        throw new IllegalStateException("Action store is not open: " + file);
      }
      try (FileLock ignored = acquireFileLock()) {
        List<Action> actions = new ArrayList<>(read());
        T result = mutation.apply(actions);
        write(actions);
        log.debug("Persisted {} actions to {}", actions.size(), file);
        return result;
      }
    } catch (IOException e) {
      throw new ActionStorageException("Failed to lock action store at", file, e);
    } finally {
      lock.writeLock().unlock();
    }
  }

  private List<Action> read() {
    if (!Files.exists(file)) {
      return List.of();
    }

    try {
      byte[] content = Files.readAllBytes(file);
      if (isBlank(content)) {
        return List.of();
      }
      List<Action> actions = objectMapper.readValue(content, ACTION_LIST);
      checkWellFormed(actions);
      return actions;
    } catch (IOException e) {
      throw new ActionStorageException("Failed to read actions from", file, e);
    }
  }

  private void checkWellFormed(List<Action> actions) {
    if (actions == null) {
      throw invalid("top-level value is null");
    }
    Set<Long> ids = new HashSet<>();
    for (int i = 0; i < actions.size(); i++) {
      Action action = actions.get(i);
      if (action == null) {
        throw invalid("entry " + i + " is null");
      }
      if (action.id() <= 0 || !ids.add(action.id())) {
        throw invalid("entry " + i + " has missing or duplicate id " + action.id());
      }
      if (action.action() == null || action.action().isBlank()) {
        throw invalid("entry " + i + " has no action");
      }
      if (action.date() == null) {
        throw invalid("entry " + i + " has no date");
      }
      if (action.points() <= 0) {
        throw invalid("entry " + i + " has non-positive points " + action.points());
      }
    }
  }

  private ActionStorageException invalid(String detail) {
    return new ActionStorageException("Invalid actions (" + detail + ") in", file, null);
  }

  private FileLock acquireFileLock() throws IOException {
    try {
      return lockChannel.lock();
    } catch (OverlappingFileLockException e) {
      throw new ActionStorageException("Lock file already held in this JVM for", file, e);
    }
  }

  private void write(List<Action> actions) {
    Path tmp = null;
    try {
      tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
      Files.write(tmp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(actions));
      try {
        Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
      tmp = null;
    } catch (IOException e) {
      throw new ActionStorageException("Failed to write actions to", file, e);
    } finally {
      if (tmp != null) {
        deleteTemp(tmp);
      }
    }
  }

  private static void deleteTemp(Path tmp) {
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.warn("Failed to delete temp file {}", tmp, e);
    }
  }

  private void closeQuietly() {
    if (lockChannel == null) {
      return;
    }
    try {
      lockChannel.close();
    } catch (IOException e) {
      log.warn("Failed to close lock file {}", lockFile, e);
    }
    lockChannel = null;
  }

  private static boolean isBlank(byte[] content) {
    for (byte b : content) {
      if (!Character.isWhitespace(b)) {
        return false;
      }
    }
    return true;
  }
}

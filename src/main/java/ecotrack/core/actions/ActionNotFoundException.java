package ecotrack.core.actions;

public class ActionNotFoundException extends RuntimeException {
  private final long id;

  public ActionNotFoundException(long id) {
    super("Action " + id + " not found.");
    this.id = id;
  }

  public long id() {
    return id;
  }
}

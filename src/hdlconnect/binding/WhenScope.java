package hdlconnect.binding;

/**
 * A conditional (when) scope of the elaborating module body.
 * Signals declared inside the scope must not be referenced after it was closed.
 */
public class WhenScope {
  private final String condition;
  private boolean active = true;

  public WhenScope(String condition) { this.condition = condition; }

  public String getCondition() { return condition; }

  /**
   * @return true while the scope is still open
   */
  public boolean isActive() { return active; }

  /** Marks the scope as closed. */
  public void close() { active = false; }

  @Override
  public String toString() {
    return "when(" + condition + ")" + (active ? "" : " [closed]");
  }
}

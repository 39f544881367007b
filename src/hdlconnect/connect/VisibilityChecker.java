package hdlconnect.connect;

import hdlconnect.binding.ConditionalDeclarable;
import hdlconnect.binding.MemoryPortBinding;
import hdlconnect.binding.TopBinding;
import hdlconnect.binding.WhenScope;
import hdlconnect.data.Signal;

/** Checks that signals declared inside a when scope are only used while the scope is open. */
public final class VisibilityChecker {
  private VisibilityChecker() {}

  /**
   * @param signal the signal to check
   * @return false iff the signal was declared in a when scope that has been closed already
   */
  public static boolean isVisible(Signal signal) {
    TopBinding top = signal.getTopBinding();
    // Memory ports may be enabled from outside of their declaring when.
    if (top instanceof MemoryPortBinding)
      return true;
    if (top instanceof ConditionalDeclarable)
      return ((ConditionalDeclarable)top).getVisibility().map(WhenScope::isActive).orElse(true);
    return true;
  }
}

package hdlconnect.binding;

import hdlconnect.hierarchy.HwModule;
import java.util.Optional;

/** Binding of the structural root of a signal. */
public abstract class TopBinding extends Binding {
  /**
   * Returns the module that owns the bound signal.
   * @return the owning module, or empty for literals and DontCare
   */
  public abstract Optional<HwModule> getLocation();

  /**
   * Returns true iff signals with this binding may never be written.
   * @return the read-only flag
   */
  public boolean isReadOnly() { return false; }
}

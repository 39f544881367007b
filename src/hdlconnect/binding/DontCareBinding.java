package hdlconnect.binding;

import hdlconnect.hierarchy.HwModule;
import java.util.Optional;

/** Binding of the DontCare marker. A connection from a DontCare-bound source lowers to an invalidate. */
public class DontCareBinding extends TopBinding {
  @Override
  public Optional<HwModule> getLocation() {
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "DontCareBinding";
  }
}

package hdlconnect.binding;

import hdlconnect.hierarchy.HwModule;
import java.util.Optional;

/** Binding of a module port. Ports are visible from inside and from the parent of their module. */
public class PortBinding extends TopBinding {
  private final HwModule enclosure;

  public PortBinding(HwModule enclosure) { this.enclosure = enclosure; }

  public HwModule getEnclosure() { return enclosure; }

  @Override
  public Optional<HwModule> getLocation() {
    return Optional.of(enclosure);
  }

  @Override
  public String toString() {
    return "PortBinding(" + enclosure.getName() + ")";
  }
}

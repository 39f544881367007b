package hdlconnect.binding;

import hdlconnect.hierarchy.HwModule;
import java.util.Optional;

/**
 * Binding of a memory port. Memory ports carry the when scope of their declaration
 * but are treated as visible everywhere in the enclosing module.
 */
public class MemoryPortBinding extends TopBinding implements ConditionalDeclarable {
  private final HwModule enclosure;
  private final Optional<WhenScope> visibility;

  public MemoryPortBinding(HwModule enclosure, Optional<WhenScope> visibility) {
    this.enclosure = enclosure;
    this.visibility = visibility;
  }

  @Override
  public Optional<HwModule> getLocation() {
    return Optional.of(enclosure);
  }

  @Override
  public Optional<WhenScope> getVisibility() {
    return visibility;
  }

  @Override
  public String toString() {
    return "MemoryPortBinding(" + enclosure.getName() + ")";
  }
}

package hdlconnect.binding;

import hdlconnect.hierarchy.HwModule;
import java.util.Optional;

/** Binding of a literal value. Literals have no owning module and cannot be written. */
public class LiteralBinding extends TopBinding {
  private final String value;

  public LiteralBinding(String value) { this.value = value; }

  public String getValue() { return value; }

  @Override
  public Optional<HwModule> getLocation() {
    return Optional.empty();
  }

  @Override
  public boolean isReadOnly() {
    return true;
  }

  @Override
  public String toString() {
    return "LiteralBinding(" + value + ")";
  }
}

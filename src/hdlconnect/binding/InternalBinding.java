package hdlconnect.binding;

import hdlconnect.hierarchy.HwModule;
import java.util.Optional;

/** Binding of a module-internal signal (register, wire, node or operation result). */
public class InternalBinding extends TopBinding implements ConditionalDeclarable {
  public enum Kind {
    REG,
    WIRE,
    NODE,
    OP;
    /** Nodes and operation results are read-only. */
    public boolean isReadOnly() { return this == NODE || this == OP; }
  }

  private final HwModule enclosure;
  private final Kind kind;
  private final Optional<WhenScope> visibility;

  public InternalBinding(HwModule enclosure, Kind kind, Optional<WhenScope> visibility) {
    this.enclosure = enclosure;
    this.kind = kind;
    this.visibility = visibility;
  }

  public Kind getKind() { return kind; }

  @Override
  public Optional<HwModule> getLocation() {
    return Optional.of(enclosure);
  }

  @Override
  public Optional<WhenScope> getVisibility() {
    return visibility;
  }

  @Override
  public boolean isReadOnly() {
    return kind.isReadOnly();
  }

  @Override
  public String toString() {
    return String.format("%sBinding(%s)", kind, enclosure.getName());
  }
}

package hdlconnect.binding;

import hdlconnect.data.Signal;

/** Binding of a field or element of an aggregate to its enclosing aggregate. */
public class ChildBinding extends Binding {
  private final Signal parent;

  public ChildBinding(Signal parent) { this.parent = parent; }

  /**
   * @return the enclosing aggregate
   */
  public Signal getParent() { return parent; }

  @Override
  public String toString() {
    return "ChildBinding(" + parent.getName() + ")";
  }
}

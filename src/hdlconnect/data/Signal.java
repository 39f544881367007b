package hdlconnect.data;

import hdlconnect.binding.Binding;
import hdlconnect.binding.ChildBinding;
import hdlconnect.binding.PortBinding;
import hdlconnect.binding.TopBinding;
import hdlconnect.hierarchy.HwModule;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A node in the hardware value graph: a scalar, a vector or record of signals, or the DontCare marker.
 * Signals start out as unbound types; binding them (see {@link HwModule}) turns them into hardware
 * and makes them read-only.
 */
public abstract class Signal {
  SpecifiedDirection specifiedDirection = SpecifiedDirection.UNSPECIFIED;

  private Binding binding = null;
  private ActualDirection direction = null;
  private String name = null;

  public abstract SignalVariant getVariant();

  /**
   * Returns the immediate children in canonical order (index order for vectors, field order for records).
   * @return a read-only list, empty for scalars and DontCare
   */
  public abstract List<Signal> getElements();

  /**
   * Renders the type of this signal, e.g. {@code UInt<8>[4]}.
   * @return the type description
   */
  public abstract String typeDescription();

  /** Creates an unbound structural copy, without the direction annotation of this signal. */
  protected abstract Signal cloneUnbound();

  /** Returns the name suffixes of the children relative to the name of this signal, in canonical order. */
  protected abstract List<String> childNameSuffixes();

  public boolean isAggregate() {
    return getVariant() == SignalVariant.VECTOR || getVariant() == SignalVariant.RECORD;
  }

  /**
   * Creates an unbound copy of this signal's type, including its direction annotation.
   * @return the copy
   */
  public Signal cloneType() {
    Signal copy = cloneUnbound();
    copy.specifiedDirection = this.specifiedDirection;
    return copy;
  }

  public SpecifiedDirection getSpecifiedDirection() { return specifiedDirection; }

  public boolean isBound() { return binding != null; }

  public Binding getBinding() {
    requireBound();
    return binding;
  }

  /**
   * Follows the child bindings up to the structural root.
   * @return the binding of the root signal
   */
  public TopBinding getTopBinding() {
    requireBound();
    Binding cur = binding;
    while (cur instanceof ChildBinding)
      cur = ((ChildBinding)cur).getParent().binding;
    return (TopBinding)cur;
  }

  /**
   * @return the direction resolved at bind time
   */
  public ActualDirection getDirection() {
    requireBound();
    return direction;
  }

  /**
   * @return the hierarchical name within the owning module, e.g. {@code io.data[2]}
   */
  public String getName() {
    requireBound();
    return name;
  }

  /**
   * @return the module owning the root of this signal, or empty for literals and DontCare
   */
  public Optional<HwModule> getParentModule() { return getTopBinding().getLocation(); }

  /**
   * @return the name of the owning module, or "(unknown)"
   */
  public String getParentName() { return getParentModule().map(HwModule::getName).orElse("(unknown)"); }

  /**
   * Renders a reference to this signal as seen from a module.
   * Ports of other modules are prefixed with their module's instance name.
   * @param context the referencing module
   * @return the reference string
   */
  public String getRef(HwModule context) {
    TopBinding top = getTopBinding();
    if (top instanceof PortBinding && ((PortBinding)top).getEnclosure() != context)
      return ((PortBinding)top).getEnclosure().getName() + "." + getName();
    return getName();
  }

  /**
   * Collects all non-aggregate signals below (and including) this one, depth first, in canonical order.
   * @return the list of leaves
   */
  public List<Signal> getLeaves() {
    List<Signal> leaves = new ArrayList<>();
    Deque<Signal> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      Signal cur = stack.pop();
      if (!cur.isAggregate()) {
        leaves.add(cur);
        continue;
      }
      List<Signal> elements = cur.getElements();
      for (int i = elements.size() - 1; i >= 0; --i)
        stack.push(elements.get(i));
    }
    return leaves;
  }

  /**
   * Binds this signal (and all its children) as hardware.
   * @param target the binding of the root
   * @param name the name of the signal within its module
   * @throws IllegalStateException if the signal is already bound
   */
  public void bind(TopBinding target, String name) { bind(target, name, SpecifiedDirection.UNSPECIFIED); }

  private void bind(Binding target, String name, SpecifiedDirection parentDirection) {
    if (binding != null)
      throw new IllegalStateException("Signal " + this.name + " is already bound");
    this.binding = target;
    this.name = name;
    SpecifiedDirection resolved = SpecifiedDirection.fromParent(parentDirection, specifiedDirection);
    if (!isAggregate()) {
      direction = ActualDirection.fromSpecified(resolved, getTopBinding() instanceof PortBinding);
      return;
    }
    List<Signal> elements = getElements();
    List<String> suffixes = childNameSuffixes();
    Set<ActualDirection> childDirections = EnumSet.noneOf(ActualDirection.class);
    for (int i = 0; i < elements.size(); ++i) {
      Signal child = elements.get(i);
      child.bind(new ChildBinding(this), name + suffixes.get(i), resolved);
      childDirections.add(child.direction);
    }
    // Empty children do not constrain the direction.
    childDirections.remove(ActualDirection.EMPTY);
    direction = ActualDirection.fromChildren(childDirections, resolved)
                    .orElseThrow(() -> new IllegalArgumentException("Aggregate " + name + " mixes unspecified and specified child directions"));
  }

  protected void requireUnbound() {
    if (binding != null)
      throw new IllegalStateException("Signal " + name + " is already bound and cannot be modified");
  }

  private void requireBound() {
    if (binding == null)
      throw new IllegalStateException("Signal of type " + typeDescription() + " is not bound to hardware");
  }

  @Override
  public String toString() {
    return (binding == null ? "" : name + ": ") + typeDescription();
  }
}

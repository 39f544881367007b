package hdlconnect.hierarchy;

import hdlconnect.binding.InternalBinding;
import hdlconnect.binding.MemoryPortBinding;
import hdlconnect.binding.PortBinding;
import hdlconnect.binding.TopBinding;
import hdlconnect.binding.WhenScope;
import hdlconnect.data.Signal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A module in the design hierarchy. Each module instance is its own object;
 * the module name doubles as the instance name seen from the parent.
 * Signals become hardware by being declared in a module.
 */
public class HwModule {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final String name;
  private final Optional<HwModule> parent;
  private final List<HwModule> children = new ArrayList<>();
  /** Declared ports and internal signals by name, in declaration order. */
  private final LinkedHashMap<String, Signal> declarations = new LinkedHashMap<>();

  /**
   * Creates a top-level module.
   * @param name the module name
   */
  public HwModule(String name) { this(name, Optional.empty()); }

  private HwModule(String name, Optional<HwModule> parent) {
    this.name = name;
    this.parent = parent;
  }

  /**
   * Instantiates a new child module.
   * @param instanceName the name of the instance, unique within this module
   * @return the child module
   */
  public HwModule instantiate(String instanceName) {
    if (getChild(instanceName).isPresent())
      throw new IllegalArgumentException("Module " + name + " already has an instance named " + instanceName);
    HwModule child = new HwModule(instanceName, Optional.of(this));
    children.add(child);
    return child;
  }

  public String getName() { return name; }

  public Optional<HwModule> getParent() { return parent; }

  public List<HwModule> getChildren() { return Collections.unmodifiableList(children); }

  public Optional<HwModule> getChild(String instanceName) {
    return children.stream().filter(child -> child.name.equals(instanceName)).findFirst();
  }

  /**
   * Tests if this module is the direct parent of another.
   * @param other the other module
   * @return true iff other is instantiated directly in this module
   */
  public boolean isParentOf(HwModule other) { return other != null && other.parent.orElse(null) == this; }

  /**
   * @return the declared ports and internal signals by name
   */
  public Map<String, Signal> getDeclarations() { return Collections.unmodifiableMap(declarations); }

  public Optional<Signal> getDeclaration(String signalName) { return Optional.ofNullable(declarations.get(signalName)); }

  /** Declares a port. Direction annotations of the type decide input and output. */
  public <T extends Signal> T port(String signalName, T type) { return declare(signalName, type, new PortBinding(this)); }

  public <T extends Signal> T wire(String signalName, T type) { return wire(signalName, type, Optional.empty()); }
  /**
   * Declares a wire.
   * @param visibility the when scope the wire is declared in, if any
   */
  public <T extends Signal> T wire(String signalName, T type, Optional<WhenScope> visibility) {
    return declare(signalName, type, new InternalBinding(this, InternalBinding.Kind.WIRE, visibility));
  }

  public <T extends Signal> T reg(String signalName, T type) { return reg(signalName, type, Optional.empty()); }
  public <T extends Signal> T reg(String signalName, T type, Optional<WhenScope> visibility) {
    return declare(signalName, type, new InternalBinding(this, InternalBinding.Kind.REG, visibility));
  }

  /** Declares a named, read-only node. */
  public <T extends Signal> T node(String signalName, T type, Optional<WhenScope> visibility) {
    return declare(signalName, type, new InternalBinding(this, InternalBinding.Kind.NODE, visibility));
  }

  /** Declares the read-only result of an operation. */
  public <T extends Signal> T op(String signalName, T type, Optional<WhenScope> visibility) {
    return declare(signalName, type, new InternalBinding(this, InternalBinding.Kind.OP, visibility));
  }

  public <T extends Signal> T memoryPort(String signalName, T type, Optional<WhenScope> visibility) {
    return declare(signalName, type, new MemoryPortBinding(this, visibility));
  }

  private <T extends Signal> T declare(String signalName, T type, TopBinding binding) {
    if (declarations.containsKey(signalName))
      throw new IllegalArgumentException("Module " + name + " already declares " + signalName);
    @SuppressWarnings("unchecked") T hw = (T)type.cloneType();
    hw.bind(binding, signalName);
    declarations.put(signalName, hw);
    logger.trace("{}: declared {} as {}", name, hw, binding);
    return hw;
  }

  /**
   * @return the instance path from the top module, e.g. {@code Top.core.alu}
   */
  public String getPath() { return parent.map(p -> p.getPath() + ".").orElse("") + name; }

  @Override
  public String toString() {
    return "HwModule(" + getPath() + ")";
  }
}

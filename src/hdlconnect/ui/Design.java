package hdlconnect.ui;

import hdlconnect.binding.WhenScope;
import hdlconnect.data.Signal;
import hdlconnect.hierarchy.HwModule;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** An elaborated design: the module hierarchy, its when scopes and the connect statements to resolve. */
public class Design {
  /** A connect statement {@code sink := source} in the body of a module. */
  public static class ConnectStatement {
    public final HwModule context;
    public final Signal sink;
    public final Signal source;
    /** The statement as written in the description. */
    public final String text;

    public ConnectStatement(HwModule context, Signal sink, Signal source, String text) {
      this.context = context;
      this.sink = sink;
      this.source = source;
      this.text = text;
    }

    @Override
    public String toString() {
      return context.getName() + ": " + text;
    }
  }

  private final LinkedHashMap<String, HwModule> modules = new LinkedHashMap<>();
  private final LinkedHashMap<String, WhenScope> whenScopes = new LinkedHashMap<>();
  private final ArrayList<ConnectStatement> statements = new ArrayList<>();

  public void addModule(HwModule module) {
    if (modules.putIfAbsent(module.getName(), module) != null)
      throw new IllegalArgumentException("Duplicate module name " + module.getName());
  }
  public void addWhenScope(String name, WhenScope scope) { whenScopes.put(name, scope); }
  public void addStatement(ConnectStatement statement) { statements.add(statement); }

  /**
   * @return the modules by name, in declaration order (parents before children)
   */
  public Map<String, HwModule> getModules() { return Collections.unmodifiableMap(modules); }
  public Optional<HwModule> getModule(String name) { return Optional.ofNullable(modules.get(name)); }
  public Optional<WhenScope> getWhenScope(String name) { return Optional.ofNullable(whenScopes.get(name)); }
  public List<ConnectStatement> getStatements() { return Collections.unmodifiableList(statements); }
}

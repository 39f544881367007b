package hdlconnect.ui;

import hdlconnect.binding.WhenScope;
import hdlconnect.data.Directions;
import hdlconnect.data.DontCare;
import hdlconnect.data.RecordSignal;
import hdlconnect.data.ScalarKind;
import hdlconnect.data.ScalarSignal;
import hdlconnect.data.Signal;
import hdlconnect.data.VecSignal;
import hdlconnect.hierarchy.HwModule;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a YAML design description.
 *
 * <pre>
 * whens:
 *   - {name: en, closed: true}
 * modules:
 *   - name: Top
 *     ports:
 *       - {name: io, direction: output, type: {record: [{name: a, type: "UInt&lt;8&gt;"}, {name: b, type: Bool, direction: flip}]}}
 *     wires:
 *       - {name: w, type: {vec: 4, of: "UInt&lt;8&gt;"}, when: en}
 *   - name: child
 *     parent: Top
 *     ports: [...]
 * connects:
 *   - {context: Top, sink: "child.io.a", source: "w[2]"}
 * </pre>
 *
 * Declaration sections are ports, wires, regs, nodes, ops and memoryPorts.
 * References are paths within the context module ({@code io.a}, {@code w[2]}), ports of a child instance ({@code child.io.a}),
 * signals of an arbitrary module ({@code Other::io.a}), {@code DontCare} or literals ({@code lit:UInt<8>:5}).
 */
public class DesignReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Pattern SCALAR_TYPE = Pattern.compile("(\\w+)(?::(\\w+))?(?:<(\\d+)>)?");
  private static final Pattern REF_TOKEN = Pattern.compile("\\.?([A-Za-z_]\\w*)|\\[(\\d+)\\]");
  private static final String[] DECLARATION_SECTIONS = {"ports", "wires", "regs", "nodes", "ops", "memoryPorts"};

  /**
   * Parses a design description.
   * @param input the YAML document
   * @return the design
   * @throws DesignFormatException if the document is malformed
   */
  public Design read(InputStream input) throws DesignFormatException {
    Object parsed;
    try {
      parsed = new Yaml().load(input);
    } catch (YAMLException e) {
      throw new DesignFormatException("Design description is not valid YAML: " + e.getMessage(), e);
    }
    Map<String, Object> root = asMap(parsed, "design");
    Design design = new Design();

    for (Object whenObj : asList(root.getOrDefault("whens", List.of()), "whens")) {
      Map<String, Object> when = asMap(whenObj, "when scope");
      String name = asString(when.get("name"), "when scope name");
      WhenScope scope = new WhenScope(asString(when.getOrDefault("condition", name), "when condition " + name));
      if (Boolean.TRUE.equals(when.get("closed")))
        scope.close();
      design.addWhenScope(name, scope);
    }

    for (Object moduleObj : asList(root.getOrDefault("modules", List.of()), "modules"))
      readModule(asMap(moduleObj, "module"), design);

    for (Object connectObj : asList(root.getOrDefault("connects", List.of()), "connects")) {
      Map<String, Object> connect = asMap(connectObj, "connect");
      String contextName = asString(connect.get("context"), "connect context");
      HwModule context =
          design.getModule(contextName).orElseThrow(() -> new DesignFormatException("Connect in unknown module " + contextName));
      String sinkRef = asString(connect.get("sink"), "connect sink");
      String sourceRef = asString(connect.get("source"), "connect source");
      design.addStatement(new Design.ConnectStatement(context, resolveRef(design, context, sinkRef), resolveRef(design, context, sourceRef),
                                                      sinkRef + " := " + sourceRef));
    }
    logger.debug("Read design with {} modules and {} connect statements", design.getModules().size(), design.getStatements().size());
    return design;
  }

  private void readModule(Map<String, Object> moduleDesc, Design design) throws DesignFormatException {
    String name = asString(moduleDesc.get("name"), "module name");
    if (design.getModule(name).isPresent())
      throw new DesignFormatException("Duplicate module name " + name);
    HwModule module;
    if (moduleDesc.containsKey("parent")) {
      String parentName = asString(moduleDesc.get("parent"), "parent of module " + name);
      HwModule parent = design.getModule(parentName).orElseThrow(
          () -> new DesignFormatException("Parent " + parentName + " of module " + name + " must be declared before it"));
      module = parent.instantiate(name);
    } else {
      module = new HwModule(name);
    }
    design.addModule(module);

    for (String section : DECLARATION_SECTIONS) {
      for (Object declObj : asList(moduleDesc.getOrDefault(section, List.of()), section + " of module " + name)) {
        Map<String, Object> decl = asMap(declObj, "declaration in module " + name);
        String signalName = asString(decl.get("name"), section + " entry name in module " + name);
        String what = "declaration " + name + "." + signalName;
        Signal type = withDirection(parseType(decl.get("type"), what), decl.get("direction"), what);
        Optional<WhenScope> visibility = Optional.empty();
        if (decl.containsKey("when")) {
          String whenName = asString(decl.get("when"), "when of " + what);
          visibility = Optional.of(design.getWhenScope(whenName).orElseThrow(
              () -> new DesignFormatException("Unknown when scope " + whenName + " in " + what)));
        }
        try {
          declare(module, section, signalName, type, visibility);
        } catch (IllegalArgumentException e) {
          throw new DesignFormatException("Invalid " + what + ": " + e.getMessage(), e);
        }
      }
    }
  }

  private static void declare(HwModule module, String section, String name, Signal type, Optional<WhenScope> visibility) {
    switch (section) {
    case "ports":
      module.port(name, type);
      break;
    case "wires":
      module.wire(name, type, visibility);
      break;
    case "regs":
      module.reg(name, type, visibility);
      break;
    case "nodes":
      module.node(name, type, visibility);
      break;
    case "ops":
      module.op(name, type, visibility);
      break;
    case "memoryPorts":
      module.memoryPort(name, type, visibility);
      break;
    default:
      throw new IllegalArgumentException("Unknown declaration section " + section);
    }
  }

  /**
   * Parses a type: a scalar type string such as {@code UInt<8>}, {@code Bool} or {@code Enum:State<2>},
   * a vector {@code {vec: 4, of: <type>}} or a record {@code {record: [{name: a, type: <type>, direction: flip}]}}.
   */
  Signal parseType(Object typeDesc, String what) throws DesignFormatException {
    if (typeDesc instanceof String) {
      Matcher m = SCALAR_TYPE.matcher(((String)typeDesc).trim());
      if (!m.matches())
        throw new DesignFormatException("Malformed type '" + typeDesc + "' in " + what);
      ScalarKind kind;
      try {
        kind = ScalarKind.fromTypeName(m.group(1));
      } catch (IllegalArgumentException e) {
        throw new DesignFormatException(e.getMessage() + " in " + what, e);
      }
      int width = (m.group(3) != null) ? Integer.parseInt(m.group(3)) : -1;
      if (kind == ScalarKind.ENUM)
        return ScalarSignal.enumOf(m.group(2) != null ? m.group(2) : "Enum", width);
      return new ScalarSignal(kind, width);
    }
    Map<String, Object> aggregate = asMap(typeDesc, "type of " + what);
    if (aggregate.containsKey("vec")) {
      Object length = aggregate.get("vec");
      if (!(length instanceof Integer) || (Integer)length < 0)
        throw new DesignFormatException("Vec length must be a non-negative integer in " + what);
      return new VecSignal((Integer)length, parseType(aggregate.get("of"), what + "[]"));
    }
    if (aggregate.containsKey("record")) {
      RecordSignal record = new RecordSignal();
      for (Object fieldObj : asList(aggregate.get("record"), "record fields of " + what)) {
        Map<String, Object> field = asMap(fieldObj, "record field of " + what);
        String fieldName = asString(field.get("name"), "field name in " + what);
        String fieldWhat = what + "." + fieldName;
        try {
          record.field(fieldName, withDirection(parseType(field.get("type"), fieldWhat), field.get("direction"), fieldWhat));
        } catch (IllegalArgumentException e) {
          throw new DesignFormatException(e.getMessage() + " in " + what, e);
        }
      }
      return record;
    }
    throw new DesignFormatException("Type of " + what + " must be a scalar type string, a vec or a record");
  }

  private static Signal withDirection(Signal type, Object direction, String what) throws DesignFormatException {
    if (direction == null)
      return type;
    switch (asString(direction, "direction of " + what).toLowerCase()) {
    case "input":
      return Directions.input(type);
    case "output":
      return Directions.output(type);
    case "flip":
    case "flipped":
      return Directions.flipped(type);
    case "unspecified":
      return type;
    default:
      throw new DesignFormatException("Unknown direction '" + direction + "' of " + what);
    }
  }

  /** Resolves a signal reference relative to a context module. */
  Signal resolveRef(Design design, HwModule context, String ref) throws DesignFormatException {
    String trimmed = ref.trim();
    if (trimmed.equals("DontCare"))
      return DontCare.INSTANCE;
    if (trimmed.startsWith("lit:")) {
      int sep = trimmed.lastIndexOf(':');
      if (sep <= 4)
        throw new DesignFormatException("Literal '" + ref + "' must have the form lit:<type>:<value>");
      Signal type = parseType(trimmed.substring(4, sep), "literal " + ref);
      if (!(type instanceof ScalarSignal))
        throw new DesignFormatException("Literal '" + ref + "' must have a scalar type");
      ScalarSignal scalarType = (ScalarSignal)type;
      return ScalarSignal.literal(scalarType.getKind(), scalarType.getWidth(), trimmed.substring(sep + 1));
    }

    HwModule scope = context;
    String path = trimmed;
    int moduleSep = trimmed.indexOf("::");
    if (moduleSep >= 0) {
      String moduleName = trimmed.substring(0, moduleSep);
      scope = design.getModule(moduleName).orElseThrow(() -> new DesignFormatException("Unknown module in reference '" + ref + "'"));
      path = trimmed.substring(moduleSep + 2);
    }

    Matcher m = REF_TOKEN.matcher(path);
    int pos = 0;
    Signal cur = null;
    while (pos < path.length()) {
      if (!m.find(pos) || m.start() != pos || (m.group(1) != null && (pos == 0) == m.group().startsWith(".")))
        throw new DesignFormatException("Malformed reference '" + ref + "'");
      pos = m.end();
      String field = m.group(1);
      if (cur == null) {
        Optional<Signal> decl = scope.getDeclaration(field);
        if (decl.isPresent()) {
          cur = decl.get();
          continue;
        }
        Optional<HwModule> child = (moduleSep < 0) ? scope.getChild(field) : Optional.empty();
        if (child.isEmpty() || !m.find(pos) || m.start() != pos || m.group(1) == null || !m.group().startsWith("."))
          throw new DesignFormatException("Reference '" + ref + "' does not name a signal of " + scope.getName());
        pos = m.end();
        String portName = m.group(1);
        cur = child.get().getDeclaration(portName).orElseThrow(
            () -> new DesignFormatException("Instance " + field + " has no port " + portName + " (in '" + ref + "')"));
        continue;
      }
      cur = select(cur, field, m.group(2), ref);
    }
    if (cur == null)
      throw new DesignFormatException("Empty reference in module " + context.getName());
    return cur;
  }

  private static Signal select(Signal cur, String field, String index, String ref) throws DesignFormatException {
    if (field != null) {
      if (!(cur instanceof RecordSignal))
        throw new DesignFormatException("'" + ref + "': " + cur.getName() + " is not a record");
      return ((RecordSignal)cur).getField(field).orElseThrow(
          () -> new DesignFormatException("'" + ref + "': " + cur.getName() + " has no field " + field));
    }
    if (!(cur instanceof VecSignal))
      throw new DesignFormatException("'" + ref + "': " + cur.getName() + " is not a vec");
    VecSignal vec = (VecSignal)cur;
    int i = Integer.parseInt(index);
    if (i >= vec.length())
      throw new DesignFormatException("'" + ref + "': index " + i + " out of range for " + cur.getName());
    return vec.get(i);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(Object obj, String what) throws DesignFormatException {
    if (!(obj instanceof Map))
      throw new DesignFormatException("Expected a mapping for " + what + ", got " + obj);
    return (Map<String, Object>)obj;
  }

  @SuppressWarnings("unchecked")
  private static List<Object> asList(Object obj, String what) throws DesignFormatException {
    if (!(obj instanceof List))
      throw new DesignFormatException("Expected a list for " + what + ", got " + obj);
    return (List<Object>)obj;
  }

  private static String asString(Object obj, String what) throws DesignFormatException {
    if (obj == null)
      throw new DesignFormatException("Missing " + what);
    return obj.toString();
  }
}

package hdlconnect.connect;

import hdlconnect.data.Signal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rejected connection: the reason, the message of the failing step,
 * and the structural path (e.g. {@code (2)}, {@code .valid}) from the connected roots to that step.
 */
public class ConnectError {
  private final ConnectErrorKind kind;
  private final String message;
  private final List<String> path;

  public ConnectError(ConnectErrorKind kind, String message) { this(kind, message, List.of()); }

  private ConnectError(ConnectErrorKind kind, String message, List<String> path) {
    this.kind = kind;
    this.message = message;
    this.path = path;
  }

  /**
   * Returns a copy of this error located below the given path, outer segments first.
   * @param outerPath path segments to place in front of the current path
   * @return the relocated error
   */
  public ConnectError atPath(List<String> outerPath) {
    if (outerPath.isEmpty())
      return this;
    ArrayList<String> combined = new ArrayList<>(outerPath.size() + path.size());
    combined.addAll(outerPath);
    combined.addAll(path);
    return new ConnectError(kind, message, Collections.unmodifiableList(combined));
  }

  public ConnectErrorKind getKind() { return kind; }

  /**
   * @return the message of the failing step, without the path
   */
  public String getMessage() { return message; }

  public List<String> getPath() { return path; }

  /**
   * @return the path segments followed by the message, e.g. {@code (1).statusSink and Source are different length Vecs.}
   */
  public String getFullMessage() { return String.join("", path) + message; }

  @Override
  public String toString() {
    return kind + ": " + getFullMessage();
  }

  static String formatName(Signal signal) { return signal.getName() + " in " + signal.getParentName(); }

  // Element-level errors
  public static ConnectError unreadableSource(Signal sink, Signal source) {
    return new ConnectError(ConnectErrorKind.UNREADABLE_SOURCE,
                            formatName(source) + " cannot be read from module " + sink.getParentName() + ".");
  }
  public static ConnectError unwritableSink(Signal sink, Signal source) {
    return new ConnectError(ConnectErrorKind.UNWRITABLE_SINK,
                            formatName(sink) + " cannot be written from module " + source.getParentName() + ".");
  }
  public static ConnectError sourceEscapedScope(Signal source) {
    return new ConnectError(ConnectErrorKind.SOURCE_ESCAPED_SCOPE,
                            "Source " + formatName(source) + " has escaped the scope of the when in which it was constructed.");
  }
  public static ConnectError sinkEscapedScope(Signal sink) {
    return new ConnectError(ConnectErrorKind.SINK_ESCAPED_SCOPE,
                            "Sink " + formatName(sink) + " has escaped the scope of the when in which it was constructed.");
  }
  public static ConnectError unrelatedModules() {
    return new ConnectError(ConnectErrorKind.UNRELATED_MODULES, "Sink or source unavailable to current module.");
  }

  // Errors while descending into aggregates
  public static ConnectError mismatchedVectorLength() {
    return new ConnectError(ConnectErrorKind.MISMATCHED_VECTOR_LENGTH, "Sink and Source are different length Vecs.");
  }
  public static ConnectError missingField(String field) {
    return new ConnectError(ConnectErrorKind.MISSING_FIELD, "Source Record missing field (" + field + ").");
  }
  public static ConnectError typeMismatch(Signal sink, Signal source) {
    return new ConnectError(ConnectErrorKind.TYPE_MISMATCH, "Sink (" + sink.typeDescription() + ") and Source (" +
                                                                source.typeDescription() + ") have different types.");
  }
  public static ConnectError wildcardSink() {
    return new ConnectError(ConnectErrorKind.WILDCARD_SINK, "DontCare cannot be a connection sink");
  }
  public static ConnectError analogSink(Signal sink) {
    return new ConnectError(ConnectErrorKind.BIDIRECTIONAL_OPERAND,
                            "Sink " + formatName(sink) + " of type Analog cannot participate in a mono connection (:=)");
  }
  public static ConnectError analogSource(Signal source) {
    return new ConnectError(ConnectErrorKind.BIDIRECTIONAL_OPERAND,
                            "Source " + formatName(source) + " of type Analog cannot participate in a mono connection (:=)");
  }
  public static ConnectError analogOperands(Signal source, Signal sink) {
    return new ConnectError(ConnectErrorKind.BIDIRECTIONAL_OPERAND, "Source " + formatName(source) + " and sink " + formatName(sink) +
                                                                        " of type Analog cannot participate in a mono connection (:=)");
  }
}

package hdlconnect.ir;

import hdlconnect.data.Signal;
import hdlconnect.hierarchy.HwModule;
import java.util.Objects;

/** Drives a sink from a source. Both are leaves, or an aggregate pair that may be bulk connected. */
public class Connect extends Command {
  private final Signal source;

  public Connect(HwModule context, Signal sink, Signal source) {
    super(context, sink);
    this.source = source;
  }

  public Signal getSource() { return source; }

  @Override
  public String serialize() {
    return sink.getRef(context) + " <= " + source.getRef(context);
  }

  @Override
  public int hashCode() {
    return Objects.hash(System.identityHashCode(context), System.identityHashCode(sink), System.identityHashCode(source));
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Connect other = (Connect)obj;
    return context == other.context && sink == other.sink && source == other.source;
  }
}

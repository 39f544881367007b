package hdlconnect.ir;

import hdlconnect.data.Signal;
import hdlconnect.hierarchy.HwModule;

/** Marks a sink as intentionally undriven. */
public class DefInvalid extends Command {
  public DefInvalid(HwModule context, Signal sink) { super(context, sink); }

  @Override
  public String serialize() {
    return sink.getRef(context) + " is invalid";
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(context) + System.identityHashCode(sink);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    DefInvalid other = (DefInvalid)obj;
    return context == other.context && sink == other.sink;
  }
}

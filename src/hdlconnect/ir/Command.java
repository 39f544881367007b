package hdlconnect.ir;

import hdlconnect.data.Signal;
import hdlconnect.hierarchy.HwModule;

/** A primitive operation emitted into the body of a module. */
public abstract class Command {
  protected final HwModule context;
  protected final Signal sink;

  protected Command(HwModule context, Signal sink) {
    this.context = context;
    this.sink = sink;
  }

  /**
   * @return the module whose body the command belongs to
   */
  public HwModule getContext() { return context; }

  /**
   * @return the signal written by the command
   */
  public Signal getSink() { return sink; }

  /**
   * Renders the command as a single line of FIRRTL-like text, with references relative to the context module.
   * @return the rendered line
   */
  public abstract String serialize();

  @Override
  public String toString() {
    return serialize();
  }
}

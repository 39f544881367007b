package hdlconnect.connect;

import hdlconnect.binding.Binding;
import hdlconnect.binding.ChildBinding;
import hdlconnect.binding.PortBinding;
import hdlconnect.data.Signal;
import hdlconnect.hierarchy.HwModule;

/** Computes the effective flow of a signal as seen from a context module. */
public final class FlowTracer {
  private FlowTracer() {}

  /**
   * Walks from a signal to its structural root, xor-ing the flips of each level.
   * Ports of a module other than the context module flip once more; non-port roots always pass.
   * @param consideredAsSink true to test for sink flow, false for source flow
   * @param signal the signal to trace
   * @param context the module the connection is made in
   * @param maxDepth the maximum number of binding levels to follow
   * @return true iff the signal can take the given role
   * @throws IllegalStateException if the binding chain is longer than maxDepth
   */
  public static boolean traceFlow(boolean consideredAsSink, Signal signal, HwModule context, int maxDepth) {
    boolean currentlyFlipped = consideredAsSink;
    Signal cur = signal;
    for (int depth = 0; depth <= maxDepth; ++depth) {
      boolean flipped = cur.getSpecifiedDirection().isFlipped();
      Binding binding = cur.getBinding();
      if (binding instanceof ChildBinding) {
        currentlyFlipped ^= flipped;
        cur = ((ChildBinding)binding).getParent();
        continue;
      }
      if (binding instanceof PortBinding) {
        boolean childPort = ((PortBinding)binding).getEnclosure() != context;
        return childPort ^ flipped ^ currentlyFlipped;
      }
      return true;
    }
    throw new IllegalStateException("Binding chain of " + signal.getName() + " exceeds " + maxDepth + " levels");
  }

  public static boolean canBeSink(Signal signal, HwModule context, ConnectOptions options) {
    return traceFlow(true, signal, context, options.maxBindingDepth());
  }

  public static boolean canBeSource(Signal signal, HwModule context, ConnectOptions options) {
    return traceFlow(false, signal, context, options.maxBindingDepth());
  }
}

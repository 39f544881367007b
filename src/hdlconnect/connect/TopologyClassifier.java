package hdlconnect.connect;

import hdlconnect.data.Signal;
import hdlconnect.hierarchy.HwModule;

public final class TopologyClassifier {
  private TopologyClassifier() {}

  /**
   * Classifies the owners of a sink and a source relative to the context module. The cases are tested in declaration order of
   * {@link Topology}.
   */
  public static Topology classify(HwModule sinkModule, HwModule sourceModule, HwModule context) {
    if (sinkModule == context && sourceModule == context)
      return Topology.SAME_MODULE;
    if (sinkModule == context && context.isParentOf(sourceModule))
      return Topology.SINK_HERE_SOURCE_CHILD;
    if (sourceModule == context && context.isParentOf(sinkModule))
      return Topology.SOURCE_HERE_SINK_CHILD;
    // Also covers sink and source in the same child.
    if (context.isParentOf(sinkModule) && context.isParentOf(sourceModule))
      return Topology.BOTH_CHILDREN;
    return Topology.UNRELATED;
  }

  /** Classifies two signals. Signals without an owning module (literals) count as owned by the context module. */
  public static Topology classify(Signal sink, Signal source, HwModule context) {
    return classify(sink.getParentModule().orElse(context), source.getParentModule().orElse(context), context);
  }
}

package hdlconnect.connect;

import hdlconnect.binding.LiteralBinding;
import hdlconnect.binding.PortBinding;
import hdlconnect.data.ActualDirection;
import hdlconnect.data.Signal;
import hdlconnect.hierarchy.HwModule;
import java.util.Optional;

/**
 * Bulk-connect check of the commutative connection. Two aggregates may be connected as a whole iff
 * - their types are structurally connectable,
 * - their owners and directions allow it from the context module,
 * - the sink is not read-only,
 * - the sink has sink flow and the source has source flow,
 * - the source is not a literal.
 * The checks are applied in that order, stopping at the first that fails.
 */
public class BiConnectBulkCheck implements BulkConnectCheck {

  @Override
  public BulkConnectVerdict check(Signal sink, Signal source, HwModule context, ConnectOptions options) {
    if (!TypeEquivalence.validConnect(sink, source))
      return BulkConnectVerdict.ELEMENT_WISE;
    BulkConnectVerdict contextVerdict = contextCheck(sink, source, context, options);
    if (!contextVerdict.isBulk())
      return contextVerdict;
    if (sink.getTopBinding().isReadOnly())
      return BulkConnectVerdict.ELEMENT_WISE;
    if (!FlowTracer.canBeSink(sink, context, options) || !FlowTracer.canBeSource(source, context, options))
      return BulkConnectVerdict.ELEMENT_WISE;
    return BulkConnectVerdict.of(!(source.getTopBinding() instanceof LiteralBinding));
  }

  /**
   * Aggregate-level counterpart of the leaf decision table, based on the aggregate directions.
   * @return BULK if the aggregates may be connected in the context, ELEMENT_WISE if not, or an error
   */
  public static BulkConnectVerdict contextCheck(Signal sink, Signal source, HwModule context, ConnectOptions options) {
    Optional<HwModule> sinkModule = sink.getParentModule();
    if (sinkModule.isEmpty())
      return BulkConnectVerdict.error(ConnectError.unwritableSink(sink, source));
    HwModule sourceModule = source.getParentModule().orElse(context);

    boolean sinkIsPort = sink.getTopBinding() instanceof PortBinding;
    boolean sourceIsPort = source.getTopBinding() instanceof PortBinding;

    if (!VisibilityChecker.isVisible(sink))
      return BulkConnectVerdict.error(ConnectError.sinkEscapedScope(sink));
    if (!VisibilityChecker.isVisible(source))
      return BulkConnectVerdict.error(ConnectError.sourceEscapedScope(source));

    boolean sinkIsInput = sink.getDirection() == ActualDirection.INPUT;
    switch (TopologyClassifier.classify(sinkModule.get(), sourceModule, context)) {
    case SAME_MODULE:
      return BulkConnectVerdict.of(!sinkIsInput);
    case SINK_HERE_SOURCE_CHILD:
      if (!sourceIsPort)
        return BulkConnectVerdict.of(!options.dontAssumeDirectionality());
      if (sinkIsInput)
        return BulkConnectVerdict.of(source.getDirection() == ActualDirection.OUTPUT && !options.dontTryConnectionsSwapped());
      return BulkConnectVerdict.BULK;
    case SOURCE_HERE_SINK_CHILD:
      return BulkConnectVerdict.of(sinkIsInput);
    case BOTH_CHILDREN:
      if (!sourceIsPort)
        return BulkConnectVerdict.of(!options.dontAssumeDirectionality());
      return BulkConnectVerdict.of(sinkIsPort && sinkIsInput);
    case UNRELATED:
    default:
      return BulkConnectVerdict.ELEMENT_WISE;
    }
  }
}

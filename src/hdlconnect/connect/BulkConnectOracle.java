package hdlconnect.connect;

import hdlconnect.data.ActualDirection;
import hdlconnect.data.ScalarKind;
import hdlconnect.data.ScalarSignal;
import hdlconnect.data.Signal;
import hdlconnect.data.SignalVariant;
import hdlconnect.data.SpecifiedDirection;
import hdlconnect.hierarchy.HwModule;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Decides whether two aggregates can be connected with a single command.
 *
 * Mono-directional bulk connects only work if all leaves of the sink are inputs.
 * Sinks with mixed directions (e.g. a ready/valid handshake) are always connected leaf by leaf.
 * Aggregates with Analog leaves are never bulk connected.
 */
public class BulkConnectOracle {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final BulkConnectCheck commutativeCheck;

  /**
   * @param commutativeCheck the bulk-connect check of the commutative connection, applied first
   */
  public BulkConnectOracle(BulkConnectCheck commutativeCheck) { this.commutativeCheck = commutativeCheck; }

  public BulkConnectVerdict canBulkConnect(Signal sink, Signal source, HwModule context, ConnectOptions options) {
    BulkConnectVerdict verdict = commutativeCheck.check(sink, source, context, options);
    if (verdict.isBulk() && (!hasOnlyInputLeaves(sink) || hasAnalogLeaf(sink) || hasAnalogLeaf(source)))
      verdict = BulkConnectVerdict.ELEMENT_WISE;
    logger.debug("{}: bulk connect {} := {}: {}", context.getName(), sink.getName(), source.getName(), verdict);
    return verdict;
  }

  /** Analog leaves are rejected by the element-wise descent and must never be hidden in an aggregate connect. */
  static boolean hasAnalogLeaf(Signal signal) {
    return signal.getLeaves().stream().anyMatch(
        leaf -> leaf.getVariant() == SignalVariant.SCALAR && ((ScalarSignal)leaf).getKind() == ScalarKind.ANALOG);
  }

  static boolean hasOnlyInputLeaves(Signal sink) {
    Set<ActualDirection> leafDirections =
        sink.getLeaves().stream().map(Signal::getDirection).collect(Collectors.toCollection(() -> EnumSet.noneOf(ActualDirection.class)));
    leafDirections.remove(ActualDirection.EMPTY);
    Optional<ActualDirection> combined = ActualDirection.fromChildren(leafDirections, SpecifiedDirection.UNSPECIFIED);
    return combined.isPresent() && combined.get() == ActualDirection.INPUT;
  }
}

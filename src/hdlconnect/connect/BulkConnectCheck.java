package hdlconnect.connect;

import hdlconnect.data.Signal;
import hdlconnect.hierarchy.HwModule;

/**
 * Legality check of the commutative (bidirectional) connection for bulk-connecting two aggregates.
 * The mono-directional resolver only connects aggregates as a whole if this check passes.
 */
public interface BulkConnectCheck {
  /**
   * @param sink the sink aggregate
   * @param source the source aggregate
   * @param context the module the connection is made in
   * @param options the connection policy
   * @return the verdict; an error verdict rejects the whole connection
   */
  BulkConnectVerdict check(Signal sink, Signal source, HwModule context, ConnectOptions options);
}

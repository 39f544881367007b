package hdlconnect.connect;

import hdlconnect.binding.BindingDirection;
import hdlconnect.binding.DontCareBinding;
import hdlconnect.data.Signal;
import hdlconnect.data.SignalVariant;
import hdlconnect.hierarchy.HwModule;
import hdlconnect.ir.Command;
import hdlconnect.ir.CommandSink;
import hdlconnect.ir.Connect;
import hdlconnect.ir.DefInvalid;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Decides whether a leaf-level connection is allowed and issues it.
 *
 * A valid sink must be writable, so one of these must hold:
 * - it is an internal writable node (register or wire),
 * - it is an output of the context module,
 * - it is an input of a child of the context module.
 *
 * A valid source must be readable, so one of these must hold:
 * - it is an internal readable node (register, wire, node, operation result),
 * - it is a literal,
 * - it is a port of the context module or of a child of the context module.
 */
public final class LeafConnector {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private LeafConnector() {}

  /**
   * Connects a leaf sink to a leaf source or to DontCare.
   * @param sink the sink leaf
   * @param source the source leaf, or DontCare
   * @param context the module the connection is made in
   * @param options the connection policy
   * @param commands receives the issued command
   * @return the reason the connection is illegal, or empty if a command was issued
   */
  public static Optional<ConnectError> resolveLeaf(Signal sink, Signal source, HwModule context, ConnectOptions options,
                                                   CommandSink commands) {
    if (source.getVariant() == SignalVariant.WILDCARD) {
      push(commands, new DefInvalid(context, sink));
      return Optional.empty();
    }

    if (!VisibilityChecker.isVisible(sink))
      return Optional.of(ConnectError.sinkEscapedScope(sink));
    if (!VisibilityChecker.isVisible(source))
      return Optional.of(ConnectError.sourceEscapedScope(source));

    // Literals cannot be written. Sources without a module (literals) are assumed to be in the context module.
    if (sink.getParentModule().isEmpty())
      return Optional.of(ConnectError.unwritableSink(sink, source));
    Topology topology = TopologyClassifier.classify(sink, source, context);

    BindingDirection sinkDirection = BindingDirection.from(sink.getTopBinding(), sink.getDirection());
    BindingDirection sourceDirection = BindingDirection.from(source.getTopBinding(), source.getDirection());

    switch (topology) {
    case SAME_MODULE:
      //    SINK          SOURCE
      //    CURRENT MOD   CURRENT MOD
      //    Output|Internal  any      connect
      //    Input            any      unwritable
      if (sinkDirection == BindingDirection.INPUT)
        return Optional.of(ConnectError.unwritableSink(sink, source));
      return issueConnect(sink, source, context, commands);

    case SINK_HERE_SOURCE_CHILD:
      //    SINK          SOURCE
      //    CURRENT MOD   CHILD MOD
      if (sinkDirection != BindingDirection.INPUT && sourceDirection != BindingDirection.INTERNAL)
        return issueConnect(sink, source, context, commands);
      if (sourceDirection == BindingDirection.INTERNAL)
        return assumeReadable(sink, source, context, options, commands);
      if (sourceDirection == BindingDirection.OUTPUT && !options.dontTryConnectionsSwapped()) {
        logger.debug("{}: connecting {} and {} with swapped operands", context.getName(), sink.getName(), source.getName());
        return issueConnect(source, sink, context, commands);
      }
      return Optional.of(ConnectError.unwritableSink(sink, source));

    case SOURCE_HERE_SINK_CHILD:
      //    SINK          SOURCE
      //    CHILD MOD     CURRENT MOD
      if (sinkDirection == BindingDirection.INPUT)
        return issueConnect(sink, source, context, commands);
      return Optional.of(ConnectError.unwritableSink(sink, source));

    case BOTH_CHILDREN:
      //    SINK          SOURCE
      //    CHILD MOD     CHILD MOD
      if (sinkDirection == BindingDirection.INPUT && sourceDirection != BindingDirection.INTERNAL)
        return issueConnect(sink, source, context, commands);
      if (sinkDirection == BindingDirection.OUTPUT)
        return Optional.of(ConnectError.unwritableSink(sink, source));
      if (sourceDirection == BindingDirection.INTERNAL)
        return assumeReadable(sink, source, context, options, commands);
      return Optional.of(ConnectError.unwritableSink(sink, source));

    case UNRELATED:
      return Optional.of(ConnectError.unrelatedModules());
    }
    throw new IllegalStateException("Unhandled topology " + topology);
  }

  /** Internal sources of a child module are readable unless the policy forbids assuming so. */
  private static Optional<ConnectError> assumeReadable(Signal sink, Signal source, HwModule context, ConnectOptions options,
                                                       CommandSink commands) {
    if (options.dontAssumeDirectionality())
      return Optional.of(ConnectError.unreadableSource(sink, source));
    return issueConnect(sink, source, context, commands);
  }

  private static Optional<ConnectError> issueConnect(Signal sink, Signal source, HwModule context, CommandSink commands) {
    if (source.getTopBinding() instanceof DontCareBinding)
      push(commands, new DefInvalid(context, sink));
    else
      push(commands, new Connect(context, sink, source));
    return Optional.empty();
  }

  static void push(CommandSink commands, Command command) {
    logger.trace("{}: {}", command.getContext().getName(), command);
    commands.pushCommand(command);
  }
}

package hdlconnect.connect;

import hdlconnect.data.DontCare;
import hdlconnect.data.RecordSignal;
import hdlconnect.data.ScalarKind;
import hdlconnect.data.ScalarSignal;
import hdlconnect.data.Signal;
import hdlconnect.data.SignalVariant;
import hdlconnect.data.VecSignal;
import hdlconnect.hierarchy.HwModule;
import hdlconnect.ir.CommandLog;
import hdlconnect.ir.CommandSink;
import hdlconnect.ir.Connect;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Executes a mono-directional connection ({@code sink := source}) element-wise.
 *
 * The connection is not commutative: sink and source are fixed before resolution starts.
 * Resolution descends the sink and matches each step in the source. The source may have extra record fields;
 * vectors must have the same length. Leaf pairs are decided by {@link LeafConnector}.
 *
 * Commands are emitted depth first, in index order for vectors and field order for records.
 * The first illegal step ends the resolution; commands emitted before it are kept.
 */
public class MonoConnect {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** A pending step of the descent. */
  private static class WorkItem {
    /** Path segments from the connected roots to this step, e.g. ["(2)", ".valid"]. */
    final List<String> path;
    final Signal sink;
    /** Null iff the step reports a record field missing from the source. */
    final Signal source;
    final String missingField;

    WorkItem(List<String> path, Signal sink, Signal source, String missingField) {
      this.path = path;
      this.sink = sink;
      this.source = source;
      this.missingField = missingField;
    }

    WorkItem child(String segment, Signal childSink, Signal childSource) {
      return new WorkItem(extendPath(segment), childSink, childSource, null);
    }

    WorkItem missing(String segment, String field) { return new WorkItem(extendPath(segment), sink, null, field); }

    private List<String> extendPath(String segment) {
      ArrayList<String> childPath = new ArrayList<>(path.size() + 1);
      childPath.addAll(path);
      childPath.add(segment);
      return childPath;
    }
  }

  private final BulkConnectOracle bulkOracle;

  public MonoConnect() { this(new BiConnectBulkCheck()); }

  /**
   * @param commutativeCheck the bulk-connect check of the commutative connection
   */
  public MonoConnect(BulkConnectCheck commutativeCheck) { this.bulkOracle = new BulkConnectOracle(commutativeCheck); }

  /**
   * Connects sink to source.
   * @param sink the signal to drive
   * @param source the driving signal, or {@link DontCare}
   * @param context the module the connect statement is in
   * @param options the connection policy
   * @param commands receives the emitted commands
   * @throws MonoConnectException if the connection is illegal; commands emitted before the failing step stay in commands
   */
  public void connect(Signal sink, Signal source, HwModule context, ConnectOptions options, CommandSink commands)
      throws MonoConnectException {
    Optional<ConnectError> error = tryConnect(sink, source, context, options, commands);
    if (error.isPresent())
      throw new MonoConnectException(error.get());
  }

  /**
   * Like {@link #connect(Signal, Signal, HwModule, ConnectOptions, CommandSink)}, but only hands commands to the sink if the
   * whole connection is legal.
   */
  public void connectAtomically(Signal sink, Signal source, HwModule context, ConnectOptions options, CommandSink commands)
      throws MonoConnectException {
    CommandLog buffer = new CommandLog();
    connect(sink, source, context, options, buffer);
    buffer.commit(commands);
  }

  /**
   * Connects sink to source, reporting an illegal connection as a value.
   * @return the error with its full structural path, or empty if the connection was emitted completely
   */
  public Optional<ConnectError> tryConnect(Signal sink, Signal source, HwModule context, ConnectOptions options,
                                           CommandSink commands) {
    requireHardware(sink, "Sink");
    requireHardware(source, "Source");
    Deque<WorkItem> pending = new ArrayDeque<>();
    pending.push(new WorkItem(List.of(), sink, source, null));
    while (!pending.isEmpty()) {
      WorkItem item = pending.pop();
      Optional<ConnectError> error = (item.missingField != null) ? Optional.of(ConnectError.missingField(item.missingField))
                                                                  : step(item, context, options, commands, pending);
      if (error.isPresent()) {
        ConnectError located = error.get().atPath(item.path);
        logger.debug("{}: cannot connect {} := {}: {}", context.getName(), sink.getName(), source.getName(), located);
        return Optional.of(located);
      }
    }
    return Optional.empty();
  }

  private Optional<ConnectError> step(WorkItem item, HwModule context, ConnectOptions options, CommandSink commands,
                                      Deque<WorkItem> pending) {
    Signal sink = item.sink;
    Signal source = item.source;
    SignalVariant sourceVariant = source.getVariant();

    switch (sink.getVariant()) {
    case WILDCARD:
      return Optional.of(ConnectError.wildcardSink());

    case SCALAR:
      // DontCare drives any scalar, Analog included.
      if (sourceVariant == SignalVariant.WILDCARD)
        return LeafConnector.resolveLeaf(sink, source, context, options, commands);
      if (sourceVariant == SignalVariant.SCALAR && KindCompatibility.isConnectable((ScalarSignal)sink, (ScalarSignal)source))
        return LeafConnector.resolveLeaf(sink, source, context, options, commands);
      break;

    case VECTOR: {
      VecSignal sinkVec = (VecSignal)sink;
      if (sourceVariant == SignalVariant.VECTOR) {
        VecSignal sourceVec = (VecSignal)source;
        if (sinkVec.length() != sourceVec.length())
          return Optional.of(ConnectError.mismatchedVectorLength());
        BulkConnectVerdict verdict = bulkOracle.canBulkConnect(sink, source, context, options);
        if (verdict.getError().isPresent())
          return verdict.getError();
        if (verdict.isBulk()) {
          LeafConnector.push(commands, new Connect(context, sink, source));
          return Optional.empty();
        }
        ArrayList<WorkItem> children = new ArrayList<>(sinkVec.length());
        for (int i = 0; i < sinkVec.length(); ++i)
          children.add(item.child("(" + i + ")", sinkVec.get(i), sourceVec.get(i)));
        pushInOrder(pending, children);
        return Optional.empty();
      }
      if (sourceVariant == SignalVariant.WILDCARD) {
        ArrayList<WorkItem> children = new ArrayList<>(sinkVec.length());
        for (int i = 0; i < sinkVec.length(); ++i)
          children.add(item.child("(" + i + ")", sinkVec.get(i), source));
        pushInOrder(pending, children);
        return Optional.empty();
      }
      break;
    }

    case RECORD: {
      RecordSignal sinkRecord = (RecordSignal)sink;
      if (sourceVariant == SignalVariant.RECORD) {
        RecordSignal sourceRecord = (RecordSignal)source;
        BulkConnectVerdict verdict = bulkOracle.canBulkConnect(sink, source, context, options);
        if (verdict.getError().isPresent())
          return verdict.getError();
        if (verdict.isBulk()) {
          LeafConnector.push(commands, new Connect(context, sink, source));
          return Optional.empty();
        }
        ArrayList<WorkItem> children = new ArrayList<>();
        for (Map.Entry<String, Signal> field : sinkRecord.getFields().entrySet()) {
          String segment = "." + field.getKey();
          Optional<Signal> sourceField = sourceRecord.getField(field.getKey());
          if (sourceField.isPresent())
            children.add(item.child(segment, field.getValue(), sourceField.get()));
          else if (options.connectFieldsMustMatch())
            children.add(item.missing(segment, field.getKey()));
          else
            logger.trace("{}: source {} has no field {}, skipping", context.getName(), source.getName(), field.getKey());
        }
        pushInOrder(pending, children);
        return Optional.empty();
      }
      if (sourceVariant == SignalVariant.WILDCARD) {
        ArrayList<WorkItem> children = new ArrayList<>();
        for (Map.Entry<String, Signal> field : sinkRecord.getFields().entrySet())
          children.add(item.child("." + field.getKey(), field.getValue(), source));
        pushInOrder(pending, children);
        return Optional.empty();
      }
      break;
    }
    }

    boolean sinkIsAnalog = isAnalog(sink);
    boolean sourceIsAnalog = isAnalog(source);
    if (sinkIsAnalog && sourceIsAnalog)
      return Optional.of(ConnectError.analogOperands(source, sink));
    if (sinkIsAnalog)
      return Optional.of(ConnectError.analogSink(sink));
    if (sourceIsAnalog)
      return Optional.of(ConnectError.analogSource(source));
    return Optional.of(ConnectError.typeMismatch(sink, source));
  }

  /** Pushes the items so that the first one is processed first. */
  private static void pushInOrder(Deque<WorkItem> pending, List<WorkItem> items) {
    for (int i = items.size() - 1; i >= 0; --i)
      pending.push(items.get(i));
  }

  private static boolean isAnalog(Signal signal) {
    return signal.getVariant() == SignalVariant.SCALAR && ((ScalarSignal)signal).getKind() == ScalarKind.ANALOG;
  }

  private static void requireHardware(Signal signal, String role) {
    if (!signal.isBound())
      throw new IllegalArgumentException(role + " of type " + signal.typeDescription() + " is not hardware; declare it in a module first");
  }
}

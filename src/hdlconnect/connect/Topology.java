package hdlconnect.connect;

/** Structural relationship of the sink and source owners to the context module. */
public enum Topology {
  /** Sink and source both belong to the context module. */
  SAME_MODULE,
  /** Sink belongs to the context module, source to a direct child. */
  SINK_HERE_SOURCE_CHILD,
  /** Source belongs to the context module, sink to a direct child. */
  SOURCE_HERE_SINK_CHILD,
  /** Sink and source both belong to direct children (possibly the same one). */
  BOTH_CHILDREN,
  /** None of the above; never legal. */
  UNRELATED
}

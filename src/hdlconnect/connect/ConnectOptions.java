package hdlconnect.connect;

/**
 * Policy flags consulted while resolving a connection. Immutable; passed explicitly to every resolution step.
 */
public class ConnectOptions {
  /** Default limit for the number of binding levels the flow tracer follows. */
  public static final int DEFAULT_MAX_BINDING_DEPTH = 4096;

  private final boolean connectFieldsMustMatch;
  private final boolean dontAssumeDirectionality;
  private final boolean dontTryConnectionsSwapped;
  private final int maxBindingDepth;

  /**
   * @param connectFieldsMustMatch if set, a sink record field missing from the source record is an error instead of being skipped
   * @param dontAssumeDirectionality if set, internal (non-port) sources in child modules are not assumed to be readable
   * @param dontTryConnectionsSwapped if set, an input sink driven by a child output is an error instead of being connected reversed
   */
  public ConnectOptions(boolean connectFieldsMustMatch, boolean dontAssumeDirectionality, boolean dontTryConnectionsSwapped) {
    this(connectFieldsMustMatch, dontAssumeDirectionality, dontTryConnectionsSwapped, DEFAULT_MAX_BINDING_DEPTH);
  }

  public ConnectOptions(boolean connectFieldsMustMatch, boolean dontAssumeDirectionality, boolean dontTryConnectionsSwapped,
                        int maxBindingDepth) {
    if (maxBindingDepth <= 0)
      throw new IllegalArgumentException("maxBindingDepth must be positive");
    this.connectFieldsMustMatch = connectFieldsMustMatch;
    this.dontAssumeDirectionality = dontAssumeDirectionality;
    this.dontTryConnectionsSwapped = dontTryConnectionsSwapped;
    this.maxBindingDepth = maxBindingDepth;
  }

  /** All relaxations enabled. */
  public static ConnectOptions permissive() { return new ConnectOptions(false, false, false); }

  /** All relaxations disabled. */
  public static ConnectOptions strict() { return new ConnectOptions(true, true, true); }

  public boolean connectFieldsMustMatch() { return connectFieldsMustMatch; }
  public boolean dontAssumeDirectionality() { return dontAssumeDirectionality; }
  public boolean dontTryConnectionsSwapped() { return dontTryConnectionsSwapped; }
  public int maxBindingDepth() { return maxBindingDepth; }

  @Override
  public String toString() {
    return String.format("ConnectOptions(connectFieldsMustMatch=%b, dontAssumeDirectionality=%b, dontTryConnectionsSwapped=%b, "
                             + "maxBindingDepth=%d)",
                         connectFieldsMustMatch, dontAssumeDirectionality, dontTryConnectionsSwapped, maxBindingDepth);
  }
}

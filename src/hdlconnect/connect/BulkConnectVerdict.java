package hdlconnect.connect;

import java.util.Optional;

/** Outcome of a bulk-connect check: connect as a whole, descend element-wise, or reject the connection. */
public class BulkConnectVerdict {
  public static final BulkConnectVerdict BULK = new BulkConnectVerdict(true, Optional.empty());
  public static final BulkConnectVerdict ELEMENT_WISE = new BulkConnectVerdict(false, Optional.empty());

  private final boolean bulk;
  private final Optional<ConnectError> error;

  private BulkConnectVerdict(boolean bulk, Optional<ConnectError> error) {
    this.bulk = bulk;
    this.error = error;
  }

  public static BulkConnectVerdict of(boolean bulk) { return bulk ? BULK : ELEMENT_WISE; }

  public static BulkConnectVerdict error(ConnectError error) { return new BulkConnectVerdict(false, Optional.of(error)); }

  /**
   * @return true iff the aggregates may be connected with a single command
   */
  public boolean isBulk() { return bulk; }

  /**
   * @return the reason the whole connection is illegal, if the check found one
   */
  public Optional<ConnectError> getError() { return error; }

  @Override
  public String toString() {
    return error.map(err -> "error(" + err + ")").orElse(bulk ? "bulk" : "element-wise");
  }
}

package hdlconnect.connect;

/** Thrown when a mono-directional connection is illegal. The message carries the structural path to the failing element. */
public class MonoConnectException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ConnectError error;

  public MonoConnectException(ConnectError error) {
    super(error.getFullMessage());
    this.error = error;
  }

  public ConnectError getError() { return error; }

  public ConnectErrorKind getKind() { return error.getKind(); }
}

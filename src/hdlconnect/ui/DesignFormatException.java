package hdlconnect.ui;

/** Thrown if a design description cannot be turned into modules, signals and connect statements. */
public class DesignFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  public DesignFormatException(String message) { super(message); }

  public DesignFormatException(String message, Throwable cause) { super(message, cause); }
}

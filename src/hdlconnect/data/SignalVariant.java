package hdlconnect.data;

/** The closed set of signal shapes. */
public enum SignalVariant {
  SCALAR,
  VECTOR,
  RECORD,
  /** The DontCare marker. */
  WILDCARD
}

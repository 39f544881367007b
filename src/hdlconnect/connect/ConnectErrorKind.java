package hdlconnect.connect;

/** Reasons a mono-directional connection can be rejected. */
public enum ConnectErrorKind {
  UNREADABLE_SOURCE,
  UNWRITABLE_SINK,
  SOURCE_ESCAPED_SCOPE,
  SINK_ESCAPED_SCOPE,
  UNRELATED_MODULES,
  MISMATCHED_VECTOR_LENGTH,
  MISSING_FIELD,
  TYPE_MISMATCH,
  WILDCARD_SINK,
  BIDIRECTIONAL_OPERAND
}

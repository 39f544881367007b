package hdlconnect.data;

/** Kinds of leaf signals. */
public enum ScalarKind {
  UINT("UInt", true),
  BOOL("Bool", false),
  SINT("SInt", true),
  FIXED_POINT("FixedPoint", true),
  INTERVAL("Interval", true),
  CLOCK("Clock", false),
  ASYNC_RESET("AsyncReset", false),
  /** Abstract reset, inferred to a synchronous or asynchronous reset later. */
  RESET("Reset", false),
  ENUM("Enum", false),
  /** Enum value of unchecked origin (e.g. cast from a UInt). */
  UNSAFE_ENUM("UnsafeEnum", true),
  /** Bidirectional wire. */
  ANALOG("Analog", true);

  private final String typeName;
  private final boolean showWidth;

  ScalarKind(String typeName, boolean showWidth) {
    this.typeName = typeName;
    this.showWidth = showWidth;
  }

  public String getTypeName() { return typeName; }

  /** UInt and its subtype Bool. */
  public boolean isUIntFamily() { return this == UINT || this == BOOL; }
  /** The abstract reset and all concrete reset types (Bool is a synchronous reset). */
  public boolean isResetFamily() { return this == RESET || this == ASYNC_RESET || this == BOOL; }
  /** Enum and its subtype UnsafeEnum. */
  public boolean isEnumFamily() { return this == ENUM || this == UNSAFE_ENUM; }

  /**
   * Renders a type description such as {@code UInt<8>}.
   * @param width the width, or a negative value if unknown
   */
  public String describe(int width) {
    if (!showWidth || width < 0)
      return typeName;
    return typeName + "<" + width + ">";
  }

  /**
   * Parses the type name (case insensitive), as used in design descriptions.
   * @param name the type name
   * @return the kind
   */
  public static ScalarKind fromTypeName(String name) {
    for (ScalarKind kind : values()) {
      if (kind.typeName.equalsIgnoreCase(name))
        return kind;
    }
    throw new IllegalArgumentException("Unknown scalar type " + name);
  }
}

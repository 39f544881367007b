package hdlconnect.data;

import hdlconnect.binding.LiteralBinding;
import java.util.List;
import java.util.Objects;

/** A leaf signal of a given {@link ScalarKind}. */
public class ScalarSignal extends Signal {
  private final ScalarKind kind;
  private final int width;
  private final String enumName;

  /**
   * @param kind the scalar kind; use {@link #enumOf(String, int)} for enums
   * @param width the width in bits, or -1 if unknown
   */
  public ScalarSignal(ScalarKind kind, int width) { this(kind, width, kind == ScalarKind.ENUM ? "Enum" : null); }

  private ScalarSignal(ScalarKind kind, int width, String enumName) {
    this.kind = kind;
    this.width = (kind == ScalarKind.BOOL || kind == ScalarKind.CLOCK || kind == ScalarKind.ASYNC_RESET) ? 1 : width;
    this.enumName = enumName;
  }

  public static ScalarSignal uint(int width) { return new ScalarSignal(ScalarKind.UINT, width); }
  public static ScalarSignal sint(int width) { return new ScalarSignal(ScalarKind.SINT, width); }
  public static ScalarSignal bool() { return new ScalarSignal(ScalarKind.BOOL, 1); }
  public static ScalarSignal clock() { return new ScalarSignal(ScalarKind.CLOCK, 1); }
  public static ScalarSignal reset() { return new ScalarSignal(ScalarKind.RESET, -1); }
  public static ScalarSignal asyncReset() { return new ScalarSignal(ScalarKind.ASYNC_RESET, 1); }
  public static ScalarSignal analog(int width) { return new ScalarSignal(ScalarKind.ANALOG, width); }
  public static ScalarSignal fixedPoint(int width) { return new ScalarSignal(ScalarKind.FIXED_POINT, width); }
  public static ScalarSignal interval() { return new ScalarSignal(ScalarKind.INTERVAL, -1); }
  public static ScalarSignal unsafeEnum(int width) { return new ScalarSignal(ScalarKind.UNSAFE_ENUM, width); }
  /**
   * @param enumName name of the enum type; enums of different types are not connectable
   * @param width the encoding width
   */
  public static ScalarSignal enumOf(String enumName, int width) { return new ScalarSignal(ScalarKind.ENUM, width, enumName); }

  /**
   * Creates a bound literal.
   * @param kind the kind of the literal
   * @param width the literal width, or -1 if unknown
   * @param value the rendered value
   * @return the literal signal
   */
  public static ScalarSignal literal(ScalarKind kind, int width, String value) {
    ScalarSignal lit = new ScalarSignal(kind, width);
    lit.bind(new LiteralBinding(value), lit.typeDescription() + "(" + value + ")");
    return lit;
  }

  public ScalarKind getKind() { return kind; }

  /**
   * @return the width in bits, or -1 if unknown
   */
  public int getWidth() { return width; }

  public String getEnumName() { return enumName; }

  /**
   * Tests if two enum signals belong to the same enum type.
   * @param other the other signal
   * @return true iff both are enums of the same type
   */
  public boolean typeEquivalent(ScalarSignal other) {
    return kind == other.kind && Objects.equals(enumName, other.enumName);
  }

  @Override
  public SignalVariant getVariant() {
    return SignalVariant.SCALAR;
  }

  @Override
  public List<Signal> getElements() {
    return List.of();
  }

  @Override
  public String typeDescription() {
    if (kind == ScalarKind.ENUM)
      return enumName;
    return kind.describe(width);
  }

  @Override
  protected Signal cloneUnbound() {
    return new ScalarSignal(kind, width, enumName);
  }

  @Override
  protected List<String> childNameSuffixes() {
    return List.of();
  }
}

package hdlconnect.data;

/** Direction annotations for signal types, applied before binding. */
public final class Directions {
  private Directions() {}

  /** Returns a copy of the type forced to input. */
  public static <T extends Signal> T input(T type) { return withDirection(type, SpecifiedDirection.INPUT); }

  /** Returns a copy of the type forced to output. */
  public static <T extends Signal> T output(T type) { return withDirection(type, SpecifiedDirection.OUTPUT); }

  /** Returns a copy of the type with its direction inverted relative to the parent. */
  public static <T extends Signal> T flipped(T type) { return withDirection(type, type.getSpecifiedDirection().flip()); }

  @SuppressWarnings("unchecked")
  private static <T extends Signal> T withDirection(T type, SpecifiedDirection direction) {
    if (type.isBound())
      throw new IllegalArgumentException("Direction annotations only apply to unbound types, got " + type.getName());
    T copy = (T)type.cloneType();
    copy.specifiedDirection = direction;
    return copy;
  }
}

package hdlconnect.data;

/** User-specified direction annotation of a signal, relative to its parent. */
public enum SpecifiedDirection {
  /** Default direction; inherits from the parent. */
  UNSPECIFIED,
  /** Forces the signal and everything below it to output. */
  OUTPUT,
  /** Forces the signal and everything below it to input. */
  INPUT,
  /** Inverts the direction of the signal relative to its parent. */
  FLIP;

  /**
   * Returns true iff the annotation flips the flow of the signal relative to its parent.
   * @return the flag
   */
  public boolean isFlipped() { return this == INPUT || this == FLIP; }

  public SpecifiedDirection flip() {
    switch (this) {
    case UNSPECIFIED:
      return FLIP;
    case FLIP:
      return UNSPECIFIED;
    case OUTPUT:
      return INPUT;
    case INPUT:
      return OUTPUT;
    }
    throw new IllegalStateException();
  }

  /**
   * Resolves the direction of a child from the already resolved direction of its parent.
   * Input and Output on a parent coerce the whole subtree.
   * @param parentDirection the resolved parent direction
   * @param childDirection the annotation of the child
   * @return the resolved child direction
   */
  public static SpecifiedDirection fromParent(SpecifiedDirection parentDirection, SpecifiedDirection childDirection) {
    switch (parentDirection) {
    case OUTPUT:
      return OUTPUT;
    case INPUT:
      return INPUT;
    case UNSPECIFIED:
      return childDirection;
    case FLIP:
      return childDirection.flip();
    }
    throw new IllegalStateException();
  }
}

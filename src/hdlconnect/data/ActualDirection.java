package hdlconnect.data;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/** Direction of a bound signal, resolved over its whole binding chain. */
public enum ActualDirection {
  /** Aggregate without any elements. */
  EMPTY,
  /** Non-port signal without a forced direction. */
  UNSPECIFIED,
  OUTPUT,
  INPUT,
  /** Aggregate that contains both inputs and outputs. */
  BIDIRECTIONAL;

  /**
   * Resolves the direction of a leaf.
   * Port leaves are always either input or output: a flipped leaf is an input, an unspecified one an output.
   * @param direction the resolved specified direction of the leaf
   * @param isPort true iff the leaf belongs to a port
   */
  public static ActualDirection fromSpecified(SpecifiedDirection direction, boolean isPort) {
    switch (direction) {
    case OUTPUT:
      return OUTPUT;
    case INPUT:
      return INPUT;
    case FLIP:
      return isPort ? INPUT : UNSPECIFIED;
    case UNSPECIFIED:
      return isPort ? OUTPUT : UNSPECIFIED;
    }
    throw new IllegalStateException();
  }

  /**
   * Determines the direction of an aggregate from the set of its children's directions.
   * @param childDirections the set of directions of the immediate children
   * @param containerDirection the resolved specified direction of the aggregate
   * @return the aggregate direction, or empty if the children mix unspecified and specified directions
   */
  public static Optional<ActualDirection> fromChildren(Set<ActualDirection> childDirections, SpecifiedDirection containerDirection) {
    if (childDirections.isEmpty()) {
      ActualDirection dir = fromSpecified(containerDirection, false);
      return Optional.of(dir == UNSPECIFIED ? EMPTY : dir);
    }
    if (childDirections.size() == 1) {
      ActualDirection only = childDirections.iterator().next();
      if (only != EMPTY)
        return Optional.of(only);
    }
    if (EnumSet.of(OUTPUT, INPUT, BIDIRECTIONAL).containsAll(childDirections))
      return Optional.of(BIDIRECTIONAL);
    return Optional.empty();
  }
}

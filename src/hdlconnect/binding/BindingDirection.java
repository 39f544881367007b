package hdlconnect.binding;

import hdlconnect.data.ActualDirection;

/** Direction of a leaf signal as far as its binding is concerned. */
public enum BindingDirection {
  /** Internal node (wire, register, literal etc.) of a module. */
  INTERNAL,
  /** Module port, driven from outside of the module. */
  INPUT,
  /** Module port, driven from inside of the module. */
  OUTPUT;

  /**
   * Determines the binding direction of a leaf.
   * @param binding the top binding of the leaf
   * @param direction the resolved direction of the leaf
   * @return {@link #INTERNAL} for anything but ports, the port direction otherwise
   */
  public static BindingDirection from(TopBinding binding, ActualDirection direction) {
    if (!(binding instanceof PortBinding))
      return INTERNAL;
    switch (direction) {
    case OUTPUT:
      return OUTPUT;
    case INPUT:
      return INPUT;
    default:
      throw new IllegalStateException("Unexpected port element direction '" + direction + "'");
    }
  }
}

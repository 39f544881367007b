package hdlconnect.binding;

/**
 * Describes how a signal came to exist and anchors it in the module hierarchy.
 * Either a {@link TopBinding} for the root of a signal or a {@link ChildBinding} for elements of an aggregate.
 */
public abstract class Binding {}

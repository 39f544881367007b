package hdlconnect.binding;

import java.util.Optional;

/** A binding that may have been created inside a when scope. */
public interface ConditionalDeclarable {
  /**
   * @return the when scope the signal was declared in, or empty if declared outside of any when
   */
  Optional<WhenScope> getVisibility();
}

package hdlconnect.data;

import hdlconnect.binding.DontCareBinding;
import java.util.List;

/** Source-only marker for an unspecified value. Connecting it to a sink invalidates the sink. */
public final class DontCare extends Signal {
  public static final DontCare INSTANCE = new DontCare();

  private DontCare() { bind(new DontCareBinding(), "DontCare"); }

  @Override
  public SignalVariant getVariant() {
    return SignalVariant.WILDCARD;
  }

  @Override
  public List<Signal> getElements() {
    return List.of();
  }

  @Override
  public String typeDescription() {
    return "DontCare";
  }

  @Override
  public Signal cloneType() {
    return INSTANCE;
  }

  @Override
  protected Signal cloneUnbound() {
    return INSTANCE;
  }

  @Override
  protected List<String> childNameSuffixes() {
    return List.of();
  }
}

package hdlconnect.connect;

import hdlconnect.data.ScalarKind;
import hdlconnect.data.ScalarSignal;

/** The scalar kind pairs a mono-directional connection accepts. */
public final class KindCompatibility {
  private KindCompatibility() {}

  /**
   * @param sink the sink scalar
   * @param source the source scalar
   * @return true iff the source kind may drive the sink kind
   */
  public static boolean isConnectable(ScalarSignal sink, ScalarSignal source) {
    ScalarKind sinkKind = sink.getKind();
    ScalarKind sourceKind = source.getKind();
    // Bool is a UInt.
    if (sinkKind.isUIntFamily() && sourceKind.isUIntFamily())
      return true;
    if (sinkKind == sourceKind) {
      switch (sinkKind) {
      case SINT:
      case FIXED_POINT:
      case INTERVAL:
      case CLOCK:
      case ASYNC_RESET:
        return true;
      default:
        break;
      }
    }
    if (sinkKind == ScalarKind.RESET && sourceKind.isResetFamily())
      return true;
    if (sinkKind.isResetFamily() && sourceKind == ScalarKind.RESET)
      return true;
    if (sinkKind.isEnumFamily() && sourceKind == ScalarKind.UNSAFE_ENUM)
      return true;
    if (sinkKind.isEnumFamily() && sourceKind.isEnumFamily() && sink.typeEquivalent(source))
      return true;
    if (sinkKind == ScalarKind.UNSAFE_ENUM && sourceKind.isUIntFamily())
      return true;
    return false;
  }
}

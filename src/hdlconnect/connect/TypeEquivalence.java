package hdlconnect.connect;

import hdlconnect.data.RecordSignal;
import hdlconnect.data.ScalarKind;
import hdlconnect.data.ScalarSignal;
import hdlconnect.data.Signal;
import hdlconnect.data.VecSignal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;

/** Structural connectability of two types, on the level of lowered ground types. */
public final class TypeEquivalence {
  private TypeEquivalence() {}

  /**
   * Tests if a source type can drive a sink type as a whole.
   * Vectors need equal lengths; records need the same field names, in the same order, with equal flips.
   * Flipped fields are compared with sink and source exchanged.
   */
  public static boolean validConnect(Signal sink, Signal source) {
    Deque<Signal[]> pending = new ArrayDeque<>();
    pending.push(new Signal[] {sink, source});
    while (!pending.isEmpty()) {
      Signal[] pair = pending.pop();
      Signal curSink = pair[0];
      Signal curSource = pair[1];
      if (curSink.getVariant() != curSource.getVariant())
        return false;
      switch (curSink.getVariant()) {
      case SCALAR:
        if (!groundConnectable((ScalarSignal)curSink, (ScalarSignal)curSource))
          return false;
        break;
      case VECTOR: {
        VecSignal sinkVec = (VecSignal)curSink;
        VecSignal sourceVec = (VecSignal)curSource;
        if (sinkVec.length() != sourceVec.length())
          return false;
        for (int i = 0; i < sinkVec.length(); ++i)
          pending.push(new Signal[] {sinkVec.get(i), sourceVec.get(i)});
        break;
      }
      case RECORD: {
        Map<String, Signal> sinkFields = ((RecordSignal)curSink).getFields();
        Map<String, Signal> sourceFields = ((RecordSignal)curSource).getFields();
        if (sinkFields.size() != sourceFields.size())
          return false;
        Iterator<Map.Entry<String, Signal>> sourceIter = sourceFields.entrySet().iterator();
        for (Map.Entry<String, Signal> sinkField : sinkFields.entrySet()) {
          Map.Entry<String, Signal> sourceField = sourceIter.next();
          boolean sinkFlip = sinkField.getValue().getSpecifiedDirection().isFlipped();
          if (!sinkField.getKey().equals(sourceField.getKey()) || sinkFlip != sourceField.getValue().getSpecifiedDirection().isFlipped())
            return false;
          pending.push(sinkFlip ? new Signal[] {sourceField.getValue(), sinkField.getValue()}
                                : new Signal[] {sinkField.getValue(), sourceField.getValue()});
        }
        break;
      }
      case WILDCARD:
        return false;
      }
    }
    return true;
  }

  /** Enums and Bool lower to UInt. */
  static ScalarKind groundKind(ScalarKind kind) {
    if (kind.isUIntFamily() || kind.isEnumFamily())
      return ScalarKind.UINT;
    return kind;
  }

  static boolean groundConnectable(ScalarSignal sink, ScalarSignal source) {
    ScalarKind sinkGround = groundKind(sink.getKind());
    ScalarKind sourceGround = groundKind(source.getKind());
    if (sinkGround == ScalarKind.RESET)
      return isLegalResetType(source);
    if (sourceGround == ScalarKind.RESET)
      return isLegalResetType(sink);
    return sinkGround == sourceGround;
  }

  /** An abstract reset connects to 1-bit (or unknown width) UInts, asynchronous resets and other abstract resets. */
  static boolean isLegalResetType(ScalarSignal signal) {
    ScalarKind ground = groundKind(signal.getKind());
    if (ground == ScalarKind.UINT)
      return signal.getWidth() == 1 || signal.getWidth() < 0;
    return ground == ScalarKind.ASYNC_RESET || ground == ScalarKind.RESET;
  }
}

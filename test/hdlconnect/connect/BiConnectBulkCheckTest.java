package hdlconnect.connect;

import hdlconnect.binding.WhenScope;
import hdlconnect.data.Directions;
import hdlconnect.data.RecordSignal;
import hdlconnect.data.ScalarKind;
import hdlconnect.data.ScalarSignal;
import hdlconnect.data.VecSignal;
import hdlconnect.hierarchy.HwModule;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BiConnectBulkCheckTest {
  HwModule top;
  HwModule child;
  BiConnectBulkCheck check = new BiConnectBulkCheck();
  ConnectOptions options = ConnectOptions.permissive();

  @BeforeEach
  void setUp() {
    top = new HwModule("top");
    child = top.instantiate("child");
  }

  static VecSignal vec() { return new VecSignal(2, ScalarSignal.uint(8)); }

  @Test
  void testWiresInSameModule() {
    var a = top.wire("a", vec());
    var b = top.wire("b", vec());
    Assertions.assertTrue(check.check(a, b, top, options).isBulk());
  }

  @Test
  void testTypeMismatch() {
    var a = top.wire("a", vec());
    var b = top.wire("b", new VecSignal(3, ScalarSignal.uint(8)));
    var c = top.wire("c", new VecSignal(2, ScalarSignal.sint(8)));
    Assertions.assertFalse(check.check(a, b, top, options).isBulk());
    Assertions.assertFalse(check.check(a, c, top, options).isBulk());
  }

  @Test
  void testReadOnlySink() {
    var n = top.node("n", vec(), Optional.empty());
    var b = top.wire("b", vec());
    var verdict = check.check(n, b, top, options);
    Assertions.assertFalse(verdict.isBulk());
    Assertions.assertTrue(verdict.getError().isEmpty());
  }

  @Test
  void testLiteralSource() {
    var w = top.wire("w", ScalarSignal.uint(8));
    Assertions.assertFalse(check.check(w, ScalarSignal.literal(ScalarKind.UINT, 8, "7"), top, options).isBulk());
  }

  @Test
  void testLiteralSinkIsAnError() {
    var w = top.wire("w", ScalarSignal.uint(8));
    var verdict = check.check(ScalarSignal.literal(ScalarKind.UINT, 8, "7"), w, top, options);
    Assertions.assertEquals(ConnectErrorKind.UNWRITABLE_SINK, verdict.getError().get().getKind());
  }

  @Test
  void testEscapedScopeIsAnError() {
    var scope = new WhenScope("c");
    var a = top.wire("a", vec(), Optional.of(scope));
    var b = top.wire("b", vec());
    scope.close();
    Assertions.assertEquals(ConnectErrorKind.SINK_ESCAPED_SCOPE, check.check(a, b, top, options).getError().get().getKind());
    Assertions.assertEquals(ConnectErrorKind.SOURCE_ESCAPED_SCOPE, check.check(b, a, top, options).getError().get().getKind());
  }

  @Test
  void testChildInternalSource() {
    var a = top.wire("a", vec());
    var b = child.wire("b", vec());
    Assertions.assertTrue(check.check(a, b, top, options).isBulk());
    Assertions.assertFalse(check.check(a, b, top, new ConnectOptions(false, true, false)).isBulk());
  }

  @Test
  void testOwnOutputPortIsNoBulkSource() {
    var out = top.port("out", Directions.output(vec()));
    var w = top.wire("w", vec());
    Assertions.assertTrue(check.check(out, w, top, options).isBulk());
    Assertions.assertFalse(check.check(w, out, top, options).isBulk());
  }

  @Test
  void testChildInputSink() {
    var in = child.port("in", Directions.input(vec()));
    var out = child.port("out", Directions.output(vec()));
    var w = top.wire("w", vec());
    Assertions.assertTrue(check.check(in, w, top, options).isBulk());
    Assertions.assertFalse(check.check(out, w, top, options).isBulk());
  }

  @Test
  void testFlippedRecordFields() {
    var handshake = new RecordSignal().field("valid", ScalarSignal.bool()).field("ready", Directions.flipped(ScalarSignal.bool()));
    var io = top.port("io", handshake);
    var childIo = child.port("io", handshake);
    Assertions.assertTrue(check.check(io, childIo, top, options).isBulk());
    var unflipped = top.wire("w", new RecordSignal().field("valid", ScalarSignal.bool()).field("ready", ScalarSignal.bool()));
    Assertions.assertFalse(check.check(io, unflipped, top, options).isBulk());
  }
}

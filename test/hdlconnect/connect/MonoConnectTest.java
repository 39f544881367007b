package hdlconnect.connect;

import hdlconnect.binding.WhenScope;
import hdlconnect.data.Directions;
import hdlconnect.data.DontCare;
import hdlconnect.data.RecordSignal;
import hdlconnect.data.ScalarKind;
import hdlconnect.data.ScalarSignal;
import hdlconnect.data.VecSignal;
import hdlconnect.hierarchy.HwModule;
import hdlconnect.ir.CommandLog;
import hdlconnect.ir.Connect;
import hdlconnect.ir.DefInvalid;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MonoConnectTest {
  HwModule top;
  HwModule child;
  CommandLog commands;
  MonoConnect monoConnect;

  @BeforeEach
  void setUp() {
    top = new HwModule("top");
    child = top.instantiate("child");
    commands = new CommandLog();
    monoConnect = new MonoConnect();
  }

  static RecordSignal handshake() {
    return new RecordSignal().field("valid", ScalarSignal.bool()).field("ready", Directions.flipped(ScalarSignal.bool()));
  }

  @Test
  void testScalarEmitsSingleConnect() throws MonoConnectException {
    var out = top.port("out", Directions.output(ScalarSignal.uint(8)));
    var w = top.wire("w", ScalarSignal.uint(8));
    monoConnect.connect(out, w, top, ConnectOptions.permissive(), commands);

    Assertions.assertEquals(1, commands.size());
    var connect = (Connect)commands.getCommands().get(0);
    Assertions.assertSame(out, connect.getSink());
    Assertions.assertSame(w, connect.getSource());
    Assertions.assertEquals("out <= w", commands.serialize());
  }

  @Test
  void testVectorFromDontCareInvalidatesEachElement() throws MonoConnectException {
    var v = top.port("v", Directions.output(new VecSignal(4, ScalarSignal.uint(8))));
    monoConnect.connect(v, DontCare.INSTANCE, top, ConnectOptions.permissive(), commands);

    Assertions.assertEquals(4, commands.size());
    for (int i = 0; i < 4; ++i) {
      Assertions.assertEquals(new DefInvalid(top, v.get(i)), commands.getCommands().get(i));
    }
    Assertions.assertEquals("v[0] is invalid\nv[1] is invalid\nv[2] is invalid\nv[3] is invalid", commands.serialize());
  }

  @Test
  void testRecordFromDontCareInvalidatesLeavesDepthFirst() throws MonoConnectException {
    var r = top.wire("r", new RecordSignal().field("a", new VecSignal(2, ScalarSignal.uint(4))).field("b", ScalarSignal.sint(4)));
    monoConnect.connect(r, DontCare.INSTANCE, top, ConnectOptions.permissive(), commands);

    Assertions.assertEquals("r.a[0] is invalid\nr.a[1] is invalid\nr.b is invalid", commands.serialize());
    Assertions.assertEquals(r.getLeaves().size(), commands.size());
  }

  @Test
  void testSourceMissingFieldIsSkipped() throws MonoConnectException {
    var io = child.port("io", new RecordSignal()
                                  .field("a", Directions.input(ScalarSignal.uint(8)))
                                  .field("b", Directions.output(ScalarSignal.uint(8))));
    var w = top.wire("w", new RecordSignal().field("a", ScalarSignal.uint(8)));
    monoConnect.connect(io, w, top, ConnectOptions.permissive(), commands);

    Assertions.assertEquals(1, commands.size());
    Assertions.assertEquals("child.io.a <= w.a", commands.serialize());
  }

  @Test
  void testSourceMissingFieldFailsIfFieldsMustMatch() {
    var io = child.port("io", new RecordSignal()
                                  .field("a", Directions.input(ScalarSignal.uint(8)))
                                  .field("b", Directions.output(ScalarSignal.uint(8))));
    var w = top.wire("w", new RecordSignal().field("a", ScalarSignal.uint(8)));
    var options = new ConnectOptions(true, false, false);
    var ex = Assertions.assertThrows(MonoConnectException.class, () -> monoConnect.connect(io, w, top, options, commands));

    Assertions.assertEquals(ConnectErrorKind.MISSING_FIELD, ex.getKind());
    Assertions.assertEquals(".bSource Record missing field (b).", ex.getMessage());
    // Field a was connected before b failed.
    Assertions.assertEquals(1, commands.size());
  }

  @Test
  void testExtraSourceFieldIsIgnored() throws MonoConnectException {
    var out = top.port("out", Directions.output(new RecordSignal().field("a", ScalarSignal.uint(8))));
    var w = top.wire("w", new RecordSignal().field("a", ScalarSignal.uint(8)).field("extra", ScalarSignal.clock()));
    monoConnect.connect(out, w, top, new ConnectOptions(true, false, false), commands);

    Assertions.assertEquals("out.a <= w.a", commands.serialize());
  }

  @Test
  void testAnalogOperandsFail() {
    var x = top.wire("x", ScalarSignal.analog(8));
    var y = top.wire("y", ScalarSignal.analog(8));
    Optional<ConnectError> error = monoConnect.tryConnect(x, y, top, ConnectOptions.permissive(), commands);

    Assertions.assertTrue(error.isPresent());
    Assertions.assertEquals(ConnectErrorKind.BIDIRECTIONAL_OPERAND, error.get().getKind());
    Assertions.assertEquals("Source y in top and sink x in top of type Analog cannot participate in a mono connection (:=)",
                            error.get().getMessage());
    Assertions.assertTrue(commands.isEmpty());
  }

  @Test
  void testAnalogVectorIsNeverBulkConnected() {
    var a = child.port("a", Directions.input(new VecSignal(2, ScalarSignal.analog(1))));
    var w = top.wire("w", new VecSignal(2, ScalarSignal.analog(1)));
    Optional<ConnectError> error = monoConnect.tryConnect(a, w, top, ConnectOptions.permissive(), commands);

    Assertions.assertTrue(error.isPresent());
    Assertions.assertEquals(ConnectErrorKind.BIDIRECTIONAL_OPERAND, error.get().getKind());
    Assertions.assertEquals(List.of("(0)"), error.get().getPath());
    Assertions.assertTrue(commands.isEmpty());
  }

  @Test
  void testAnalogSinkOrSourceFails() {
    var x = top.wire("x", ScalarSignal.analog(8));
    var u = top.wire("u", ScalarSignal.uint(8));

    var sinkError = monoConnect.tryConnect(x, u, top, ConnectOptions.permissive(), commands);
    Assertions.assertEquals(ConnectErrorKind.BIDIRECTIONAL_OPERAND, sinkError.get().getKind());
    Assertions.assertTrue(sinkError.get().getMessage().startsWith("Sink x in top of type Analog"));

    var sourceError = monoConnect.tryConnect(u, x, top, ConnectOptions.permissive(), commands);
    Assertions.assertEquals(ConnectErrorKind.BIDIRECTIONAL_OPERAND, sourceError.get().getKind());
    Assertions.assertTrue(sourceError.get().getMessage().startsWith("Source x in top of type Analog"));
    Assertions.assertTrue(commands.isEmpty());
  }

  @Test
  void testAnalogFromDontCareIsInvalidated() throws MonoConnectException {
    var x = top.wire("x", ScalarSignal.analog(8));
    monoConnect.connect(x, DontCare.INSTANCE, top, ConnectOptions.permissive(), commands);
    Assertions.assertEquals("x is invalid", commands.serialize());
  }

  @Test
  void testErrorPathIsOuterToInner() {
    var sinkElement = new RecordSignal().field("status", new VecSignal(2, ScalarSignal.uint(8)));
    var sourceElement = new RecordSignal().field("status", new VecSignal(3, ScalarSignal.uint(8)));
    var out = top.port("out", Directions.output(new VecSignal(2, sinkElement)));
    var w = top.wire("w", new VecSignal(2, sourceElement));
    var error = monoConnect.tryConnect(out, w, top, ConnectOptions.permissive(), commands);

    Assertions.assertTrue(error.isPresent());
    Assertions.assertEquals(ConnectErrorKind.MISMATCHED_VECTOR_LENGTH, error.get().getKind());
    Assertions.assertEquals(List.of("(0)", ".status"), error.get().getPath());
    Assertions.assertEquals("(0).statusSink and Source are different length Vecs.", error.get().getFullMessage());
  }

  @Test
  void testVectorLengthMismatchEmitsNothing() {
    var out = top.port("out", Directions.output(new VecSignal(4, ScalarSignal.uint(8))));
    var w = top.wire("w", new VecSignal(3, ScalarSignal.uint(8)));
    var ex = Assertions.assertThrows(MonoConnectException.class,
                                     () -> monoConnect.connect(out, w, top, ConnectOptions.permissive(), commands));

    Assertions.assertEquals(ConnectErrorKind.MISMATCHED_VECTOR_LENGTH, ex.getKind());
    Assertions.assertEquals("Sink and Source are different length Vecs.", ex.getMessage());
    Assertions.assertTrue(commands.isEmpty());
  }

  @Test
  void testSwappedOperands() throws MonoConnectException {
    var in = top.port("in", Directions.input(ScalarSignal.uint(8)));
    var o = child.port("o", Directions.output(ScalarSignal.uint(8)));
    monoConnect.connect(in, o, top, ConnectOptions.permissive(), commands);

    var connect = (Connect)commands.getCommands().get(0);
    Assertions.assertSame(o, connect.getSink());
    Assertions.assertSame(in, connect.getSource());
    Assertions.assertEquals("child.o <= in", commands.serialize());
  }

  @Test
  void testSwappedOperandsDisabled() {
    var in = top.port("in", Directions.input(ScalarSignal.uint(8)));
    var o = child.port("o", Directions.output(ScalarSignal.uint(8)));
    var ex = Assertions.assertThrows(MonoConnectException.class,
                                     () -> monoConnect.connect(in, o, top, new ConnectOptions(false, false, true), commands));

    Assertions.assertEquals(ConnectErrorKind.UNWRITABLE_SINK, ex.getKind());
    Assertions.assertEquals("in in top cannot be written from module child.", ex.getMessage());
  }

  @Test
  void testAllInputAggregateIsBulkConnected() throws MonoConnectException {
    var io = child.port("io", Directions.input(new RecordSignal().field("a", ScalarSignal.uint(8)).field("b", ScalarSignal.bool())));
    var w = top.wire("w", new RecordSignal().field("a", ScalarSignal.uint(8)).field("b", ScalarSignal.bool()));
    monoConnect.connect(io, w, top, ConnectOptions.permissive(), commands);

    Assertions.assertEquals(List.of(new Connect(top, io, w)), commands.getCommands());
    Assertions.assertEquals("child.io <= w", commands.serialize());
  }

  @Test
  void testVectorOfInputsIsBulkConnected() throws MonoConnectException {
    var v = child.port("v", Directions.input(new VecSignal(3, ScalarSignal.uint(8))));
    var w = top.wire("w", new VecSignal(3, ScalarSignal.uint(8)));
    monoConnect.connect(v, w, top, ConnectOptions.permissive(), commands);

    Assertions.assertEquals("child.v <= w", commands.serialize());
  }

  @Test
  void testOutputAggregateIsConnectedElementWise() throws MonoConnectException {
    var out = top.port("out", Directions.output(new VecSignal(2, ScalarSignal.uint(8))));
    var w = top.wire("w", new VecSignal(2, ScalarSignal.uint(8)));
    monoConnect.connect(out, w, top, ConnectOptions.permissive(), commands);

    Assertions.assertEquals("out[0] <= w[0]\nout[1] <= w[1]", commands.serialize());
  }

  @Test
  void testMixedDirectionRecordFailsOnFlippedField() {
    var io = top.port("io", handshake());
    var childIo = child.port("io", handshake());
    var ex = Assertions.assertThrows(MonoConnectException.class,
                                     () -> monoConnect.connect(io, childIo, top, ConnectOptions.permissive(), commands));

    Assertions.assertEquals(ConnectErrorKind.UNWRITABLE_SINK, ex.getKind());
    Assertions.assertEquals(List.of(".ready"), ex.getError().getPath());
    // valid was connected before ready failed
    Assertions.assertEquals("io.valid <= child.io.valid", commands.serialize());
  }

  @Test
  void testAtomicConnectKeepsNothingOnFailure() {
    var io = top.port("io", handshake());
    var childIo = child.port("io", handshake());
    Assertions.assertThrows(MonoConnectException.class,
                            () -> monoConnect.connectAtomically(io, childIo, top, ConnectOptions.permissive(), commands));
    Assertions.assertTrue(commands.isEmpty());
  }

  @Test
  void testAtomicConnectCommitsOnSuccess() throws MonoConnectException {
    var out = top.port("out", Directions.output(new VecSignal(2, ScalarSignal.uint(8))));
    monoConnect.connectAtomically(out, DontCare.INSTANCE, top, ConnectOptions.permissive(), commands);
    Assertions.assertEquals(2, commands.size());
  }

  @Test
  void testWildcardSinkFails() {
    var w = top.wire("w", ScalarSignal.uint(8));
    var error = monoConnect.tryConnect(DontCare.INSTANCE, w, top, ConnectOptions.permissive(), commands);
    Assertions.assertEquals(ConnectErrorKind.WILDCARD_SINK, error.get().getKind());

    error = monoConnect.tryConnect(DontCare.INSTANCE, DontCare.INSTANCE, top, ConnectOptions.permissive(), commands);
    Assertions.assertEquals(ConnectErrorKind.WILDCARD_SINK, error.get().getKind());
    Assertions.assertTrue(commands.isEmpty());
  }

  @Test
  void testTypeMismatch() {
    var u = top.wire("u", ScalarSignal.uint(8));
    var s = top.wire("s", ScalarSignal.sint(8));
    var error = monoConnect.tryConnect(u, s, top, ConnectOptions.permissive(), commands);
    Assertions.assertEquals(ConnectErrorKind.TYPE_MISMATCH, error.get().getKind());
    Assertions.assertEquals("Sink (UInt<8>) and Source (SInt<8>) have different types.", error.get().getMessage());

    var v = top.wire("v", new VecSignal(2, ScalarSignal.uint(8)));
    error = monoConnect.tryConnect(v, u, top, ConnectOptions.permissive(), commands);
    Assertions.assertEquals(ConnectErrorKind.TYPE_MISMATCH, error.get().getKind());
    Assertions.assertEquals("Sink (UInt<8>[2]) and Source (UInt<8>) have different types.", error.get().getMessage());
  }

  @Test
  void testLiteralSource() throws MonoConnectException {
    var out = top.port("out", Directions.output(ScalarSignal.uint(8)));
    monoConnect.connect(out, ScalarSignal.literal(ScalarKind.UINT, 8, "5"), top, ConnectOptions.permissive(), commands);
    Assertions.assertEquals("out <= UInt<8>(5)", commands.serialize());
  }

  @Test
  void testLiteralSinkIsUnwritable() {
    var w = top.wire("w", ScalarSignal.uint(8));
    var error = monoConnect.tryConnect(ScalarSignal.literal(ScalarKind.UINT, 8, "5"), w, top, ConnectOptions.permissive(), commands);
    Assertions.assertEquals(ConnectErrorKind.UNWRITABLE_SINK, error.get().getKind());
    Assertions.assertEquals("UInt<8>(5) in (unknown) cannot be written from module top.", error.get().getMessage());
  }

  @Test
  void testClosedWhenScope() {
    var scope = new WhenScope("en");
    var out = top.port("out", Directions.output(ScalarSignal.uint(8)));
    var w = top.wire("w", ScalarSignal.uint(8), Optional.of(scope));
    var mem = top.memoryPort("mem", ScalarSignal.uint(8), Optional.of(scope));
    scope.close();

    var error = monoConnect.tryConnect(out, w, top, ConnectOptions.permissive(), commands);
    Assertions.assertEquals(ConnectErrorKind.SOURCE_ESCAPED_SCOPE, error.get().getKind());
    Assertions.assertEquals("Source w in top has escaped the scope of the when in which it was constructed.",
                            error.get().getMessage());
    error = monoConnect.tryConnect(w, out, top, ConnectOptions.permissive(), commands);
    Assertions.assertEquals(ConnectErrorKind.SINK_ESCAPED_SCOPE, error.get().getKind());

    Assertions.assertTrue(monoConnect.tryConnect(out, mem, top, ConnectOptions.permissive(), commands).isEmpty());
    Assertions.assertEquals("out <= mem", commands.serialize());
  }

  @Test
  void testUnboundOperandIsRejected() {
    var out = top.port("out", Directions.output(ScalarSignal.uint(8)));
    Assertions.assertThrows(IllegalArgumentException.class,
                            () -> monoConnect.tryConnect(out, ScalarSignal.uint(8), top, ConnectOptions.permissive(), commands));
  }

  @Test
  void testCustomBulkCheckIsConsulted() throws MonoConnectException {
    var io = child.port("io", Directions.input(new VecSignal(2, ScalarSignal.uint(8))));
    var w = top.wire("w", new VecSignal(2, ScalarSignal.uint(8)));
    new MonoConnect((sink, source, context, options) -> BulkConnectVerdict.ELEMENT_WISE)
        .connect(io, w, top, ConnectOptions.permissive(), commands);
    Assertions.assertEquals("child.io[0] <= w[0]\nchild.io[1] <= w[1]", commands.serialize());
  }
}

package hdlconnect.ir;

import hdlconnect.data.Directions;
import hdlconnect.data.ScalarSignal;
import hdlconnect.hierarchy.HwModule;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CommandLogTest {

  @Test
  void testCommitForwardsInOrder() {
    var top = new HwModule("top");
    var child = top.instantiate("child");
    var in = child.port("in", Directions.input(ScalarSignal.uint(8)));
    var w = top.wire("w", ScalarSignal.uint(8));

    var log = new CommandLog();
    log.pushCommand(new Connect(top, in, w));
    log.pushCommand(new DefInvalid(top, w));
    Assertions.assertEquals("child.in <= w\nw is invalid", log.serialize());

    List<Command> received = new ArrayList<>();
    log.commit(received::add);
    Assertions.assertEquals(List.of(new Connect(top, in, w), new DefInvalid(top, w)), received);
    Assertions.assertTrue(log.isEmpty());
    Assertions.assertEquals("", log.serialize());
  }

  @Test
  void testCommandIdentity() {
    var top = new HwModule("top");
    var a = top.wire("a", ScalarSignal.uint(8));
    var b = top.wire("b", ScalarSignal.uint(8));
    Assertions.assertEquals(new Connect(top, a, b), new Connect(top, a, b));
    Assertions.assertNotEquals(new Connect(top, a, b), new Connect(top, b, a));
    Assertions.assertNotEquals(new DefInvalid(top, a), new DefInvalid(top, b));
    Assertions.assertEquals(new Connect(top, a, b).hashCode(), new Connect(top, a, b).hashCode());
  }
}

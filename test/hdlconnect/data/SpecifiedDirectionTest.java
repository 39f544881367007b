package hdlconnect.data;

import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SpecifiedDirectionTest {

  @Test
  void testFromParent() {
    Assertions.assertEquals(SpecifiedDirection.INPUT, SpecifiedDirection.fromParent(SpecifiedDirection.INPUT, SpecifiedDirection.OUTPUT));
    Assertions.assertEquals(SpecifiedDirection.OUTPUT, SpecifiedDirection.fromParent(SpecifiedDirection.OUTPUT, SpecifiedDirection.FLIP));
    Assertions.assertEquals(SpecifiedDirection.FLIP, SpecifiedDirection.fromParent(SpecifiedDirection.UNSPECIFIED, SpecifiedDirection.FLIP));
    Assertions.assertEquals(SpecifiedDirection.UNSPECIFIED, SpecifiedDirection.fromParent(SpecifiedDirection.FLIP, SpecifiedDirection.FLIP));
    Assertions.assertEquals(SpecifiedDirection.OUTPUT, SpecifiedDirection.fromParent(SpecifiedDirection.FLIP, SpecifiedDirection.INPUT));
  }

  @Test
  void testActualDirectionFromChildren() {
    Assertions.assertEquals(ActualDirection.EMPTY, ActualDirection.fromChildren(Set.of(), SpecifiedDirection.UNSPECIFIED).get());
    Assertions.assertEquals(ActualDirection.INPUT, ActualDirection.fromChildren(Set.of(), SpecifiedDirection.INPUT).get());
    Assertions.assertEquals(ActualDirection.OUTPUT,
                            ActualDirection.fromChildren(EnumSet.of(ActualDirection.OUTPUT), SpecifiedDirection.UNSPECIFIED).get());
    Assertions.assertEquals(ActualDirection.BIDIRECTIONAL,
                            ActualDirection.fromChildren(EnumSet.of(ActualDirection.OUTPUT, ActualDirection.BIDIRECTIONAL),
                                                         SpecifiedDirection.UNSPECIFIED)
                                .get());
    Assertions.assertTrue(
        ActualDirection.fromChildren(EnumSet.of(ActualDirection.UNSPECIFIED, ActualDirection.INPUT), SpecifiedDirection.UNSPECIFIED)
            .isEmpty());
  }
}

package signals.discovery;

import org.junit.jupiter.api.Test;
import signals.Cardinality;
import signals.fixtures.Count;
import signals.fixtures.Label;
import signals.fixtures.Move;
import signals.fixtures.Ping;
import signals.fixtures.Quad;
import signals.fixtures.Vector;
import signals.spi.ListenerDeclaration;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListenerTableTest {

  static class Hud {
    final List<String> calls = new ArrayList<>();

    void onPing() {
      calls.add("ping");
    }

    void onMove(Vector position, float speed) {
      calls.add("move:" + speed);
    }

    void onQuad(String name, int count, double ratio, Object extra) {
      calls.add(name + count + ratio + extra);
    }
  }

  static class SpecialHud extends Hud {
  }

  interface Labelled {
    void onLabel(CharSequence text);
  }

  static class LabelledHud extends Hud implements Labelled {
    @Override
    public void onLabel(CharSequence text) {
      calls.add("label:" + text);
    }
  }

  @Test
  void declaresTypedListeners() throws Exception {
    ListenerTable table = new ListenerTable()
        .declare(Hud.class, Ping.class, Cardinality.EVERY, "onPing", Hud::onPing)
        .declare(Hud.class, Move.class, Cardinality.ONCE, "onMove", Vector.class, float.class, Hud::onMove);

    List<ListenerDeclaration> declarations = table.discover(Hud.class);

    assertEquals(2, declarations.size());
    assertEquals("Hud.onPing", declarations.get(0).name());
    assertEquals(List.of(Vector.class, float.class), declarations.get(1).parameterTypes());
    assertEquals(Cardinality.ONCE, declarations.get(1).cardinality());

    Hud hud = new Hud();
    declarations.get(0).invoker().invoke(hud, new Object[0]);
    declarations.get(1).invoker().invoke(hud, new Object[] {new Vector(0, 0), 1.5f});
    assertEquals(List.of("ping", "move:1.5"), hud.calls);
  }

  @Test
  void supportsFourParameters() throws Exception {
    ListenerTable table = new ListenerTable()
        .declare(Hud.class, Quad.class, Cardinality.EVERY, "onQuad",
            String.class, int.class, double.class, Object.class, Hud::onQuad);
    Hud hud = new Hud();

    table.discover(Hud.class).get(0).invoker().invoke(hud, new Object[] {"q", 2, 0.5, "x"});

    assertEquals(List.of("q20.5x"), hud.calls);
  }

  @Test
  void declaresListenerOfAnyArityWithInvoker() throws Exception {
    List<Object[]> received = new ArrayList<>();
    ListenerTable table = new ListenerTable()
        .declare(Hud.class, Count.class, Cardinality.EVERY, "onCount", List.of(int.class),
            (owner, args) -> received.add(args));

    table.discover(Hud.class).get(0).invoker().invoke(new Hud(), new Object[] {4});

    assertEquals(1, received.size());
    assertEquals(4, received.get(0)[0]);
  }

  @Test
  void subtypesInheritDeclarations() {
    ListenerTable table = new ListenerTable()
        .declare(Hud.class, Ping.class, Cardinality.EVERY, "onPing", Hud::onPing)
        .declare(Labelled.class, Label.class, Cardinality.EVERY, "onLabel",
            CharSequence.class, Labelled::onLabel);

    assertEquals(1, table.discover(SpecialHud.class).size());
    assertEquals(2, table.discover(LabelledHud.class).size());
    assertTrue(table.discover(String.class).isEmpty());
  }

  @Test
  void rejectsDuplicateNameForSameType() {
    ListenerTable table = new ListenerTable()
        .declare(Hud.class, Ping.class, Cardinality.EVERY, "onPing", Hud::onPing);

    assertThrows(IllegalArgumentException.class,
        () -> table.declare(Hud.class, Ping.class, Cardinality.ONCE, "onPing", Hud::onPing));
    assertEquals(1, table.discover(Hud.class).size());
  }

  @Test
  void rejectsEmptyName() {
    assertThrows(IllegalArgumentException.class,
        () -> new ListenerTable().declare(Hud.class, Ping.class, Cardinality.EVERY, "", Hud::onPing));
  }

  @Test
  void compositeConcatenatesInOrder() {
    ListenerTable first = new ListenerTable()
        .declare(Hud.class, Ping.class, Cardinality.EVERY, "onPing", Hud::onPing);
    ListenerTable second = new ListenerTable()
        .declare(Hud.class, Move.class, Cardinality.EVERY, "onMove", Vector.class, float.class, Hud::onMove);

    List<ListenerDeclaration> declarations = CompositeListenerDiscovery.of(first, second).discover(Hud.class);

    assertEquals(List.of("Hud.onPing", "Hud.onMove"),
        List.of(declarations.get(0).name(), declarations.get(1).name()));
  }
}

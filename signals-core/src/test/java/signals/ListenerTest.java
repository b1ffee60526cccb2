package signals;

import org.junit.jupiter.api.Test;
import signals.fixtures.Ping;
import signals.spi.ListenerDeclaration;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListenerTest {

  private static ListenerDeclaration declaration(String name, ListenerDeclaration.Invoker invoker) {
    return new ListenerDeclaration(Ping.class, Cardinality.EVERY, name, List.of(), invoker);
  }

  @Test
  void equalityIsOwnerIdentityPlusName() {
    Object owner = new Object();
    Listener a = new Listener(owner, declaration("onPing", (o, args) -> { }));
    Listener b = new Listener(owner, declaration("onPing", (o, args) -> { }));
    Listener other = new Listener(new Object(), declaration("onPing", (o, args) -> { }));
    Listener renamed = new Listener(owner, declaration("onOther", (o, args) -> { }));

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, other);
    assertNotEquals(a, renamed);
  }

  @Test
  void equalOwnersByValueAreStillDistinct() {
    Listener a = new Listener("owner", declaration("onPing", (o, args) -> { }));
    Listener b = new Listener(new String("owner"), declaration("onPing", (o, args) -> { }));

    assertNotEquals(a, b);
  }

  @Test
  void uncheckedExceptionPropagatesUnchanged() {
    IllegalStateException thrown = new IllegalStateException("bug");
    Listener listener = new Listener(new Object(), declaration("onPing", (o, args) -> {
      throw thrown;
    }));

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> listener.invoke(new Object[0]));
    assertSame(thrown, ex);
  }

  @Test
  void errorPropagatesUnchanged() {
    Listener listener = new Listener(new Object(), declaration("onPing", (o, args) -> {
      throw new AssertionError("assert");
    }));

    assertThrows(AssertionError.class, () -> listener.invoke(new Object[0]));
  }

  @Test
  void checkedExceptionIsWrappedOnce() {
    IOException thrown = new IOException("disk");
    Listener listener = new Listener(new Object(), declaration("onPing", (o, args) -> {
      throw thrown;
    }));

    ListenerInvocationException ex = assertThrows(ListenerInvocationException.class,
        () -> listener.invoke(new Object[0]));

    assertSame(thrown, ex.getCause());
    assertSame(listener, ex.listener());
    assertFalse(SignalException.class.isInstance(ex));
  }

  @Test
  void declarationRejectsEmptyName() {
    assertThrows(IllegalArgumentException.class, () -> declaration("", (o, args) -> { }));
  }
}

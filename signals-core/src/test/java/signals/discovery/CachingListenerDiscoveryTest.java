package signals.discovery;

import org.junit.jupiter.api.Test;
import signals.SignalException;
import signals.spi.ListenerDeclaration;
import signals.spi.ListenerDiscovery;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CachingListenerDiscoveryTest {

  @Test
  void discoversEachTypeOnce() {
    AtomicInteger calls = new AtomicInteger();
    CachingListenerDiscovery caching = new CachingListenerDiscovery(type -> {
      calls.incrementAndGet();
      return List.of();
    });

    List<ListenerDeclaration> first = caching.discover(String.class);
    List<ListenerDeclaration> second = caching.discover(String.class);
    caching.discover(Integer.class);

    assertSame(first, second);
    assertEquals(2, calls.get());
    assertEquals(2, caching.cachedTypes());
  }

  @Test
  void failuresAreNotCached() {
    AtomicInteger calls = new AtomicInteger();
    CachingListenerDiscovery caching = new CachingListenerDiscovery(type -> {
      if (calls.incrementAndGet() == 1) {
        throw new SignalException("first attempt fails");
      }
      return List.of();
    });

    assertThrows(SignalException.class, () -> caching.discover(String.class));
    assertTrue(caching.discover(String.class).isEmpty());
    assertEquals(2, calls.get());
  }

  @Test
  void clearForgetsCachedTypes() {
    CachingListenerDiscovery caching = new CachingListenerDiscovery(new AnnotatedListenerDiscovery());
    caching.discover(String.class);

    caching.clear();

    assertEquals(0, caching.cachedTypes());
  }

  @Test
  void ofDoesNotWrapTwice() {
    ListenerDiscovery plain = new AnnotatedListenerDiscovery();
    CachingListenerDiscovery caching = CachingListenerDiscovery.of(plain);

    assertSame(caching, CachingListenerDiscovery.of(caching));
    assertSame(plain, caching.delegate());
  }
}

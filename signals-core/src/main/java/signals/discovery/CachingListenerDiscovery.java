package signals.discovery;

import signals.spi.ListenerDeclaration;
import signals.spi.ListenerDiscovery;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizes another discovery per concrete owner type.
 *
 * <p>Failed discoveries are not cached; the next bind of the same type retries.
 */
public final class CachingListenerDiscovery implements ListenerDiscovery {

  private final ListenerDiscovery delegate;
  private final Map<Class<?>, List<ListenerDeclaration>> cache = new ConcurrentHashMap<>();

  public CachingListenerDiscovery(ListenerDiscovery delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  /**
   * Wraps a discovery unless it is already caching.
   */
  public static CachingListenerDiscovery of(ListenerDiscovery discovery) {
    if (discovery instanceof CachingListenerDiscovery) {
      return (CachingListenerDiscovery) discovery;
    }
    return new CachingListenerDiscovery(discovery);
  }

  @Override
  public List<ListenerDeclaration> discover(Class<?> ownerType) {
    Objects.requireNonNull(ownerType, "ownerType");
    List<ListenerDeclaration> cached = cache.get(ownerType);
    if (cached != null) {
      return cached;
    }
    List<ListenerDeclaration> declarations = List.copyOf(delegate.discover(ownerType));
    List<ListenerDeclaration> raced = cache.putIfAbsent(ownerType, declarations);
    return raced != null ? raced : declarations;
  }

  /**
   * @return number of owner types memoized
   */
  public int cachedTypes() {
    return cache.size();
  }

  public void clear() {
    cache.clear();
  }

  public ListenerDiscovery delegate() {
    return delegate;
  }
}

package signals.discovery;

import signals.Signal;
import signals.SignalException;
import signals.spi.SignalTypeScanner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads signal types from {@code META-INF/services/signals.Signal} files on the class path.
 *
 * <p>The files use the {@link java.util.ServiceLoader} provider-configuration format: one fully
 * qualified class name per line, {@code #} starts a comment. Classes are loaded without being
 * initialized, and unlike {@code ServiceLoader} they need not be public.
 */
public final class ServiceLoaderSignalTypeScanner implements SignalTypeScanner {
  private static final Logger logger = Logger.getLogger(ServiceLoaderSignalTypeScanner.class.getName());

  static final String RESOURCE = "META-INF/services/" + Signal.class.getName();

  private final ClassLoader classLoader;

  public ServiceLoaderSignalTypeScanner() {
    this(Thread.currentThread().getContextClassLoader());
  }

  public ServiceLoaderSignalTypeScanner(ClassLoader classLoader) {
    this.classLoader = classLoader != null ? classLoader : ServiceLoaderSignalTypeScanner.class.getClassLoader();
  }

  @Override
  public Set<Class<? extends Signal>> scan() {
    Set<Class<? extends Signal>> types = new LinkedHashSet<>();
    try {
      Enumeration<URL> resources = classLoader.getResources(RESOURCE);
      while (resources.hasMoreElements()) {
        URL url = resources.nextElement();
        logger.log(Level.FINE, "Reading signal types from {0}", url);
        read(url, types);
      }
    } catch (IOException e) {
      throw new SignalException("Failed to read " + RESOURCE, e);
    }
    return Collections.unmodifiableSet(types);
  }

  private void read(URL url, Set<Class<? extends Signal>> types) throws IOException {
    try (BufferedReader reader = new BufferedReader(
        new InputStreamReader(url.openStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        int comment = line.indexOf('#');
        String name = (comment >= 0 ? line.substring(0, comment) : line).trim();
        if (!name.isEmpty()) {
          types.add(load(name, url));
        }
      }
    }
  }

  private Class<? extends Signal> load(String name, URL source) {
    Class<?> type;
    try {
      type = Class.forName(name, false, classLoader);
    } catch (ClassNotFoundException | LinkageError e) {
      throw new SignalException("Signal type " + name + " listed in " + source + " cannot be loaded", e);
    }
    if (!Signal.class.isAssignableFrom(type)) {
      throw new SignalException(name + " listed in " + source + " does not extend " + Signal.class.getName());
    }
    return type.asSubclass(Signal.class);
  }
}

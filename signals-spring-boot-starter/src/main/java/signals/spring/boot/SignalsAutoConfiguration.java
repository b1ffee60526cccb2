package signals.spring.boot;

import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackages;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.ClassUtils;
import signals.Signal;
import signals.discovery.AnnotatedListenerDiscovery;
import signals.dispatch.SignalDispatcher;
import signals.registry.SignalRegistry;
import signals.spi.ListenerDiscovery;
import signals.spi.LivenessOracle;
import signals.spi.MetricsExporter;
import signals.spi.SignalTypeScanner;

import java.util.ArrayList;
import java.util.List;

/**
 * Auto-configuration for the signal dispatcher.
 *
 * <p>Builds a {@link SignalRegistry} in the mode selected by {@code signals.mode}, installs it in
 * a {@link SignalDispatcher}, and binds singleton beans that declare
 * {@link signals.ListenTo @ListenTo} methods. Every bean backs off when the application defines
 * its own.
 *
 * @see SignalsProperties
 * @see SignalsMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(SignalDispatcher.class)
@EnableConfigurationProperties(SignalsProperties.class)
public class SignalsAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public SignalTypeScanner signalTypeScanner(SignalsProperties props, BeanFactory beanFactory) {
    List<String> packages = props.getScanPackages();
    if (packages.isEmpty() && AutoConfigurationPackages.has(beanFactory)) {
      packages = AutoConfigurationPackages.get(beanFactory);
    }
    return new ClasspathSignalTypeScanner(packages, beanClassLoader(beanFactory));
  }

  @Bean
  @ConditionalOnMissingBean
  public SignalRegistry signalRegistry(SignalsProperties props, SignalTypeScanner scanner, BeanFactory beanFactory) {
    return switch (props.getMode()) {
      case DISCOVERED -> SignalRegistry.discover(scanner);
      case CURATED -> SignalRegistry.curated(resolveSignalTypes(props.getSignalTypes(), beanClassLoader(beanFactory)));
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public LivenessOracle livenessOracle() {
    return LivenessOracle.disposable();
  }

  @Bean
  @ConditionalOnMissingBean
  public ListenerDiscovery listenerDiscovery() {
    return new AnnotatedListenerDiscovery();
  }

  @Bean
  @ConditionalOnMissingBean
  public SignalDispatcher signalDispatcher(SignalRegistry registry,
      SignalTypeScanner scanner,
      LivenessOracle livenessOracle,
      ListenerDiscovery listenerDiscovery,
      ObjectProvider<MetricsExporter> metricsProvider) {
    SignalDispatcher dispatcher = SignalDispatcher.builder()
        .signalTypeScanner(scanner)
        .livenessOracle(livenessOracle)
        .listenerDiscovery(listenerDiscovery)
        .metrics(metricsProvider.getIfAvailable())
        .build();
    dispatcher.registerSignalTypes(registry);
    return dispatcher;
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "signals", name = "bind-beans", matchIfMissing = true)
  public SignalListenerRegistrar signalListenerRegistrar(ListableBeanFactory beanFactory, SignalDispatcher dispatcher) {
    return new SignalListenerRegistrar(beanFactory, dispatcher);
  }

  private static ClassLoader beanClassLoader(BeanFactory beanFactory) {
    if (beanFactory instanceof ConfigurableBeanFactory configurable) {
      return configurable.getBeanClassLoader();
    }
    return ClassUtils.getDefaultClassLoader();
  }

  private static List<Class<? extends Signal>> resolveSignalTypes(List<String> names, ClassLoader classLoader) {
    if (names.isEmpty()) {
      throw new IllegalStateException("signals.signal-types must list at least one signal type in CURATED mode");
    }
    List<Class<? extends Signal>> types = new ArrayList<>(names.size());
    for (String name : names) {
      Class<?> type;
      try {
        type = ClassUtils.forName(name.trim(), classLoader);
      } catch (ClassNotFoundException | LinkageError e) {
        throw new IllegalStateException("signals.signal-types entry '" + name + "' cannot be loaded", e);
      }
      if (!Signal.class.isAssignableFrom(type)) {
        throw new IllegalStateException("signals.signal-types entry '" + name + "' does not extend "
            + Signal.class.getName());
      }
      types.add(type.asSubclass(Signal.class));
    }
    return types;
  }
}

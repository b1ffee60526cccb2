package signals.spring.boot;

import org.springframework.beans.factory.annotation.AnnotatedBeanDefinition;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.type.filter.AssignableTypeFilter;
import org.springframework.util.ClassUtils;
import signals.Signal;
import signals.SignalException;
import signals.spi.SignalTypeScanner;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds {@link Signal} subclasses under a set of base packages by reading class files, without
 * loading classes that are not signals.
 *
 * <p>Top-level and static nested classes are reported, abstract ones included; the registry
 * filters those out.
 */
public class ClasspathSignalTypeScanner implements SignalTypeScanner {

    private static final Logger logger = Logger.getLogger(ClasspathSignalTypeScanner.class.getName());

    private final List<String> basePackages;
    private final ClassLoader classLoader;

    public ClasspathSignalTypeScanner(List<String> basePackages, ClassLoader classLoader) {
        this.basePackages = List.copyOf(Objects.requireNonNull(basePackages, "basePackages"));
        this.classLoader = classLoader != null ? classLoader : ClassUtils.getDefaultClassLoader();
    }

    public List<String> basePackages() {
        return basePackages;
    }

    @Override
    public Set<Class<? extends Signal>> scan() {
        if (basePackages.isEmpty()) {
            logger.warning("No base packages to scan for signal types; set signals.scan-packages");
            return Set.of();
        }
        ClassPathScanningCandidateComponentProvider provider = new ClassPathScanningCandidateComponentProvider(false) {
            @Override
            protected boolean isCandidateComponent(AnnotatedBeanDefinition beanDefinition) {
                return beanDefinition.getMetadata().isIndependent();
            }
        };
        provider.addIncludeFilter(new AssignableTypeFilter(Signal.class));

        Set<Class<? extends Signal>> types = new LinkedHashSet<>();
        for (String basePackage : basePackages) {
            for (BeanDefinition candidate : provider.findCandidateComponents(basePackage)) {
                types.add(load(candidate.getBeanClassName()));
            }
        }
        logger.log(Level.FINE, "Found {0} signal type(s) under {1}", new Object[] {types.size(), basePackages});
        return Collections.unmodifiableSet(types);
    }

    private Class<? extends Signal> load(String className) {
        try {
            return ClassUtils.forName(className, classLoader).asSubclass(Signal.class);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new SignalException("Signal type " + className + " cannot be loaded", e);
        }
    }
}

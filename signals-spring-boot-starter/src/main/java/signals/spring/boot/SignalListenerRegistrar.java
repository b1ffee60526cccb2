package signals.spring.boot;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;
import signals.ListenTo;
import signals.SignalException;
import signals.dispatch.SignalDispatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Binds singleton beans that declare listeners to the {@link SignalDispatcher}, and unbinds them
 * when the context shuts down.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 * Beans are unbound in reverse binding order.
 *
 * @see ListenTo
 */
public class SignalListenerRegistrar implements SmartInitializingSingleton, DisposableBean {

    private static final Logger logger = Logger.getLogger(SignalListenerRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final SignalDispatcher dispatcher;
    private final List<Object> bound = new ArrayList<>();

    public SignalListenerRegistrar(ListableBeanFactory beanFactory, SignalDispatcher dispatcher) {
        this.beanFactory = beanFactory;
        this.dispatcher = dispatcher;
    }

    @Override
    public void afterSingletonsInstantiated() {
        for (String beanName : beanFactory.getBeanNamesForType(Object.class, false, false)) {
            Class<?> type = beanFactory.getType(beanName, false);
            if (type == null || !declaresListeners(beanName, type)) {
                continue;
            }
            Object bean = beanFactory.getBean(beanName);
            try {
                dispatcher.bind(bean);
            } catch (SignalException e) {
                throw new BeanCreationException(beanName,
                        "Failed to bind signal listeners of " + bean.getClass().getName(), e);
            }
            if (dispatcher.isBound(bean)) {
                bound.add(bean);
                logger.log(Level.FINE, "Bound signal listeners of bean ''{0}''", beanName);
            }
        }
    }

    /**
     * @return beans bound by this registrar, in binding order
     */
    public List<Object> boundBeans() {
        return Collections.unmodifiableList(bound);
    }

    @Override
    public void destroy() {
        for (int i = bound.size() - 1; i >= 0; i--) {
            dispatcher.unbind(bound.get(i));
        }
        bound.clear();
    }

    private boolean declaresListeners(String beanName, Class<?> type) {
        if (!AnnotationUtils.isCandidateClass(type, ListenTo.class)) {
            return false;
        }
        try {
            return dispatcher.declaresListeners(type);
        } catch (LinkageError e) {
            // a method signature references a class missing from the class path
            logger.log(Level.FINE, "Skipping bean ''" + beanName + "'': cannot introspect " + type.getName(), e);
            return false;
        } catch (SignalException e) {
            throw new BeanCreationException(beanName, "Invalid signal listener declaration on " + type.getName(), e);
        }
    }
}

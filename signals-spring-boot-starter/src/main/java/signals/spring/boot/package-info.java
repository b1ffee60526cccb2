/**
 * Spring Boot auto-configuration for the signal dispatcher.
 *
 * <p>{@link signals.spring.boot.SignalsAutoConfiguration} builds a
 * {@link signals.dispatch.SignalDispatcher} from {@code signals.*} application properties and
 * binds beans whose methods carry {@link signals.ListenTo @ListenTo}.
 *
 * @see signals.spring.boot.SignalsAutoConfiguration
 * @see signals.spring.boot.SignalsProperties
 * @see signals.spring.boot.SignalListenerRegistrar
 */
package signals.spring.boot;

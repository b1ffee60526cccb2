package signals.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import signals.registry.SignalRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the signal dispatcher.
 *
 * @see SignalsAutoConfiguration
 */
@ConfigurationProperties(prefix = "signals")
public class SignalsProperties {

    /**
     * How the signal registry is populated: discovered from the class path, or curated from
     * {@code signals.signal-types}.
     */
    private SignalRegistry.Mode mode = SignalRegistry.Mode.DISCOVERED;

    /**
     * Base packages scanned for signal types in discovered mode. Defaults to the application's
     * auto-configuration packages.
     */
    private List<String> scanPackages = new ArrayList<>();

    /**
     * Fully qualified signal class names registered in curated mode.
     */
    private List<String> signalTypes = new ArrayList<>();

    /**
     * Whether singleton beans declaring listeners are bound automatically.
     */
    private boolean bindBeans = true;

    private final Metrics metrics = new Metrics();

    public SignalRegistry.Mode getMode() {
        return mode;
    }

    public void setMode(SignalRegistry.Mode mode) {
        this.mode = mode;
    }

    public List<String> getScanPackages() {
        return scanPackages;
    }

    public void setScanPackages(List<String> scanPackages) {
        this.scanPackages = scanPackages;
    }

    public List<String> getSignalTypes() {
        return signalTypes;
    }

    public void setSignalTypes(List<String> signalTypes) {
        this.signalTypes = signalTypes;
    }

    public boolean isBindBeans() {
        return bindBeans;
    }

    public void setBindBeans(boolean bindBeans) {
        this.bindBeans = bindBeans;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "signals";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}

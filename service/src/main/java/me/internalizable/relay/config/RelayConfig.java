package me.internalizable.relay.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration for the Relay change-feed service.
 */
public class RelayConfig {

    // Delivery
    private long defaultDebounceMs = 500;
    private long gracePeriodMs = 5000;

    // Reconnect backoff
    private long retryInitialDelayMs = 2000;
    private long retryMaxDelayMs = 30_000;
    private double retryMultiplier = 2.0;
    private int maxRetryAttempts = 0;
    private int channelTimeoutSeconds = 10;

    // Debug options
    private boolean debugLogging = false;

    // Redis transport
    private boolean redisEnabled = false;
    private String redisHost = "localhost";
    private int redisPort = 6379;
    private String redisPassword = null;
    private boolean redisSsl = false;
    private int redisDatabase = 0;
    private String redisChannelPrefix = "relay:changes:";

    // ==================== Load / Save ====================

    public static RelayConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            RelayConfig config = new RelayConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(RelayConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            RelayConfig config = yaml.load(is);
            return config != null ? config : new RelayConfig();
        }
    }

    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumperOptions.setPrettyFlow(true);
        dumperOptions.setIndent(2);

        Representer representer = new Representer(dumperOptions) {
            @Override
            protected NodeTuple representJavaBeanProperty(Object javaBean, Property property,
                                                          Object propertyValue, Tag customTag) {
                if (propertyValue == null) {
                    return null;
                }
                return super.representJavaBeanProperty(javaBean, property, propertyValue, customTag);
            }

            @Override
            protected Set<Property> getProperties(Class<? extends Object> type) {
                Set<Property> props = super.getProperties(type);
                if (type == RelayConfig.class) {
                    return orderProperties(props,
                        "defaultDebounceMs", "gracePeriodMs",
                        "retryInitialDelayMs", "retryMaxDelayMs", "retryMultiplier",
                        "maxRetryAttempts", "channelTimeoutSeconds",
                        "debugLogging",
                        "redisEnabled", "redisHost", "redisPort", "redisPassword",
                        "redisSsl", "redisDatabase", "redisChannelPrefix"
                    );
                }
                return props;
            }

            private Set<Property> orderProperties(Set<Property> props, String... order) {
                Set<Property> ordered = new LinkedHashSet<>();
                for (String name : order) {
                    for (Property p : props) {
                        if (p.getName().equals(name)) {
                            ordered.add(p);
                            break;
                        }
                    }
                }
                for (Property p : props) {
                    if (!ordered.contains(p)) {
                        ordered.add(p);
                    }
                }
                return ordered;
            }
        };

        representer.addClassTag(RelayConfig.class, Tag.MAP);

        Yaml yaml = new Yaml(representer, dumperOptions);

        try (Writer writer = Files.newBufferedWriter(path)) {
            writer.write("# Relay Change Feed Configuration\n\n");
            yaml.dump(this, writer);
        }
    }

    // ==================== Delivery Getters/Setters ====================

    public long getDefaultDebounceMs() { return defaultDebounceMs; }
    public void setDefaultDebounceMs(long defaultDebounceMs) { this.defaultDebounceMs = defaultDebounceMs; }

    public long getGracePeriodMs() { return gracePeriodMs; }
    public void setGracePeriodMs(long gracePeriodMs) { this.gracePeriodMs = gracePeriodMs; }

    // ==================== Retry Getters/Setters ====================

    public long getRetryInitialDelayMs() { return retryInitialDelayMs; }
    public void setRetryInitialDelayMs(long retryInitialDelayMs) { this.retryInitialDelayMs = retryInitialDelayMs; }

    public long getRetryMaxDelayMs() { return retryMaxDelayMs; }
    public void setRetryMaxDelayMs(long retryMaxDelayMs) { this.retryMaxDelayMs = retryMaxDelayMs; }

    public double getRetryMultiplier() { return retryMultiplier; }
    public void setRetryMultiplier(double retryMultiplier) { this.retryMultiplier = retryMultiplier; }

    public int getMaxRetryAttempts() { return maxRetryAttempts; }
    public void setMaxRetryAttempts(int maxRetryAttempts) { this.maxRetryAttempts = maxRetryAttempts; }

    public int getChannelTimeoutSeconds() { return channelTimeoutSeconds; }
    public void setChannelTimeoutSeconds(int channelTimeoutSeconds) { this.channelTimeoutSeconds = channelTimeoutSeconds; }

    // ==================== Debug Getters/Setters ====================

    public boolean isDebugLogging() { return debugLogging; }
    public void setDebugLogging(boolean debugLogging) { this.debugLogging = debugLogging; }

    // ==================== Redis Getters/Setters ====================

    public boolean isRedisEnabled() { return redisEnabled; }
    public void setRedisEnabled(boolean redisEnabled) { this.redisEnabled = redisEnabled; }

    public String getRedisHost() { return redisHost; }
    public void setRedisHost(String redisHost) { this.redisHost = redisHost; }

    public int getRedisPort() { return redisPort; }
    public void setRedisPort(int redisPort) { this.redisPort = redisPort; }

    public String getRedisPassword() { return redisPassword; }
    public void setRedisPassword(String redisPassword) { this.redisPassword = redisPassword; }

    public boolean isRedisSsl() { return redisSsl; }
    public void setRedisSsl(boolean redisSsl) { this.redisSsl = redisSsl; }

    public int getRedisDatabase() { return redisDatabase; }
    public void setRedisDatabase(int redisDatabase) { this.redisDatabase = redisDatabase; }

    public String getRedisChannelPrefix() { return redisChannelPrefix; }
    public void setRedisChannelPrefix(String redisChannelPrefix) { this.redisChannelPrefix = redisChannelPrefix; }
}

package com.amqpmock.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Settings applied to a {@code MockBroker} before use.
 * Defaults are overridden by environment variables, then by an explicit properties bag.
 */
public class BrokerConfig {
    private static final Logger logger = LoggerFactory.getLogger(BrokerConfig.class);

    public static final String DEFAULT_EXCHANGE = "amq.direct";

    static final String ENV_CONNECTABLE = "AMQP_MOCK_CONNECTABLE";
    static final String ENV_DEBUG = "AMQP_MOCK_DEBUG";
    static final String ENV_DEFAULT_EXCHANGE = "AMQP_MOCK_DEFAULT_EXCHANGE";

    static final String PROP_CONNECTABLE = "connectable";
    static final String PROP_DEBUG = "debug";
    static final String PROP_DEFAULT_EXCHANGE = "default.exchange";

    private boolean connectable = true;
    private boolean debug = false;
    private String defaultExchange = DEFAULT_EXCHANGE;

    public BrokerConfig() {
        this(System.getenv());
    }

    BrokerConfig(Map<String, String> env) {
        loadFromEnvironment(env);
    }

    /**
     * Load a config from a classpath resource. A missing resource leaves the defaults in place.
     */
    public static BrokerConfig fromResource(String resourceName) {
        BrokerConfig config = new BrokerConfig();
        try (InputStream in = BrokerConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                logger.debug("Config resource {} not found, using defaults", resourceName);
                return config;
            }
            Properties properties = new Properties();
            properties.load(in);
            config.loadFromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config resource " + resourceName, e);
        }
        return config;
    }

    private void loadFromEnvironment(Map<String, String> env) {
        if (env.containsKey(ENV_CONNECTABLE)) {
            connectable = Boolean.parseBoolean(env.get(ENV_CONNECTABLE));
        }
        if (env.containsKey(ENV_DEBUG)) {
            debug = Boolean.parseBoolean(env.get(ENV_DEBUG));
        }
        if (env.containsKey(ENV_DEFAULT_EXCHANGE)) {
            defaultExchange = env.get(ENV_DEFAULT_EXCHANGE);
        }
    }

    public void loadFromProperties(Properties properties) {
        if (properties.containsKey(PROP_CONNECTABLE)) {
            connectable = Boolean.parseBoolean(properties.getProperty(PROP_CONNECTABLE).trim());
        }
        if (properties.containsKey(PROP_DEBUG)) {
            debug = Boolean.parseBoolean(properties.getProperty(PROP_DEBUG).trim());
        }
        if (properties.containsKey(PROP_DEFAULT_EXCHANGE)) {
            defaultExchange = properties.getProperty(PROP_DEFAULT_EXCHANGE).trim();
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("connectable", connectable);
        map.put("debug", debug);
        map.put("defaultExchange", defaultExchange);
        return map;
    }

    public boolean isConnectable() {
        return connectable;
    }

    public void setConnectable(boolean connectable) {
        this.connectable = connectable;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public String getDefaultExchange() {
        return defaultExchange;
    }

    public void setDefaultExchange(String defaultExchange) {
        this.defaultExchange = defaultExchange;
    }

    @Override
    public String toString() {
        return String.format("BrokerConfig{connectable=%s, debug=%s, defaultExchange='%s'}",
                           connectable, debug, defaultExchange);
    }
}

package com.conveyal.supplycurve;

import com.conveyal.supplycurve.error.SupplyCurveInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.Reader;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for classes that load properties containing configuration information and expose these options
 * via the Config interfaces of the components that use them.
 *
 * Input and output locations are required. Tuning options fall back to documented defaults when absent, but a value
 * that is present and cannot be parsed is always an error.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String PROPERTY_PREFIX = "supply-curve-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to load config from the given properties, overriding from environment variables and system properties.
     * In the latter two sources, the keys may be in upper or lower case and use dashes, underscores, or dots as
     * separators, and must be prefixed with "supply-curve", e.g. SUPPLY_CURVE_WORKER_COUNT=4 or
     * java -Dsupply.curve.worker.count=4.
     * Precedence of configuration sources is: system properties > environment variables > config file.
     */
    protected ConfigBase (Properties properties) {
        this(properties, System.getenv(), System.getProperties());
    }

    protected ConfigBase (Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
        setPropertiesFromMap(environment, "environment variable");
        setPropertiesFromMap(systemProperties, "system properties");
    }

    /** Static convenience method to uniformly load files into properties and catch errors. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (Exception e) {
            throw new SupplyCurveInputException("Could not load configuration properties from " + filename, e);
        }
    }

    // Always use the following *Prop methods to read properties. This will catch and log missing keys or parse
    // exceptions, allowing config loading to continue and reporting as many problems as possible at once.

    /** Catches and records missing values, so wrapping methods can just ignore null values. */
    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value;
    }

    /** @return the trimmed value of an optional key, or defaultValue if it is absent or blank. */
    protected String strProp (String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }

    protected int intProp (String key, int defaultValue) {
        String val = strProp(key, null);
        if (val != null) {
            try {
                return Integer.parseInt(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return defaultValue;
    }

    /** Record a value that was present but could not be interpreted. */
    protected void invalidProp (String key, String value, String problem) {
        LOG.error("Value of configuration option '{}' is invalid ({}): {}", key, problem, value);
        keysWithErrors.add(key);
    }

    /** Call this after reading all properties to report every missing or invalid option at once. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw new SupplyCurveInputException("Missing or invalid configuration properties: " +
                    String.join(", ", keysWithErrors));
        }
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties
     * (e.g. supplied on the JVM command line). Case and separators are normalized to conform to both properties and
     * environment variable conventions. Properties are Object-Object Maps so key and value are cast to String.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = ((String) entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = ((String) entry.getValue());
            if (key.startsWith(PROPERTY_PREFIX)) {
                key = key.substring(PROPERTY_PREFIX.length());
                if (properties.getProperty(key) != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}

package io.github.jaggr.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import static java.lang.String.format;

/**
 * Engine settings. Values come from {@code jaggr.properties} on the classpath, JVM system
 * properties with the same keys take precedence, e.g.
 * {@code java -Djaggr.stream.check.order=false ...}
 */
public class AggrConfig {
    private static final Logger logger = LoggerFactory.getLogger(AggrConfig.class);

    public static final String RESOURCE = "jaggr.properties";

    public static final String HASH_INITIAL_CAPACITY = "jaggr.hash.initial.capacity";
    public static final String HASH_WARN_GROUPS = "jaggr.hash.warn.groups";
    public static final String STREAM_CHECK_ORDER = "jaggr.stream.check.order";
    public static final String HLL_PRECISION = "jaggr.hll.precision";
    public static final String DECIMAL_MAX_PRECISION = "jaggr.decimal.max.precision";
    public static final String AVG_DIV_PRECISION_INCREMENT = "jaggr.avg.div.precision.increment";

    private static volatile AggrConfig loaded;

    private final int hashInitialCapacity;
    private final long hashWarnGroups;
    private final boolean streamCheckOrder;
    private final int hllPrecision;
    private final int decimalMaxPrecision;
    private final int avgDivPrecisionIncrement;

    private AggrConfig(Properties properties) {
        hashInitialCapacity = intValue(properties, HASH_INITIAL_CAPACITY, 1024, 1, 1 << 30);
        hashWarnGroups = longValue(properties, HASH_WARN_GROUPS, 1_000_000L, 1L, Long.MAX_VALUE);
        streamCheckOrder = Boolean.parseBoolean(properties.getProperty(STREAM_CHECK_ORDER, "true").trim());
        hllPrecision = intValue(properties, HLL_PRECISION, 12, 4, 18);
        decimalMaxPrecision = intValue(properties, DECIMAL_MAX_PRECISION, 65, 1, 1000);
        avgDivPrecisionIncrement = intValue(properties, AVG_DIV_PRECISION_INCREMENT, 4, 0, 30);
    }

    /**
     * @return the built-in defaults, ignoring the classpath file and system properties
     */
    public static AggrConfig defaults() {
        return new AggrConfig(new Properties());
    }

    public static AggrConfig fromProperties(Properties properties) {
        return new AggrConfig(properties);
    }

    /**
     * @return the process wide configuration, read once
     */
    public static AggrConfig get() {
        if (null == loaded) {
            synchronized (AggrConfig.class) {
                if (null == loaded) {
                    loaded = load();
                }
            }
        }
        return loaded;
    }

    static AggrConfig load() {
        Properties properties = new Properties();
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (null == classLoader) {
            classLoader = AggrConfig.class.getClassLoader();
        }
        try (InputStream inputStream = classLoader.getResourceAsStream(RESOURCE)) {
            if (null != inputStream) {
                properties.load(inputStream);
            } else {
                logger.debug("no {} on classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalStateException(format("failed to read %s", RESOURCE), e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("jaggr.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        AggrConfig config = new AggrConfig(properties);
        logger.info("loaded {}", config);
        return config;
    }

    private static int intValue(Properties properties, String key, int defaultValue, int min, int max) {
        return (int) longValue(properties, key, defaultValue, min, max);
    }

    private static long longValue(Properties properties, String key, long defaultValue, long min, long max) {
        String value = properties.getProperty(key);
        if (null == value) {
            return defaultValue;
        }
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(format("%s=%s is not a number", key, value), e);
        }
        if (parsed < min || parsed > max) {
            throw new IllegalArgumentException(format("%s=%d out of range [%d, %d]", key, parsed, min, max));
        }
        return parsed;
    }

    public int getHashInitialCapacity() {
        return hashInitialCapacity;
    }

    public long getHashWarnGroups() {
        return hashWarnGroups;
    }

    public boolean isStreamCheckOrder() {
        return streamCheckOrder;
    }

    public int getHllPrecision() {
        return hllPrecision;
    }

    public int getDecimalMaxPrecision() {
        return decimalMaxPrecision;
    }

    public int getAvgDivPrecisionIncrement() {
        return avgDivPrecisionIncrement;
    }

    @Override
    public String toString() {
        return "AggrConfig{" +
                "hashInitialCapacity=" + hashInitialCapacity +
                ", hashWarnGroups=" + hashWarnGroups +
                ", streamCheckOrder=" + streamCheckOrder +
                ", hllPrecision=" + hllPrecision +
                ", decimalMaxPrecision=" + decimalMaxPrecision +
                ", avgDivPrecisionIncrement=" + avgDivPrecisionIncrement +
                '}';
    }
}

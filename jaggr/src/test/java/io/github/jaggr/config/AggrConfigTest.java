package io.github.jaggr.config;

import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class AggrConfigTest {
    @Test
    public void defaults() {
        AggrConfig config = AggrConfig.defaults();
        assertEquals(1024, config.getHashInitialCapacity());
        assertEquals(1_000_000L, config.getHashWarnGroups());
        assertTrue(config.isStreamCheckOrder());
        assertEquals(12, config.getHllPrecision());
        assertEquals(65, config.getDecimalMaxPrecision());
        assertEquals(4, config.getAvgDivPrecisionIncrement());
    }

    @Test
    public void classpathFileMatchesDefaults() {
        AggrConfig loaded = AggrConfig.load();
        assertEquals(AggrConfig.defaults().toString(), loaded.toString());
        assertSame(AggrConfig.get(), AggrConfig.get());
    }

    @Test
    public void systemPropertyOverridesFile() {
        System.setProperty(AggrConfig.HLL_PRECISION, "14");
        try {
            assertEquals(14, AggrConfig.load().getHllPrecision());
        } finally {
            System.clearProperty(AggrConfig.HLL_PRECISION);
        }
    }

    @Test
    public void fromProperties() {
        Properties properties = new Properties();
        properties.setProperty(AggrConfig.STREAM_CHECK_ORDER, " false ");
        properties.setProperty(AggrConfig.HASH_INITIAL_CAPACITY, "16");
        AggrConfig config = AggrConfig.fromProperties(properties);
        assertFalse(config.isStreamCheckOrder());
        assertEquals(16, config.getHashInitialCapacity());
    }

    @Test(expected = IllegalArgumentException.class)
    public void precisionOutOfRange() {
        Properties properties = new Properties();
        properties.setProperty(AggrConfig.HLL_PRECISION, "20");
        AggrConfig.fromProperties(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void notANumber() {
        Properties properties = new Properties();
        properties.setProperty(AggrConfig.HASH_WARN_GROUPS, "many");
        AggrConfig.fromProperties(properties);
    }
}

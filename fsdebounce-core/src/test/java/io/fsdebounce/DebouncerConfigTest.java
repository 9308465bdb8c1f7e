package io.fsdebounce;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DebouncerConfigTest {

    @Test
    void defaults() {
        DebouncerConfig config = new DebouncerConfig();
        assertEquals(2000L, config.getTimeoutMs());
        assertNull(config.getTickRateMs());
    }

    @Test
    void readsPrefixedProperties() {
        Properties props = new Properties();
        props.setProperty("fsdebounce.timeout-ms", "500");
        props.setProperty("fsdebounce.tick-rate-ms", " 25 ");

        DebouncerConfig config = DebouncerConfig.fromProperties(props);

        assertEquals(500L, config.getTimeoutMs());
        assertEquals(25L, config.getTickRateMs());
    }

    @Test
    void customPrefix() {
        Properties props = new Properties();
        props.setProperty("app.watch.timeout-ms", "750");

        DebouncerConfig config = DebouncerConfig.fromProperties(props, "app.watch.");

        assertEquals(750L, config.getTimeoutMs());
        assertNull(config.getTickRateMs());
    }

    @Test
    void blankTickRateMeansDerived() {
        Properties props = new Properties();
        props.setProperty("fsdebounce.tick-rate-ms", "");

        assertNull(DebouncerConfig.fromProperties(props).getTickRateMs());
    }

    @Test
    void malformedValueIsConfigError() {
        Properties props = new Properties();
        props.setProperty("fsdebounce.timeout-ms", "2s");

        DebounceConfigException e = assertThrows(DebounceConfigException.class,
                () -> DebouncerConfig.fromProperties(props));
        assertEquals("Invalid value for fsdebounce.timeout-ms: '2s'", e.getMessage());
    }

    @Test
    void loadsFromClasspathResource() throws Exception {
        Properties props = new Properties();
        try (var in = getClass().getResourceAsStream("/fsdebounce-test.properties")) {
            props.load(in);
        }

        DebouncerConfig config = DebouncerConfig.fromProperties(props);

        assertEquals(300L, config.getTimeoutMs());
        assertEquals(30L, config.getTickRateMs());
    }
}

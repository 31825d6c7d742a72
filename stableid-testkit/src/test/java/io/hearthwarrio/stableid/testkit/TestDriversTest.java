package io.hearthwarrio.stableid.testkit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TestDriversTest {

    @Test
    void defaultsToHeadlessLocalChromeWithShortWait() {
        TestDrivers.DriverSettings settings = TestDrivers.DriverSettings.from(Map.of());

        assertTrue(settings.isHeadless());
        assertTrue(settings.getGridUrl().isEmpty());
        assertEquals(TestDrivers.DEFAULT_IMPLICIT_WAIT, settings.getImplicitWait());
    }

    @Test
    void readsGridUrlHeadlessFlagAndWait() {
        TestDrivers.DriverSettings settings = TestDrivers.DriverSettings.from(Map.of(
                TestDrivers.HEADLESS_PROPERTY, " false ",
                TestDrivers.GRID_URL_PROPERTY, "http://grid:4444/wd/hub",
                TestDrivers.IMPLICIT_WAIT_PROPERTY, "500"
        ));

        assertFalse(settings.isHeadless());
        assertEquals("grid", settings.getGridUrl().orElseThrow().getHost());
        assertEquals(Duration.ofMillis(500), settings.getImplicitWait());
    }

    @Test
    void blankValuesFallBackToDefaults() {
        TestDrivers.DriverSettings settings = TestDrivers.DriverSettings.from(Map.of(
                TestDrivers.GRID_URL_PROPERTY, " ",
                TestDrivers.IMPLICIT_WAIT_PROPERTY, ""
        ));

        assertTrue(settings.getGridUrl().isEmpty());
        assertEquals(TestDrivers.DEFAULT_IMPLICIT_WAIT, settings.getImplicitWait());
    }

    @Test
    void malformedValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> TestDrivers.DriverSettings.from(Map.of(TestDrivers.GRID_URL_PROPERTY, "not a url")));
        assertThrows(IllegalArgumentException.class,
                () -> TestDrivers.DriverSettings.from(Map.of(TestDrivers.IMPLICIT_WAIT_PROPERTY, "soon")));
        assertThrows(IllegalArgumentException.class,
                () -> TestDrivers.DriverSettings.from(Map.of(TestDrivers.IMPLICIT_WAIT_PROPERTY, "-1")));
    }
}

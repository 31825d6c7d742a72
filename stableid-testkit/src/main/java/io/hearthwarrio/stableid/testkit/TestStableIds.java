package io.hearthwarrio.stableid.testkit;

import io.hearthwarrio.stableid.core.ConfigStore;
import io.hearthwarrio.stableid.core.IdentifierConfig;
import io.hearthwarrio.stableid.core.IdentifierScope;
import io.hearthwarrio.stableid.core.StdOutDebugLogSink;
import io.hearthwarrio.stableid.webdriver.IdentifierAttribute;
import io.hearthwarrio.stableid.webdriver.IdentifierLogDetail;
import io.hearthwarrio.stableid.webdriver.StableIdWebDriver;
import org.openqa.selenium.WebDriver;

import java.util.Objects;

/**
 * Convenience factory methods for identifier scopes and drivers in tests.
 * <p>
 * Keeps test code minimal and consistent.
 * Does not depend on Allure.
 */
public final class TestStableIds {

    private TestStableIds() {
        // utility class
    }

    /**
     * Standalone scope with the {@link IdentifierConfig#forTesting()} preset. Not tied to the global store.
     */
    public static IdentifierScope isolatedScope() {
        return new IdentifierScope(new ConfigStore(IdentifierConfig.forTesting()));
    }

    /**
     * Standalone scope with the testing preset, debug logging on and printed to stdout.
     */
    public static IdentifierScope debugScope() {
        IdentifierConfig config = IdentifierConfig.forTesting().setEnableDebugLogging(true);
        IdentifierScope scope = new IdentifierScope(new ConfigStore(config));
        scope.debugLog().addSink(new StdOutDebugLogSink());
        return scope;
    }

    /**
     * Creates a plain StableIdWebDriver without logging.
     */
    public static StableIdWebDriver plain(WebDriver driver, IdentifierAttribute attribute) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new StableIdWebDriver(driver, attribute);
    }

    /**
     * Creates a StableIdWebDriver with stdout lookup logging enabled.
     */
    public static StableIdWebDriver stdout(WebDriver driver, IdentifierAttribute attribute, IdentifierLogDetail detail) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new StableIdWebDriver(driver, attribute)
                .withLoggingToStdOut(detail);
    }
}

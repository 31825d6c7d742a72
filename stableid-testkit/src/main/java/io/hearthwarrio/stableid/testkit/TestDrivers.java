package io.hearthwarrio.stableid.testkit;

import io.hearthwarrio.stableid.webdriver.IdentifierAttribute;
import io.hearthwarrio.stableid.webdriver.IdentifierLogDetail;
import io.hearthwarrio.stableid.webdriver.StableIdWebDriver;
import org.openqa.selenium.Capabilities;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;

import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * WebDriver factory for browser tests against pages carrying generated identifiers.
 * <p>
 * {@link #fromSystemProperties()} picks the browser from {@code stableid.*} system properties so the same
 * test runs against a local Chrome on a workstation and against a Selenium Grid in CI.
 * Lookups by generated identifier are exact, so the implicit wait stays short.
 */
public final class TestDrivers {

    public static final String HEADLESS_PROPERTY = "stableid.browser.headless";
    public static final String GRID_URL_PROPERTY = "stableid.grid.url";
    public static final String IMPLICIT_WAIT_PROPERTY = "stableid.browser.implicitWaitMillis";

    public static final Duration DEFAULT_IMPLICIT_WAIT = Duration.ofSeconds(2);

    private TestDrivers() {
        // utility class
    }

    /**
     * Browser selection read from {@code stableid.*} properties.
     */
    public static final class DriverSettings {

        private final boolean headless;
        private final URL gridUrl;
        private final Duration implicitWait;

        DriverSettings(boolean headless, URL gridUrl, Duration implicitWait) {
            this.headless = headless;
            this.gridUrl = gridUrl;
            this.implicitWait = implicitWait;
        }

        /**
         * Unknown keys are ignored; malformed values are rejected rather than silently defaulted.
         *
         * @throws IllegalArgumentException on a malformed grid URL or wait
         */
        public static DriverSettings from(Map<String, String> properties) {
            Objects.requireNonNull(properties, "properties must not be null");
            boolean headless = Boolean.parseBoolean(properties.getOrDefault(HEADLESS_PROPERTY, "true").trim());

            URL gridUrl = null;
            String grid = properties.get(GRID_URL_PROPERTY);
            if (grid != null && !grid.isBlank()) {
                try {
                    gridUrl = new URL(grid.trim());
                } catch (MalformedURLException e) {
                    throw new IllegalArgumentException(GRID_URL_PROPERTY + " is not a URL: " + grid, e);
                }
            }

            Duration wait = DEFAULT_IMPLICIT_WAIT;
            String millis = properties.get(IMPLICIT_WAIT_PROPERTY);
            if (millis != null && !millis.isBlank()) {
                try {
                    wait = Duration.ofMillis(Long.parseLong(millis.trim()));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(IMPLICIT_WAIT_PROPERTY + " is not a number: " + millis, e);
                }
                if (wait.isNegative()) {
                    throw new IllegalArgumentException(IMPLICIT_WAIT_PROPERTY + " must not be negative: " + millis);
                }
            }
            return new DriverSettings(headless, gridUrl, wait);
        }

        public boolean isHeadless() {
            return headless;
        }

        public Optional<URL> getGridUrl() {
            return Optional.ofNullable(gridUrl);
        }

        public Duration getImplicitWait() {
            return implicitWait;
        }

        public ChromeOptions chromeOptions() {
            ChromeOptions options = new ChromeOptions();
            if (headless) {
                options.addArguments("--headless=new", "--window-size=1280,900");
            }
            return options;
        }
    }

    /**
     * Grid when {@value #GRID_URL_PROPERTY} is set, local Chrome otherwise.
     */
    public static WebDriver fromSystemProperties() {
        Map<String, String> properties = Map.of(
                HEADLESS_PROPERTY, System.getProperty(HEADLESS_PROPERTY, "true"),
                GRID_URL_PROPERTY, System.getProperty(GRID_URL_PROPERTY, ""),
                IMPLICIT_WAIT_PROPERTY, System.getProperty(IMPLICIT_WAIT_PROPERTY, "")
        );
        return create(DriverSettings.from(properties));
    }

    public static WebDriver create(DriverSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        WebDriver driver = settings.getGridUrl()
                .<WebDriver>map(url -> new RemoteWebDriver(url, settings.chromeOptions()))
                .orElseGet(() -> new ChromeDriver(settings.chromeOptions()));
        driver.manage().timeouts().implicitlyWait(settings.getImplicitWait());
        return driver;
    }

    public static WebDriver chrome() {
        return chrome(new ChromeOptions());
    }

    /**
     * Local Chrome without a window, for CI.
     */
    public static WebDriver headlessChrome() {
        return create(new DriverSettings(true, null, DEFAULT_IMPLICIT_WAIT));
    }

    public static WebDriver chrome(ChromeOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        WebDriver driver = new ChromeDriver(options);
        driver.manage().timeouts().implicitlyWait(DEFAULT_IMPLICIT_WAIT);
        return driver;
    }

    public static WebDriver remote(URL remoteUrl, Capabilities capabilities) {
        Objects.requireNonNull(remoteUrl, "remoteUrl must not be null");
        Objects.requireNonNull(capabilities, "capabilities must not be null");
        WebDriver driver = new RemoteWebDriver(remoteUrl, capabilities);
        driver.manage().timeouts().implicitlyWait(DEFAULT_IMPLICIT_WAIT);
        return driver;
    }

    /**
     * Wraps {@code driver} for lookups through {@code attribute}, logging every lookup with its element to stdout.
     */
    public static StableIdWebDriver stableIds(WebDriver driver, IdentifierAttribute attribute) {
        return new StableIdWebDriver(driver, attribute).withLoggingToStdOut(IdentifierLogDetail.ELEMENT);
    }
}

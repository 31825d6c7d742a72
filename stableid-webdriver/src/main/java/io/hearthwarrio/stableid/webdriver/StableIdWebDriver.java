package io.hearthwarrio.stableid.webdriver;

import io.hearthwarrio.stableid.core.CollisionRegistry;
import io.hearthwarrio.stableid.core.IdentifierRequest;
import io.hearthwarrio.stableid.core.export.ElementAction;
import io.hearthwarrio.stableid.core.export.SeleniumJavaDialect;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Selenium entry point for pages whose elements carry generated identifiers.
 * <p>
 * Every lookup goes through one {@link IdentifierAttribute}; the same attribute is used by
 * {@link #dialect()} so exported test code finds exactly what this driver finds.
 * <p>
 * Each call is an independent lookup: nothing is cached between calls.
 */
public class StableIdWebDriver {

    private final WebDriver driver;
    private final IdentifierAttribute attribute;

    /**
     * Mutable to support runtime overrides.
     */
    private ResolvedIdentifierLogger logger;

    public StableIdWebDriver(WebDriver driver) {
        this(driver, IdentifierAttribute.ID, null);
    }

    public StableIdWebDriver(WebDriver driver, IdentifierAttribute attribute) {
        this(driver, attribute, null);
    }

    public StableIdWebDriver(WebDriver driver, IdentifierAttribute attribute, ResolvedIdentifierLogger logger) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.attribute = Objects.requireNonNull(attribute, "attribute must not be null");
        this.logger = logger;
    }

    // ----------- configuration -----------

    public StableIdWebDriver withLogger(ResolvedIdentifierLogger logger) {
        this.logger = logger;
        return this;
    }

    public StableIdWebDriver withLoggingToStdOut(IdentifierLogDetail detail) {
        this.logger = new StdOutResolvedIdentifierLogger(detail);
        return this;
    }

    public StableIdWebDriver disableLogging() {
        this.logger = null;
        return this;
    }

    public WebDriver driver() {
        return driver;
    }

    public IdentifierAttribute attribute() {
        return attribute;
    }

    /**
     * Export dialect matching this driver's attribute.
     */
    public SeleniumJavaDialect dialect() {
        return attribute.dialect();
    }

    public By by(String identifier) {
        return attribute.by(identifier);
    }

    // ----------- lookups and actions -----------

    /**
     * Finds the element carrying {@code identifier}.
     *
     * @throws IdentifierLookupException if no such element is present
     */
    public WebElement find(String identifier) {
        return resolve(identifier, ElementAction.NONE);
    }

    public boolean exists(String identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        return !driver.findElements(by(identifier)).isEmpty();
    }

    public void click(String identifier) {
        resolve(identifier, ElementAction.TAP).click();
    }

    public void type(String identifier, CharSequence... text) {
        resolve(identifier, ElementAction.TYPE).sendKeys(text);
    }

    /**
     * Performs the action a role implies (see {@link ElementAction#fromRole(String)}):
     * click for tappable roles, typing {@code text} for input roles, a plain lookup otherwise.
     *
     * @return the element acted on
     */
    public WebElement perform(String identifier, String role, CharSequence... text) {
        ElementAction action = ElementAction.fromRole(role);
        WebElement element = resolve(identifier, action);
        switch (action) {
            case TAP:
                element.click();
                break;
            case TYPE:
                element.sendKeys(text);
                break;
            case NONE:
            default:
                break;
        }
        return element;
    }

    /**
     * Performs the action implied by the role the identifier was issued for.
     */
    public WebElement perform(String identifier, IdentifierRequest request, CharSequence... text) {
        Objects.requireNonNull(request, "request must not be null");
        return perform(identifier, request.getRole(), text);
    }

    /**
     * Wraps {@code element} so an {@code AssignmentResolver} can attach identifiers to the live page.
     *
     * @throws IllegalStateException if the driver cannot execute JavaScript
     */
    public WebElementNode node(WebElement element) {
        if (!(driver instanceof JavascriptExecutor)) {
            throw new IllegalStateException("Driver does not support JavaScript: " + driver.getClass().getName());
        }
        return new WebElementNode((JavascriptExecutor) driver, element, attribute);
    }

    // ----------- verification -----------

    /**
     * Identifiers from {@code identifiers} that no element on the current page carries, in input order.
     */
    public List<String> missing(Collection<String> identifiers) {
        Objects.requireNonNull(identifiers, "identifiers must not be null");
        List<String> missing = new ArrayList<>();
        for (String identifier : identifiers) {
            if (!exists(identifier)) {
                missing.add(identifier);
            }
        }
        return missing;
    }

    /**
     * Checks that every identifier issued in a run is present on the current page.
     *
     * @throws IdentifierLookupException listing the missing identifiers
     */
    public void verifyIssued(CollisionRegistry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        Map<String, IdentifierRequest> issued = registry.issued();
        List<String> missing = missing(issued.keySet());
        if (!missing.isEmpty()) {
            throw new IdentifierLookupException(
                    missing.size() + " of " + issued.size() + " issued identifier(s) not found by " +
                            attribute.attributeName() + ": " + missing
            );
        }
    }

    private WebElement resolve(String identifier, ElementAction action) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        By by = by(identifier);

        WebElement element;
        try {
            element = driver.findElement(by);
        } catch (NoSuchElementException e) {
            throw new IdentifierLookupException(
                    "No element with " + attribute.attributeName() + " '" + identifier + "'", e
            );
        }

        if (logger != null) {
            IdentifierLogDetail detail = logger.detail();
            String tagName = detail == IdentifierLogDetail.ELEMENT ? element.getTagName() : null;
            logger.logResolvedIdentifier(identifier, by, action, tagName);
        }
        return element;
    }
}

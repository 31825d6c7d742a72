package io.hearthwarrio.stableid.webdriver;

import io.hearthwarrio.stableid.core.export.ElementAction;
import org.openqa.selenium.By;

/**
 * Receives information about an element found by its generated identifier.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 * <p>
 * Note: {@link #detail()} is used by {@link StableIdWebDriver} to decide whether it should
 * query the element's tag name at all.
 */
@FunctionalInterface
public interface ResolvedIdentifierLogger {

    /**
     * Called after the element is found, before the action is performed.
     *
     * @param identifier generated identifier
     * @param locator    locator used for the lookup
     * @param action     action about to be performed ({@link ElementAction#NONE} for plain lookups)
     * @param tagName    element tag name (null unless {@link IdentifierLogDetail#ELEMENT} is requested)
     */
    void logResolvedIdentifier(String identifier, By locator, ElementAction action, String tagName);

    default IdentifierLogDetail detail() {
        return IdentifierLogDetail.LOCATOR;
    }
}

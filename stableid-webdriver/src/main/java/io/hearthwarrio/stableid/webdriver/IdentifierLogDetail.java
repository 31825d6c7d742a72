package io.hearthwarrio.stableid.webdriver;

/**
 * Controls how much is logged for a resolved identifier.
 */
public enum IdentifierLogDetail {

    /**
     * Identifier and action only.
     */
    NONE,

    /**
     * Also the Selenium locator used.
     */
    LOCATOR,

    /**
     * Also the element tag name. Costs one extra driver round trip per lookup.
     */
    ELEMENT
}

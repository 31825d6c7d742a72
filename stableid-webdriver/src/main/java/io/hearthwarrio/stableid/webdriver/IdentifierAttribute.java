package io.hearthwarrio.stableid.webdriver;

import io.hearthwarrio.stableid.core.export.SeleniumJavaDialect;
import org.openqa.selenium.By;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * DOM attribute that carries generated identifiers in a rendered page.
 */
public enum IdentifierAttribute {
    ID("id"),
    DATA_TESTID("data-testid"),
    DATA_TEST_ID("data-test-id"),
    DATA_QA("data-qa"),
    ARIA_LABEL("aria-label");

    private final String attributeName;

    IdentifierAttribute(String attributeName) {
        this.attributeName = attributeName;
    }

    public String attributeName() {
        return attributeName;
    }

    /**
     * Locator for the element carrying {@code identifier}.
     * {@link #ID} uses {@code By.id}; other attributes use an exact attribute CSS selector.
     */
    public By by(String identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        if (this == ID) {
            return By.id(identifier);
        }
        return By.cssSelector("[" + attributeName + "=" + cssAttrLiteral(identifier) + "]");
    }

    /**
     * Export dialect producing Selenium code that locates elements the same way as {@link #by(String)}.
     */
    public SeleniumJavaDialect dialect() {
        return new SeleniumJavaDialect(attributeName);
    }

    /**
     * Lenient lookup by attribute name ({@code data-testid}) or constant name ({@code DATA_TESTID}).
     */
    public static Optional<IdentifierAttribute> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (IdentifierAttribute attribute : values()) {
            if (attribute.attributeName.equals(normalized)
                    || attribute.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }

    private static String cssAttrLiteral(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}

package io.hearthwarrio.stableid.webdriver;

import io.hearthwarrio.stableid.core.IdentifiableNode;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebElement;

import java.util.Objects;

/**
 * A live DOM element seen as an {@link IdentifiableNode}: the identifier is the value of the configured
 * {@link IdentifierAttribute}, written through JavaScript.
 */
public final class WebElementNode implements IdentifiableNode {

    private static final String SET_ATTRIBUTE_SCRIPT = "arguments[0].setAttribute(arguments[1], arguments[2]);";

    private final JavascriptExecutor js;
    private final WebElement element;
    private final IdentifierAttribute attribute;

    WebElementNode(JavascriptExecutor js, WebElement element, IdentifierAttribute attribute) {
        this.js = Objects.requireNonNull(js, "js must not be null");
        this.element = Objects.requireNonNull(element, "element must not be null");
        this.attribute = Objects.requireNonNull(attribute, "attribute must not be null");
    }

    public WebElement element() {
        return element;
    }

    @Override
    public String getIdentifier() {
        String value = element.getAttribute(attribute.attributeName());
        return value == null || value.isEmpty() ? null : value;
    }

    @Override
    public void setIdentifier(String identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        js.executeScript(SET_ATTRIBUTE_SCRIPT, element, attribute.attributeName(), identifier);
    }
}

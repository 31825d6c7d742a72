package io.hearthwarrio.stableid.webdriver;

import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory page backing {@link java.lang.reflect.Proxy} based {@link WebDriver} and {@link WebElement} fakes.
 * Understands {@code By.id} and {@code By.cssSelector("[attr='value']")} lookups only.
 */
final class FakePage {

    private static final Pattern ATTRIBUTE_SELECTOR = Pattern.compile("^\\[([a-z-]+)='((?:[^'\\\\]|\\\\.)*)'\\]$");

    private final List<Element> elements = new ArrayList<>();
    final List<String> events = new ArrayList<>();

    Element add(String tagName, String... attributeNameValuePairs) {
        Element element = new Element(tagName);
        for (int i = 0; i + 1 < attributeNameValuePairs.length; i += 2) {
            element.attributes.put(attributeNameValuePairs[i], attributeNameValuePairs[i + 1]);
        }
        elements.add(element);
        return element;
    }

    WebDriver driver() {
        return (WebDriver) Proxy.newProxyInstance(
                getClass().getClassLoader(),
                new Class<?>[]{WebDriver.class, JavascriptExecutor.class},
                (proxy, method, args) -> {
                    switch (method.getName()) {
                        case "findElement": {
                            List<WebElement> found = find((By) args[0]);
                            if (found.isEmpty()) {
                                throw new NoSuchElementException("Cannot locate " + args[0]);
                            }
                            return found.get(0);
                        }
                        case "findElements":
                            return find((By) args[0]);
                        case "executeScript":
                            return executeScript((String) args[0], (Object[]) args[1]);
                        case "hashCode":
                            return System.identityHashCode(proxy);
                        case "equals":
                            return proxy == args[0];
                        case "toString":
                            return "FakeDriver";
                        default:
                            throw new UnsupportedOperationException(method.getName());
                    }
                }
        );
    }

    /**
     * Driver without JavaScript support.
     */
    WebDriver plainDriver() {
        WebDriver full = driver();
        return (WebDriver) Proxy.newProxyInstance(
                getClass().getClassLoader(),
                new Class<?>[]{WebDriver.class},
                (proxy, method, args) -> method.invoke(full, args)
        );
    }

    private List<WebElement> find(By by) {
        String description = by.toString();
        String attribute;
        String value;
        if (description.startsWith("By.id: ")) {
            attribute = "id";
            value = description.substring("By.id: ".length());
        } else if (description.startsWith("By.cssSelector: ")) {
            Matcher m = ATTRIBUTE_SELECTOR.matcher(description.substring("By.cssSelector: ".length()));
            if (!m.matches()) {
                throw new UnsupportedOperationException(description);
            }
            attribute = m.group(1);
            value = m.group(2).replaceAll("\\\\(.)", "$1");
        } else {
            throw new UnsupportedOperationException(description);
        }

        List<WebElement> found = new ArrayList<>();
        for (Element element : elements) {
            if (value.equals(element.attributes.get(attribute))) {
                found.add(element.proxy);
            }
        }
        return found;
    }

    private Object executeScript(String script, Object[] args) {
        if (!script.contains("setAttribute")) {
            throw new UnsupportedOperationException(script);
        }
        for (Element element : elements) {
            if (element.proxy == args[0]) {
                element.attributes.put((String) args[1], (String) args[2]);
                return null;
            }
        }
        throw new IllegalArgumentException("unknown element");
    }

    final class Element {
        final String tagName;
        final Map<String, String> attributes = new HashMap<>();
        final WebElement proxy;

        private Element(String tagName) {
            this.tagName = tagName;
            this.proxy = (WebElement) Proxy.newProxyInstance(
                    getClass().getClassLoader(),
                    new Class<?>[]{WebElement.class},
                    (p, method, args) -> {
                        switch (method.getName()) {
                            case "click":
                                events.add("click " + describe());
                                return null;
                            case "sendKeys":
                                events.add("type " + describe() + " " + String.join("", (CharSequence[]) args[0]));
                                return null;
                            case "getTagName":
                                return this.tagName;
                            case "getAttribute":
                                return attributes.get((String) args[0]);
                            case "hashCode":
                                return System.identityHashCode(p);
                            case "equals":
                                return p == args[0];
                            case "toString":
                                return "FakeElement(" + describe() + ")";
                            default:
                                throw new UnsupportedOperationException(method.getName());
                        }
                    }
            );
        }

        String describe() {
            return tagName + attributes;
        }
    }
}

package io.hearthwarrio.stableid.core.export;

import java.util.Objects;

/**
 * Selenium WebDriver test in Java (JUnit 5), elements located by an attribute carrying the identifier.
 */
public final class SeleniumJavaDialect implements ScriptDialect {

    /**
     * Default attribute: {@code id}, located with {@code By.id}.
     */
    public static final String ID_ATTRIBUTE = "id";

    private final String attribute;

    public SeleniumJavaDialect() {
        this(ID_ATTRIBUTE);
    }

    /**
     * @param attribute DOM attribute that carries the generated identifier (e.g. {@code data-testid})
     */
    public SeleniumJavaDialect(String attribute) {
        this.attribute = Objects.requireNonNull(attribute, "attribute must not be null");
    }

    @Override
    public String fileExtension() {
        return ".java";
    }

    @Override
    public String header(String screenContext) {
        return "// Generated UI test code\n" +
                "// Screen: " + screenContext + "\n" +
                "import org.junit.jupiter.api.Test;\n" +
                "import org.openqa.selenium.By;\n" +
                "import org.openqa.selenium.WebDriver;\n" +
                "import org.openqa.selenium.WebElement;\n" +
                "\n" +
                "import static org.junit.jupiter.api.Assertions.assertTrue;\n" +
                "\n" +
                "class GeneratedUiTest {\n" +
                "\n" +
                "    // assign in your own setup\n" +
                "    private WebDriver driver;\n" +
                "\n" +
                "    @Test\n" +
                "    void generatedUiElements() {\n";
    }

    @Override
    public String locate(String variable, String identifier) {
        return "        WebElement " + variable + " = driver.findElement(" + by(identifier) + ");\n" +
                "        assertTrue(" + variable + ".isDisplayed(), " +
                ScriptDialect.quote("Element '" + identifier + "' should exist") + ");\n";
    }

    @Override
    public String action(String variable, ElementAction action) {
        switch (action) {
            case TAP:
                return "        " + variable + ".click();\n";
            case TYPE:
                return "        " + variable + ".sendKeys(\"text\");\n";
            case NONE:
            default:
                return "";
        }
    }

    @Override
    public String footer() {
        return "    }\n" +
                "}\n";
    }

    @Override
    public String tapAction(String identifier) {
        return "driver.findElement(" + by(identifier) + ").click();";
    }

    @Override
    public String textInputAction(String identifier, String text) {
        return "driver.findElement(" + by(identifier) + ").sendKeys(" + ScriptDialect.quote(text) + ");";
    }

    private String by(String identifier) {
        if (ID_ATTRIBUTE.equals(attribute)) {
            return "By.id(" + ScriptDialect.quote(identifier) + ")";
        }
        String css = "[" + attribute + "='" + identifier.replace("\\", "\\\\").replace("'", "\\'") + "']";
        return "By.cssSelector(" + ScriptDialect.quote(css) + ")";
    }
}

package io.hearthwarrio.stableid.allure;

import io.hearthwarrio.stableid.core.export.ElementAction;
import io.hearthwarrio.stableid.webdriver.IdentifierLogDetail;
import io.hearthwarrio.stableid.webdriver.ResolvedIdentifierLogger;
import io.qameta.allure.Allure;
import org.openqa.selenium.By;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.util.Objects;

/**
 * Allure logger for elements found by generated identifier.
 */
public final class AllureResolvedIdentifierLogger implements ResolvedIdentifierLogger {

    private final WebDriver driver;
    private final IdentifierLogDetail detail;
    private final boolean attachScreenshot;

    public AllureResolvedIdentifierLogger(WebDriver driver, IdentifierLogDetail detail, boolean attachScreenshot) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.detail = detail == null ? IdentifierLogDetail.NONE : detail;
        this.attachScreenshot = attachScreenshot;
    }

    @Override
    public IdentifierLogDetail detail() {
        return detail;
    }

    @Override
    public void logResolvedIdentifier(String identifier, By locator, ElementAction action, String tagName) {
        String title = "StableId: " + identifier + " – " + action;

        Allure.step(title, () -> {
            StringBuilder sb = new StringBuilder(256);
            sb.append("identifier: ").append(identifier).append('\n')
                    .append("action: ").append(action).append('\n');

            if (detail != IdentifierLogDetail.NONE) {
                sb.append("by: ").append(locator).append('\n');
            }
            if (detail == IdentifierLogDetail.ELEMENT) {
                sb.append("tag: ").append(tagName == null ? "null" : tagName).append('\n');
            }

            AllureDebugLogSink.attachText("Resolved identifier", sb.toString());

            if (attachScreenshot && driver instanceof TakesScreenshot ts) {
                byte[] png = ts.getScreenshotAs(OutputType.BYTES);
                Allure.addAttachment(
                        "Screenshot",
                        "image/png",
                        new ByteArrayInputStream(png),
                        ".png"
                );
            }
        });
    }
}

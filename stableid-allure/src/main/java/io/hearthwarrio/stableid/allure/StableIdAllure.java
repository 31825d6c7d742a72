package io.hearthwarrio.stableid.allure;

import io.hearthwarrio.stableid.core.DebugLog;
import io.hearthwarrio.stableid.core.DebugLogSink;
import io.hearthwarrio.stableid.core.export.TestScriptExporter;
import io.hearthwarrio.stableid.webdriver.IdentifierLogDetail;
import io.hearthwarrio.stableid.webdriver.ResolvedIdentifierLogger;
import io.qameta.allure.Allure;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Factory methods and attachment helpers for Allure reporting.
 * <p>
 * This class lives in the stableid-allure module to avoid leaking Allure
 * dependencies into stableid-core or stableid-webdriver.
 */
public final class StableIdAllure {

    private StableIdAllure() {
        // utility class
    }

    public static DebugLogSink debugLogSink() {
        return new AllureDebugLogSink();
    }

    /**
     * Creates an Allure logger that logs locators without screenshots.
     */
    public static ResolvedIdentifierLogger resolvedIdentifiers(WebDriver driver) {
        return new AllureResolvedIdentifierLogger(driver, IdentifierLogDetail.LOCATOR, false);
    }

    /**
     * Creates an Allure logger with explicit detail and screenshot flag.
     */
    public static ResolvedIdentifierLogger resolvedIdentifiers(
            WebDriver driver,
            IdentifierLogDetail detail,
            boolean screenshots
    ) {
        return new AllureResolvedIdentifierLogger(driver, detail, screenshots);
    }

    /**
     * Attaches the whole debug log as one text attachment.
     *
     * @return false if the log is empty (nothing attached)
     */
    public static boolean attachDebugLog(DebugLog log) {
        Objects.requireNonNull(log, "log must not be null");
        String text = log.getLog();
        if (text.isEmpty()) {
            return false;
        }
        AllureDebugLogSink.attachText("StableId debug log", text);
        return true;
    }

    /**
     * Attaches the generated test code, named after the exporter's dialect.
     *
     * @return false if nothing was issued (nothing attached)
     */
    public static boolean attachScript(TestScriptExporter exporter) {
        Objects.requireNonNull(exporter, "exporter must not be null");
        String code = exporter.render();
        if (code.isEmpty()) {
            return false;
        }
        String extension = exporter.dialect().fileExtension();
        Allure.addAttachment(
                "Generated UI test" + extension,
                "text/plain",
                new ByteArrayInputStream(code.getBytes(StandardCharsets.UTF_8)),
                extension
        );
        return true;
    }
}

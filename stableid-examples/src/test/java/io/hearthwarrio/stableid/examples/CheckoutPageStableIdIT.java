package io.hearthwarrio.stableid.examples;

import io.hearthwarrio.stableid.allure.StableIdAllure;
import io.hearthwarrio.stableid.core.AmbientContext;
import io.hearthwarrio.stableid.core.AmbientOverride;
import io.hearthwarrio.stableid.core.AssignmentResolver;
import io.hearthwarrio.stableid.core.IdentifierGenerator;
import io.hearthwarrio.stableid.core.IdentifierScope;
import io.hearthwarrio.stableid.core.NodeDeclaration;
import io.hearthwarrio.stableid.testkit.IsolatedIdentifierScopeExtension;
import io.hearthwarrio.stableid.testkit.TestDrivers;
import io.hearthwarrio.stableid.webdriver.IdentifierAttribute;
import io.hearthwarrio.stableid.webdriver.StableIdWebDriver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(IsolatedIdentifierScopeExtension.class)
class CheckoutPageStableIdIT {

    private static final String SCRIPT =
            "<script>function pay(){document.getElementById('result').textContent=" +
                    "'Paid by '+document.querySelector('input').value;}</script>";

    @TempDir
    Path tempDir;

    private WebDriver driver;

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.quit();
        }
    }

    @Test
    void checkout_renderedWithGeneratedIds(IdentifierScope scope) throws IOException {
        scope.hierarchy().setScreenContext("Checkout");
        IdentifierGenerator generator = scope.generator();
        String email = generator.generateId("Email", "text-field", "payment");
        String pay = generator.generateId("Pay now", "button", "payment");

        Path page = writePage(
                "<form onsubmit='return false'>" +
                        "<input type='email' data-testid='" + email + "'>" +
                        "<button type='button' data-testid='" + pay + "' onclick='pay()'>Pay now</button>" +
                        "</form>"
        );

        driver = TestDrivers.fromSystemProperties();
        driver.get(page.toUri().toString());

        StableIdWebDriver stableIds = TestDrivers.stableIds(driver, IdentifierAttribute.DATA_TESTID);
        stableIds.verifyIssued(scope.registry());

        stableIds.perform(email, scope.registry().issued().get(email), "ann@example.com");
        stableIds.perform(pay, scope.registry().issued().get(pay));

        assertPaid("ann@example.com");
        assertEquals("DebugTest.checkout.payment.button.pay-now", pay);
        assertTrue(scope.exporter(stableIds.dialect()).render().contains(pay));
    }

    @Test
    void checkout_idsAttachedToLivePage_withAllureLogging(IdentifierScope scope) throws IOException {
        scope.config().setEnableAutoIds(false).setEnableDebugLogging(true);
        scope.debugLog().addSink(StableIdAllure.debugLogSink());

        Path page = writePage(
                "<form onsubmit='return false'>" +
                        "<input type='text' name='name'>" +
                        "<button type='button' onclick='pay()'>Pay</button>" +
                        "</form>"
        );

        driver = TestDrivers.fromSystemProperties();
        driver.get(page.toUri().toString());

        StableIdWebDriver stableIds = new StableIdWebDriver(driver, IdentifierAttribute.ID)
                .withLogger(StableIdAllure.resolvedIdentifiers(driver));
        AssignmentResolver resolver = scope.resolver();
        AmbientContext form = AmbientContext.root().with(AmbientOverride.FORCE_ON);

        String nameId = resolver.apply(
                stableIds.node(driver.findElement(By.tagName("input"))),
                NodeDeclaration.of("name", "text-field", "form"),
                form
        ).getIdentifier().orElseThrow();
        String payId = resolver.apply(
                stableIds.node(driver.findElement(By.tagName("button"))),
                NodeDeclaration.of("Pay", "button", "form"),
                form
        ).getIdentifier().orElseThrow();

        stableIds.type(nameId, "Bob");
        stableIds.click(payId);

        assertPaid("Bob");
        assertEquals(2, scope.debugLog().size());
        StableIdAllure.attachDebugLog(scope.debugLog());
        StableIdAllure.attachScript(scope.exporter(stableIds.dialect()));
    }

    private Path writePage(String body) throws IOException {
        String html = "<!DOCTYPE html><html><head><meta charset='utf-8'>" + SCRIPT + "</head><body>" +
                body + "<div id='result'></div></body></html>";
        return Files.writeString(tempDir.resolve("checkout.html"), html, StandardCharsets.UTF_8);
    }

    private void assertPaid(String payer) {
        String result = driver.findElement(By.id("result")).getText();
        assertTrue(result.contains("Paid by " + payer), "Expected payment confirmation, got: " + result);
    }
}

package io.hearthwarrio.stableid.webdriver;

import io.hearthwarrio.stableid.core.export.ElementAction;
import org.openqa.selenium.By;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Default stdout logger for resolved identifiers.
 */
public final class StdOutResolvedIdentifierLogger implements ResolvedIdentifierLogger {

    private final IdentifierLogDetail detail;
    private final PrintStream out;

    public StdOutResolvedIdentifierLogger(IdentifierLogDetail detail) {
        this(detail, System.out);
    }

    public StdOutResolvedIdentifierLogger(IdentifierLogDetail detail, PrintStream out) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public IdentifierLogDetail detail() {
        return detail;
    }

    @Override
    public void logResolvedIdentifier(String identifier, By locator, ElementAction action, String tagName) {
        StringBuilder sb = new StringBuilder(128);
        sb.append("[StableId] id='").append(identifier).append('\'')
                .append(", action=").append(action);

        if (detail != IdentifierLogDetail.NONE) {
            sb.append(", by=").append(locator);
        }
        if (detail == IdentifierLogDetail.ELEMENT) {
            sb.append(", tag=").append(tagName == null ? "null" : tagName);
        }

        out.println(sb);
    }
}

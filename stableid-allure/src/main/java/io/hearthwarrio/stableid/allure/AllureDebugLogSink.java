package io.hearthwarrio.stableid.allure;

import io.hearthwarrio.stableid.core.CollisionRegistry;
import io.hearthwarrio.stableid.core.DebugLogEntry;
import io.hearthwarrio.stableid.core.DebugLogSink;
import io.qameta.allure.Allure;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reports debug log events as Allure steps, each with a small text attachment.
 * <p>
 * Lives in stableid-allure to avoid leaking the Allure dependency into core.
 */
public final class AllureDebugLogSink implements DebugLogSink {

    @Override
    public void onEntry(DebugLogEntry entry) {
        String title = "StableId: " + entry.getIdentifier();

        Allure.step(title, () -> {
            StringBuilder sb = new StringBuilder(256);
            sb.append("identifier: ").append(entry.getIdentifier()).append('\n')
                    .append("kind: ").append(entry.getKind()).append('\n')
                    .append("subject: ").append(entry.getSubjectIdentity()).append('\n')
                    .append("role: ").append(entry.getRole()).append('\n')
                    .append("context: ").append(entry.getContext()).append('\n')
                    .append("timestamp: ").append(entry.getTimestamp()).append('\n');
            attachText("Identifier", sb.toString());
        });
    }

    @Override
    public void onCollision(CollisionRegistry.Collision collision) {
        Allure.step("StableId collision: " + collision.getIdentifier(), () -> attachText(
                "Collision",
                "identifier: " + collision.getIdentifier() + '\n' +
                        "first: " + collision.getFirst() + '\n' +
                        "second: " + collision.getSecond() + '\n'
        ));
    }

    static void attachText(String name, String text) {
        byte[] txt = text.getBytes(StandardCharsets.UTF_8);
        Allure.addAttachment(name, "text/plain", new ByteArrayInputStream(txt), ".txt");
    }
}

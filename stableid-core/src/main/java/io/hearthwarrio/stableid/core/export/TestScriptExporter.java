package io.hearthwarrio.stableid.core.export;

import io.hearthwarrio.stableid.core.CollisionRegistry;
import io.hearthwarrio.stableid.core.HierarchyTracker;
import io.hearthwarrio.stableid.core.IdentifierRequest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Renders every identifier issued so far into copy-pasteable test code.
 * <p>
 * Identifiers are emitted sorted, one lookup per identifier plus an action when the role implies one
 * (see {@link ElementAction}). Nothing issued means nothing to export: {@link #render()} returns an empty
 * string and the export methods report an empty result instead of failing.
 */
public final class TestScriptExporter {

    private static final Set<String> RESERVED_WORDS = Set.of(
            "abstract", "as", "boolean", "break", "byte", "case", "catch", "char", "class", "continue",
            "default", "do", "double", "else", "enum", "extends", "false", "final", "finally", "float",
            "for", "func", "if", "implements", "import", "in", "instanceof", "int", "interface", "is",
            "let", "long", "native", "new", "nil", "null", "package", "private", "protected", "public",
            "return", "self", "short", "static", "struct", "super", "switch", "this", "throw", "throws",
            "true", "try", "var", "void", "while"
    );

    private final CollisionRegistry registry;
    private final HierarchyTracker hierarchy;
    private final ScriptDialect dialect;
    private final ClipboardWriter clipboard;

    public TestScriptExporter(CollisionRegistry registry, HierarchyTracker hierarchy) {
        this(registry, hierarchy, new SeleniumJavaDialect());
    }

    public TestScriptExporter(CollisionRegistry registry, HierarchyTracker hierarchy, ScriptDialect dialect) {
        this(registry, hierarchy, dialect, new SystemClipboardWriter());
    }

    public TestScriptExporter(
            CollisionRegistry registry,
            HierarchyTracker hierarchy,
            ScriptDialect dialect,
            ClipboardWriter clipboard
    ) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.clipboard = Objects.requireNonNull(clipboard, "clipboard must not be null");
    }

    public TestScriptExporter withClipboard(ClipboardWriter clipboard) {
        return new TestScriptExporter(registry, hierarchy, dialect, clipboard);
    }

    public ScriptDialect dialect() {
        return dialect;
    }

    /**
     * Test source for all issued identifiers, or an empty string when none were issued.
     */
    public String render() {
        Map<String, IdentifierRequest> issued = new TreeMap<>(registry.issued());
        if (issued.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder(256 + issued.size() * 160);
        sb.append(dialect.header(hierarchy.screenContext()));

        Set<String> usedVariables = new HashSet<>();
        for (Map.Entry<String, IdentifierRequest> e : issued.entrySet()) {
            String variable = variableName(e.getKey(), usedVariables);
            sb.append(dialect.locate(variable, e.getKey()));
            sb.append(dialect.action(variable, ElementAction.fromRole(e.getValue().getRole())));
            sb.append('\n');
        }

        sb.append(dialect.footer());
        return sb.toString();
    }

    /**
     * Writes the rendered code to a new temporary file. The caller owns (and deletes) the file.
     *
     * @return the file, or empty when there is nothing to export
     * @throws IdentifierExportException if the file cannot be written
     */
    public Optional<Path> exportToFile() {
        String code = render();
        if (code.isEmpty()) {
            return Optional.empty();
        }
        try {
            Path file = Files.createTempFile("generated-ui-test-", dialect.fileExtension());
            return Optional.of(write(file, code));
        } catch (IOException e) {
            throw new IdentifierExportException("Failed to create temporary export file", e);
        }
    }

    /**
     * Writes the rendered code to {@code target}, replacing it if present.
     *
     * @return target, or empty when there is nothing to export (target is not touched)
     * @throws IdentifierExportException if the file cannot be written
     */
    public Optional<Path> exportToFile(Path target) {
        Objects.requireNonNull(target, "target must not be null");
        String code = render();
        if (code.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(write(target, code));
    }

    /**
     * Places the rendered code on the clipboard.
     *
     * @return false when there is nothing to export or no clipboard is available
     */
    public boolean exportToClipboard() {
        String code = render();
        if (code.isEmpty()) {
            return false;
        }
        return clipboard.write(code);
    }

    private static Path write(Path file, String code) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return Files.writeString(file, code, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IdentifierExportException("Failed to write generated test code to " + file, e);
        }
    }

    /**
     * Source-safe variable name for {@code identifier}, unique within {@code used}.
     */
    static String variableName(String identifier, Set<String> used) {
        StringBuilder sb = new StringBuilder(identifier.length() + 2);
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            sb.append(Character.isLetterOrDigit(c) && c < 128 ? c : '_');
        }
        if (sb.length() == 0 || !Character.isLetter(sb.charAt(0)) || RESERVED_WORDS.contains(sb.toString())) {
            sb.insert(0, "e_");
        }
        String base = sb.toString();
        String candidate = base;
        int suffix = 2;
        while (!used.add(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }
}

package io.hearthwarrio.stableid.core.export;

/**
 * Target test framework of {@link TestScriptExporter}.
 */
public interface ScriptDialect {

    /**
     * File extension including the dot, e.g. {@code .java}.
     */
    String fileExtension();

    /**
     * Lines before the first element. {@code screenContext} may be used for a comment.
     */
    String header(String screenContext);

    /**
     * Statement(s) locating the element and asserting it exists.
     */
    String locate(String variable, String identifier);

    /**
     * Statement performing {@code action} on a located element; empty for {@link ElementAction#NONE}.
     */
    String action(String variable, ElementAction action);

    /**
     * Closing lines.
     */
    String footer();

    /**
     * Stand-alone tap/click one-liner for {@code identifier}.
     */
    String tapAction(String identifier);

    /**
     * Stand-alone text input one-liner for {@code identifier}.
     */
    String textInputAction(String identifier, String text);

    /**
     * Escapes text for a double-quoted string literal.
     */
    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }
}

package io.hearthwarrio.stableid.core;

import java.util.Locale;

/**
 * Turns human-supplied text into identifier components.
 * <p>
 * Rules for label-like text:
 * <ul>
 *   <li>lowercase (root locale)</li>
 *   <li>whitespace runs become one hyphen</li>
 *   <li>only letters, digits, {@code '-'} and {@code '_'} survive; anything else becomes a hyphen</li>
 *   <li>hyphen runs collapse, leading/trailing hyphens are trimmed</li>
 * </ul>
 * So {@code "Add Fuel"} becomes {@code add-fuel}. Text that sanitizes to nothing is replaced by a hash token,
 * and over-long text is cut and suffixed with a hash of the full text, so distinct inputs stay distinct.
 */
public final class IdentifierSanitizer {

    /**
     * Longest component emitted for label-like text.
     */
    public static final int MAX_COMPONENT_LENGTH = 32;

    static final int TRUNCATED_HEAD_LENGTH = 24;
    static final int TRUNCATION_HASH_LENGTH = 7;
    static final int EMPTY_HASH_LENGTH = 8;

    private IdentifierSanitizer() {
        // utility class
    }

    /**
     * Sanitizes a label-like component. Returns an empty string only for null or blank input.
     */
    public static String component(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String cleaned = clean(raw);
        if (cleaned.isEmpty()) {
            return "x" + StableHash.hex(raw, EMPTY_HASH_LENGTH);
        }
        if (cleaned.length() > MAX_COMPONENT_LENGTH) {
            int cut = TRUNCATED_HEAD_LENGTH;
            if (Character.isHighSurrogate(cleaned.charAt(cut - 1))) {
                cut--;
            }
            String head = trimHyphens(cleaned.substring(0, cut));
            return head + "-" + StableHash.hex(raw, TRUNCATION_HASH_LENGTH);
        }
        return cleaned;
    }

    /**
     * Content token used when component names are excluded from identifiers.
     */
    public static String hashToken(String raw) {
        return "h" + StableHash.hex(raw == null ? "" : raw, EMPTY_HASH_LENGTH);
    }

    /**
     * Light treatment for configured segments (namespace, global prefix): case is kept,
     * only whitespace and the separator are replaced so the segment cannot split the identifier.
     */
    public static String configuredSegment(String raw) {
        if (raw == null) {
            return "";
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        return trimmed
                .replaceAll("\\s+", "-")
                .replace(IdentifierGenerator.SEPARATOR, '-');
    }

    static String clean(String raw) {
        String lower = raw.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        boolean pendingHyphen = false;
        int i = 0;
        while (i < lower.length()) {
            int cp = lower.codePointAt(i);
            i += Character.charCount(cp);
            if (Character.isLetterOrDigit(cp) || cp == '_') {
                if (pendingHyphen && sb.length() > 0) {
                    sb.append('-');
                }
                pendingHyphen = false;
                sb.appendCodePoint(cp);
            } else {
                // whitespace, '-', punctuation, symbols
                pendingHyphen = true;
            }
        }
        return sb.toString();
    }

    private static String trimHyphens(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '-') {
            end--;
        }
        return s.substring(start, end);
    }
}

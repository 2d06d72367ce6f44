package io.hearthwarrio.xlocator.core;

/**
 * Identifier canonicalization.
 */
public final class Identifiers {

    private Identifiers() {
    }

    /**
     * Maps every character outside {@code [A-Za-z0-9]} to {@code _}, collapses underscore runs and trims underscores
     * at both ends. The result is empty or matches {@code [A-Za-z0-9]+(_[A-Za-z0-9]+)*}.
     *
     * @param raw raw identifier (may be null)
     * @return canonical identifier
     */
    public static String canonicalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(raw.length());
        boolean pendingUnderscore = false;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (isAsciiAlphanumeric(c)) {
                if (pendingUnderscore && sb.length() > 0) {
                    sb.append('_');
                }
                pendingUnderscore = false;
                sb.append(c);
            } else {
                pendingUnderscore = true;
            }
        }
        return sb.toString();
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}

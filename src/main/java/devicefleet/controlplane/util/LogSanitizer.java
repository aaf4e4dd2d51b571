package devicefleet.controlplane.util;

/**
 * Keeps peer supplied values (request paths, script names, nonces, device identifiers) safe
 * for log statements.
 */
public final class LogSanitizer {

    static final int MAX_LOGGED_LENGTH = 256;

    private static final int MASK_KEEP = 4;

    private LogSanitizer() {
    }

    /**
     * Collapses every run of control or line-separator characters into a single underscore
     * and caps the result at {@value #MAX_LOGGED_LENGTH} characters.
     * Terminal escapes in device log lines and uploaded file names are removed as well.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(Math.min(value.length(), MAX_LOGGED_LENGTH + 3));
        boolean inRun = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (isUnsafe(c)) {
                if (!inRun) {
                    out.append('_');
                    inRun = true;
                }
            } else {
                out.append(c);
                inRun = false;
            }
            if (out.length() >= MAX_LOGGED_LENGTH) {
                if (i < value.length() - 1) {
                    out.append("...");
                }
                break;
            }
        }
        return out.toString();
    }

    /**
     * Masks a nonce or device identifier. Identifiers longer than eight characters keep four
     * characters at each end so log lines from one device can still be correlated.
     */
    public static String maskIdentifier(String identifier) {
        String sanitized = sanitize(identifier);
        if (sanitized.isEmpty()) {
            return "";
        }
        if (sanitized.length() == 1) {
            return "*";
        }
        if (sanitized.length() <= 2 * MASK_KEEP) {
            return sanitized.charAt(0) + "***";
        }
        return sanitized.substring(0, MASK_KEEP) + "..." + sanitized.substring(sanitized.length() - MASK_KEEP);
    }

    private static boolean isUnsafe(char c) {
        int type = Character.getType(c);
        return Character.isISOControl(c)
            || type == Character.LINE_SEPARATOR
            || type == Character.PARAGRAPH_SEPARATOR;
    }
}

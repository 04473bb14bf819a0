package decentralabs.sso.util;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns arbitrary external user names into valid Matrix ID localparts.
 *
 * Allowed localpart characters are {@code a-z 0-9 . _ = - /}. A localpart may not
 * start with an underscore.
 */
public final class MxidLocalpartNormalizer {

    public static final String ALLOWED_CHARACTERS = "_-./=abcdefghijklmnopqrstuvwxyz0123456789";

    private static final Pattern DOT_REPLACE_PATTERN = Pattern.compile("[^" + Pattern.quote(ALLOWED_CHARACTERS) + "]");

    private MxidLocalpartNormalizer() {
    }

    /**
     * Hex-encodes every byte outside the allowed set as {@code =xx}, after lower-casing ASCII letters.
     * '=' itself is escaped so the encoding stays unambiguous, as is a leading underscore.
     *
     * Example: {@code Alice Smith} -> {@code alice=20smith}
     */
    public static String hexEncode(String username) {
        byte[] bytes = username.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length);
        for (byte raw : bytes) {
            int b = raw & 0xff;
            if (b >= 'A' && b <= 'Z') {
                b = b + ('a' - 'A');
            }
            if (b != '=' && b < 0x80 && ALLOWED_CHARACTERS.indexOf(b) >= 0) {
                sb.append((char) b);
            } else {
                sb.append('=').append(String.format("%02x", b));
            }
        }
        if (sb.length() > 0 && sb.charAt(0) == '_') {
            sb.replace(0, 1, "=5f");
        }
        return sb.toString();
    }

    /**
     * Lower-cases the name and replaces every disallowed character with a dot.
     * Lossy: distinct names may map to the same localpart.
     *
     * Example: {@code Alice Smith} -> {@code alice.smith}
     */
    public static String dotReplace(String username) {
        String lowered = username.toLowerCase(Locale.ROOT);
        String replaced = DOT_REPLACE_PATTERN.matcher(lowered).replaceAll(".");
        if (replaced.startsWith("_")) {
            return replaced.substring(1);
        }
        return replaced;
    }

    /**
     * @return true if every character of the localpart is allowed and it does not start with '_'
     */
    public static boolean isValidLocalpart(String localpart) {
        if (localpart == null || localpart.isEmpty() || localpart.startsWith("_")) {
            return false;
        }
        for (int i = 0; i < localpart.length(); i++) {
            if (ALLOWED_CHARACTERS.indexOf(localpart.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
}

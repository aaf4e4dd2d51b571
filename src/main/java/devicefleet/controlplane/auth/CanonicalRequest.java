package devicefleet.controlplane.auth;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.web.util.UriUtils;

/**
 * Builds the path component of the HTTP signature base. Query parameters are sorted by key
 * and then by value, so reordering them cannot produce a second valid signature for the same
 * request, and the signature parameters themselves are left out.
 */
public final class CanonicalRequest {

    public static final String TS_PARAM = "ts";
    public static final String NONCE_PARAM = "nonce";
    public static final String SIGN_PARAM = "sign";

    private static final Set<String> SIGNATURE_PARAMS = Set.of(TS_PARAM, NONCE_PARAM, SIGN_PARAM);

    private CanonicalRequest() {
    }

    /**
     * @param rawPath  request path as received (may be percent-encoded)
     * @param rawQuery raw query string without the leading '?', or null
     * @return decoded path, followed by {@code ?k=v&k=v} for the remaining sorted parameters
     */
    public static String canonicalPath(String rawPath, String rawQuery) {
        String path = rawPath == null || rawPath.isEmpty()
            ? "/"
            : UriUtils.decode(rawPath, StandardCharsets.UTF_8);

        Map<String, List<String>> params = parseQuery(rawQuery);
        SIGNATURE_PARAMS.forEach(params::remove);
        if (params.isEmpty()) {
            return path;
        }

        StringBuilder builder = new StringBuilder(path).append('?');
        boolean first = true;
        for (Map.Entry<String, List<String>> entry : params.entrySet()) {
            List<String> values = entry.getValue();
            Collections.sort(values);
            for (String value : values) {
                if (!first) {
                    builder.append('&');
                }
                first = false;
                builder.append(queryEscape(entry.getKey())).append('=').append(queryEscape(value));
            }
        }
        return builder.toString();
    }

    /**
     * Decodes a raw query string into sorted keys with their values in arrival order.
     */
    public static Map<String, List<String>> parseQuery(String rawQuery) {
        Map<String, List<String>> params = new TreeMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String rawKey = eq >= 0 ? pair.substring(0, eq) : pair;
            String rawValue = eq >= 0 ? pair.substring(eq + 1) : "";
            String key = decodeOrNull(rawKey);
            String value = decodeOrNull(rawValue);
            // malformed escapes drop the pair, as the signing peers do
            if (key == null || value == null) {
                continue;
            }
            params.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }
        return params;
    }

    private static String decodeOrNull(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    /**
     * Form-style escaping where only letters, digits and {@code -_.~} stay literal
     * and spaces become '+'.
     */
    static String queryEscape(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("*", "%2A")
            .replace("%7E", "~");
    }
}

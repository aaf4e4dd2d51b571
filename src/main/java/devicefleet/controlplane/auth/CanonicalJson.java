package devicefleet.controlplane.auth;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import lombok.extern.slf4j.Slf4j;

/**
 * Hashing helpers for signature bases. Message bodies are re-encoded the way device agents
 * encode them before signing: compact, object keys sorted, HTML-sensitive characters and
 * control characters escaped as backslash-u sequences with lowercase hex digits.
 */
@Slf4j
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder(
            new JsonFactoryBuilder()
                .characterEscapes(new PeerCompatibleEscapes())
                .disable(JsonWriteFeature.WRITE_HEX_UPPER_CASE)
                .build())
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();

    private CanonicalJson() {
    }

    /**
     * Hex SHA-256 of {@code data}, or the empty string when there is no data.
     */
    public static String sha256Hex(byte[] data) {
        if (data == null || data.length == 0) {
            return "";
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    public static String sha256Hex(String data) {
        return data == null ? "" : sha256Hex(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Hex SHA-256 of the canonical encoding of {@code body}; empty when the body is absent
     * or cannot be encoded.
     */
    public static String hashBody(Object body) {
        if (body == null) {
            return "";
        }
        try {
            return sha256Hex(encode(body));
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.debug("Message body not encodable, hashing as empty: {}", ex.getMessage());
            return "";
        }
    }

    static byte[] encode(Object body) throws JsonProcessingException {
        // JsonNode and POJO bodies become plain maps first so key ordering applies to them too
        Object tree = MAPPER.convertValue(body, Object.class);
        return MAPPER.writeValueAsBytes(tree);
    }

    private static final class PeerCompatibleEscapes extends CharacterEscapes {

        private static final long serialVersionUID = 1L;

        private final int[] asciiEscapes;

        PeerCompatibleEscapes() {
            asciiEscapes = standardAsciiEscapesForJSON();
            asciiEscapes['<'] = ESCAPE_CUSTOM;
            asciiEscapes['>'] = ESCAPE_CUSTOM;
            asciiEscapes['&'] = ESCAPE_CUSTOM;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return switch (ch) {
                case '<' -> new SerializedString("\\u003c");
                case '>' -> new SerializedString("\\u003e");
                case '&' -> new SerializedString("\\u0026");
                case 0x2028 -> new SerializedString("\\u2028");
                case 0x2029 -> new SerializedString("\\u2029");
                default -> null;
            };
        }
    }
}

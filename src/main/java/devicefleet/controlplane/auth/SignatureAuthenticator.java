package devicefleet.controlplane.auth;

import devicefleet.controlplane.config.AuthProperties;
import devicefleet.controlplane.util.LogSanitizer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Verifies HMAC-SHA256 signatures on controller HTTP requests and channel messages.
 *
 * <p>A call is accepted when its timestamp lies within the configured skew of the server clock,
 * the signature matches the canonical base string, and its nonce has not been consumed in the
 * channel's namespace. Any failure is a plain rejection.
 *
 * <pre>
 * HTTP:    "{ts}\n{nonce}\n{method}\n{canonicalPath}\n{sha256hex(body)}"
 * message: "{ts}\n{nonce}\n{type}\n{sha256hex(jsonBody)}"
 * </pre>
 */
@Service
@Slf4j
public class SignatureAuthenticator {

    public static final String HTTP_NAMESPACE = "http";
    public static final String MESSAGE_NAMESPACE = "ws";

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final NonceLedger nonceLedger;
    private final Clock clock;
    private final byte[] secret;
    private final long skewSeconds;
    private final boolean debug;

    public SignatureAuthenticator(AuthProperties properties, NonceLedger nonceLedger, Clock clock) {
        this.nonceLedger = nonceLedger;
        this.clock = clock;
        this.secret = properties.getSharedSecret() == null
            ? new byte[0]
            : properties.getSharedSecret().getBytes(StandardCharsets.UTF_8);
        this.skewSeconds = properties.getClockSkew().getSeconds();
        this.debug = properties.isDebug();
        if (secret.length == 0) {
            log.warn("control.auth.shared-secret is empty; signatures are keyed with an empty secret");
        }
    }

    public boolean isTimestampValid(long ts) {
        if (ts == 0) {
            return false;
        }
        long now = clock.instant().getEpochSecond();
        return ts >= now - skewSeconds && ts <= now + skewSeconds;
    }

    /**
     * @param canonicalPath result of {@link CanonicalRequest#canonicalPath(String, String)}
     * @param body          raw request body, empty or null when the request has none
     */
    public boolean verifyHttpRequest(long ts, String nonce, String sign, String method,
                                     String canonicalPath, byte[] body) {
        if (!isTimestampValid(ts)) {
            debugAuth("HTTP timestamp rejected: ts={} method={} path={}", ts, method,
                LogSanitizer.sanitize(canonicalPath));
            return false;
        }
        String bodyHash = CanonicalJson.sha256Hex(body);
        String expected = computeSignatureHex(httpSignatureBase(ts, nonce, method, canonicalPath, bodyHash));
        if (!signaturesMatch(expected, sign)) {
            debugAuth("HTTP signature mismatch: method={} path={} ts={} nonce={} expected={} got={} bodyHash={}",
                method, LogSanitizer.sanitize(canonicalPath), ts, LogSanitizer.sanitize(nonce),
                expected, LogSanitizer.sanitize(sign), bodyHash);
            return false;
        }
        return nonceLedger.checkAndStore(HTTP_NAMESPACE, nonce);
    }

    public boolean verifyMessage(SignedMessage message) {
        if (message == null) {
            return false;
        }
        if (!isTimestampValid(message.ts())) {
            debugAuth("Message timestamp rejected: ts={} type={}", message.ts(),
                LogSanitizer.sanitize(message.type()));
            return false;
        }
        String bodyHash = CanonicalJson.hashBody(message.body());
        String expected = computeSignatureHex(
            messageSignatureBase(message.ts(), message.nonce(), message.type(), bodyHash));
        if (!signaturesMatch(expected, message.sign())) {
            debugAuth("Message signature mismatch: type={} ts={} nonce={} expected={} got={} bodyHash={}",
                LogSanitizer.sanitize(message.type()), message.ts(), LogSanitizer.sanitize(message.nonce()),
                expected, LogSanitizer.sanitize(message.sign()), bodyHash);
            return false;
        }
        return nonceLedger.checkAndStore(MESSAGE_NAMESPACE, message.nonce());
    }

    public static String httpSignatureBase(long ts, String nonce, String method, String canonicalPath,
                                           String bodyHash) {
        return ts + "\n" + nullToEmpty(nonce) + "\n" + nullToEmpty(method) + "\n"
            + nullToEmpty(canonicalPath) + "\n" + nullToEmpty(bodyHash);
    }

    public static String messageSignatureBase(long ts, String nonce, String type, String bodyHash) {
        return ts + "\n" + nullToEmpty(nonce) + "\n" + nullToEmpty(type) + "\n" + nullToEmpty(bodyHash);
    }

    public String computeSignatureHex(String signatureBase) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            // an empty key is not accepted by SecretKeySpec
            byte[] key = secret.length == 0 ? new byte[1] : secret;
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            byte[] signature = mac.doFinal(signatureBase.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(signature);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", ex);
        }
    }

    private static boolean signaturesMatch(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            actual.getBytes(StandardCharsets.UTF_8));
    }

    private void debugAuth(String format, Object... args) {
        if (debug) {
            log.info(format, args);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

package devicefleet.controlplane.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Channel message exchanged with devices and controllers. {@code body} is kept as the
 * generic JSON tree (maps, lists, scalars) it was decoded into so it can be re-encoded
 * for signature checks.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SignedMessage(
    String type,
    Object body,
    long ts,
    String nonce,
    String sign,
    String udid,
    String error
) {

    public SignedMessage(String type, Object body, long ts, String nonce, String sign) {
        this(type, body, ts, nonce, sign, null, null);
    }
}

package devicefleet.controlplane.script;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TransferAcknowledgement Tests")
class TransferAcknowledgementTest {

    @Test
    @DisplayName("Should read a current acknowledgement")
    void shouldParseCurrentFormat() {
        assertThat(TransferAcknowledgement.fromBody(Map.of("deploymentId", "d-1", "success", true)))
            .contains(new TransferAcknowledgement("d-1", "", true, ""));
    }

    @Test
    @DisplayName("Should accept the legacy request id keys")
    void shouldAcceptLegacyKeys() {
        assertThat(TransferAcknowledgement.fromBody(Map.of("requestId", "d-1", "success", "true")))
            .map(TransferAcknowledgement::deploymentId).contains("d-1");
        assertThat(TransferAcknowledgement.fromBody(Map.of("requestID", " d-2 ", "success", 1)))
            .map(TransferAcknowledgement::deploymentId).contains("d-2");
    }

    @Test
    @DisplayName("Should carry the device error of a failed transfer")
    void shouldCarryError() {
        Map<String, Object> body = new HashMap<>();
        body.put("deploymentId", "d-1");
        body.put("success", false);
        body.put("error", "disk full");

        assertThat(TransferAcknowledgement.fromBody(body))
            .contains(new TransferAcknowledgement("d-1", "", false, "disk full"));
    }

    @Test
    @DisplayName("Should accept a report that only names the fetched file")
    void shouldAcceptPathOnlyReport() {
        assertThat(TransferAcknowledgement.fromBody(Map.of("targetPath", " lua/scripts/big.lua ", "success", true)))
            .hasValueSatisfying(ack -> {
                assertThat(ack.isPathOnly()).isTrue();
                assertThat(ack.targetPath()).isEqualTo("lua/scripts/big.lua");
                assertThat(ack.success()).isTrue();
            });
        assertThat(TransferAcknowledgement.fromBody(Map.of("deploymentId", "d-1", "targetPath", "a.lua")))
            .map(TransferAcknowledgement::isPathOnly).contains(false);
    }

    @Test
    @DisplayName("Should ignore bodies without a deployment id or file path")
    void shouldIgnoreMissingId() {
        assertThat(TransferAcknowledgement.fromBody(Map.of("success", true))).isEmpty();
        assertThat(TransferAcknowledgement.fromBody(Map.of("targetPath", " "))).isEmpty();
        assertThat(TransferAcknowledgement.fromBody(Map.of("deploymentId", " "))).isEmpty();
        assertThat(TransferAcknowledgement.fromBody(List.of("d-1"))).isEmpty();
        assertThat(TransferAcknowledgement.fromBody(null)).isEmpty();
    }

    @Test
    @DisplayName("Should read success from booleans, strings and numbers")
    void shouldParseSuccessVariants() {
        assertThat(TransferAcknowledgement.parseSuccess(Boolean.TRUE)).isTrue();
        assertThat(TransferAcknowledgement.parseSuccess(" TRUE ")).isTrue();
        assertThat(TransferAcknowledgement.parseSuccess("yes")).isFalse();
        assertThat(TransferAcknowledgement.parseSuccess(1.0)).isTrue();
        assertThat(TransferAcknowledgement.parseSuccess(0)).isFalse();
        assertThat(TransferAcknowledgement.parseSuccess(null)).isFalse();
    }
}

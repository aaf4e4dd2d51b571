package devicefleet.controlplane.script;

import java.util.Map;
import java.util.Optional;

/**
 * Device report that a pushed package (or one of its staged files) was received.
 * Older agents send {@code requestId}/{@code requestID} instead of {@code deploymentId}, and
 * {@code success} as a boolean, a "true"/"false" string, or a number. The oldest agents send
 * no id at all and only name the file they fetched in {@code targetPath}.
 *
 * @param deploymentId deployment the report belongs to; empty for path-only reports
 * @param targetPath   device path of the fetched file; may be empty
 */
public record TransferAcknowledgement(String deploymentId, String targetPath, boolean success, String error) {

    public static Optional<TransferAcknowledgement> fromBody(Object body) {
        if (!(body instanceof Map<?, ?> map)) {
            return Optional.empty();
        }
        String deploymentId = firstText(map, "deploymentId", "requestId", "requestID");
        String targetPath = firstText(map, "targetPath");
        if (deploymentId.isEmpty() && targetPath.isEmpty()) {
            return Optional.empty();
        }
        Object error = map.get("error");
        return Optional.of(new TransferAcknowledgement(
            deploymentId,
            targetPath,
            parseSuccess(map.get("success")),
            error instanceof String text ? text : ""));
    }

    public boolean isPathOnly() {
        return deploymentId.isEmpty();
    }

    static boolean parseSuccess(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            return text.trim().equalsIgnoreCase("true");
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        return false;
    }

    private static String firstText(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            if (map.get(key) instanceof String text && !text.isBlank()) {
                return text.trim();
            }
        }
        return "";
    }
}

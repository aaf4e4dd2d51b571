package devicefleet.controlplane.event;

import java.util.Set;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a multi-device script start is cancelled because its targets did not
 * report within the configured wait.
 */
@Getter
public class ScriptStartTimedOutEvent extends ApplicationEvent {

    private final String deploymentId;
    private final Set<String> outstandingTargets;
    private final String reason;

    public ScriptStartTimedOutEvent(Object source, String deploymentId, Set<String> outstandingTargets, String reason) {
        super(source);
        this.deploymentId = deploymentId;
        this.outstandingTargets = Set.copyOf(outstandingTargets);
        this.reason = reason;
    }
}

package devicefleet.controlplane.config;

import devicefleet.controlplane.script.DeviceGateway;
import devicefleet.controlplane.script.NoopDeviceGateway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DeviceGatewayConfig {

    @Bean
    @ConditionalOnMissingBean(DeviceGateway.class)
    public DeviceGateway noopDeviceGateway() {
        return new NoopDeviceGateway();
    }
}

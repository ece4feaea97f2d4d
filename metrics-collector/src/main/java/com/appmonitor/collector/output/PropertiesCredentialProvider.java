package com.appmonitor.collector.output;

import com.appmonitor.collector.config.AppMonitorProperties;
import com.appmonitor.collector.model.Platform;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Serves vendor credentials from {@code app-monitor.credentials.<platform>}. Values are
 * expected to be resolved already (environment placeholders or an external secret source).
 */
@Component
@RequiredArgsConstructor
public class PropertiesCredentialProvider implements CredentialProvider {

    private final AppMonitorProperties properties;

    @Override
    public Map<String, String> getPlatformConfig(Platform platform) {
        Map<String, String> config = properties.getCredentials().get(platform.key());
        return config != null ? Map.copyOf(config) : Map.of();
    }
}

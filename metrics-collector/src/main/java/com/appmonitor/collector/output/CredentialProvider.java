package com.appmonitor.collector.output;

import com.appmonitor.collector.model.Platform;

import java.util.Map;

public interface CredentialProvider {

    /**
     * Decrypted key/value settings for a platform's vendor account; empty when none are configured.
     */
    Map<String, String> getPlatformConfig(Platform platform);
}

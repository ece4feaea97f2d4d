package com.appmonitor.collector.service;

import com.appmonitor.collector.config.AppMonitorProperties;
import com.appmonitor.collector.exception.ConfigurationException;
import com.appmonitor.collector.model.Platform;
import com.appmonitor.collector.output.CredentialProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestTemplate;

import java.security.KeyPairGenerator;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.util.Base64;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VendorClientFactoryTest {

    private static String privateKey;

    @Mock
    private CredentialProvider credentialProvider;

    @Mock
    private SegmentDownloader segmentDownloader;

    private VendorClientFactory factory;

    @BeforeAll
    static void generateKey() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec("secp256r1"));
        privateKey = Base64.getEncoder().encodeToString(generator.generateKeyPair().getPrivate().getEncoded());
    }

    @BeforeEach
    void setUp() {
        AppMonitorProperties properties = new AppMonitorProperties();
        factory = new VendorClientFactory(credentialProvider, new RestTemplate(), new RetryableHttp(properties),
                new ObjectMapper(), segmentDownloader, new InstallReportProcessor(),
                new OverviewCsvParser(), properties, Clock.systemUTC());
    }

    @Test
    void testReportClient_ReusedWhileCredentialsUnchanged() {
        // Given
        when(credentialProvider.getPlatformConfig(Platform.IOS))
                .thenReturn(credentials("KEY1"), credentials("KEY1"), credentials("KEY2"));

        // When
        AppStoreReportClient first = factory.reportClient();
        AppStoreReportClient second = factory.reportClient();
        AppStoreReportClient rotated = factory.reportClient();

        // Then
        assertSame(first, second);
        assertNotSame(first, rotated);
    }

    @Test
    void testReportClient_MissingCredential() {
        // Given
        when(credentialProvider.getPlatformConfig(Platform.IOS)).thenReturn(Map.of("issuer_id", "issuer"));

        // When
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> factory.reportClient());

        // Then
        assertEquals("Missing ios credential 'key_id'", e.getMessage());
    }

    @Test
    void testBulkClient_MissingServiceAccount() {
        when(credentialProvider.getPlatformConfig(Platform.ANDROID)).thenReturn(Map.of());
        assertThrows(ConfigurationException.class, () -> factory.bulkClient());
    }

    private static Map<String, String> credentials(String keyId) {
        return Map.of("issuer_id", "issuer", "key_id", keyId, "private_key", privateKey);
    }
}

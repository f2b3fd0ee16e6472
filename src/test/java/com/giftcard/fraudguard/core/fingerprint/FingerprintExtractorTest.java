package com.giftcard.fraudguard.core.fingerprint;

import com.giftcard.fraudguard.config.FraudGuardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FingerprintExtractor: client IP resolution and device identity.
 */
class FingerprintExtractorTest {

    private static final String CHROME_UA = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) Chrome/124.0.0.0";

    private FingerprintExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new FingerprintExtractor(new FraudGuardProperties());
    }

    @Test
    void usesFirstForwardedForAddress() {
        RequestMetadata metadata = RequestMetadata.builder()
                .remoteAddress("10.0.0.1")
                .header("X-Forwarded-For", "203.0.113.7, 10.0.0.2")
                .header("X-Real-IP", "198.51.100.1")
                .build();

        assertThat(extractor.extract(metadata).getIp()).isEqualTo("203.0.113.7");
    }

    @Test
    void fallsBackToRealIpThenRemoteAddress() {
        RequestMetadata realIp = RequestMetadata.builder()
                .remoteAddress("10.0.0.1")
                .header("x-real-ip", "198.51.100.1")
                .build();
        RequestMetadata remoteOnly = RequestMetadata.builder().remoteAddress("10.0.0.1").build();
        RequestMetadata nothing = RequestMetadata.builder().build();

        assertThat(extractor.extract(realIp).getIp()).isEqualTo("198.51.100.1");
        assertThat(extractor.extract(remoteOnly).getIp()).isEqualTo("10.0.0.1");
        assertThat(extractor.extract(nothing).getIp()).isEqualTo("unknown");
    }

    @Test
    void forwardedHeadersFromUntrustedPeerAreIgnored() {
        FraudGuardProperties properties = new FraudGuardProperties();
        properties.getFingerprint().setTrustedProxies(List.of(" 10.0.0.1 "));
        FingerprintExtractor behindProxy = new FingerprintExtractor(properties);

        RequestMetadata viaProxy = RequestMetadata.builder()
                .remoteAddress("10.0.0.1")
                .header("X-Forwarded-For", "203.0.113.7")
                .build();
        RequestMetadata spoofed = RequestMetadata.builder()
                .remoteAddress("198.51.100.50")
                .header("X-Forwarded-For", "203.0.113.99")
                .header("X-Real-IP", "203.0.113.98")
                .build();

        assertThat(behindProxy.extract(viaProxy).getIp()).isEqualTo("203.0.113.7");
        assertThat(behindProxy.extract(spoofed).getIp()).isEqualTo("198.51.100.50");
    }

    @Test
    void explicitDeviceHeaderGivesHighConfidence() {
        RequestMetadata metadata = RequestMetadata.builder()
                .remoteAddress("10.0.0.1")
                .header(FingerprintExtractor.DEVICE_HEADER, "device-abc")
                .header("User-Agent", CHROME_UA)
                .build();

        Fingerprint fingerprint = extractor.extract(metadata);

        assertThat(fingerprint.getDeviceId()).isEqualTo("device-abc");
        assertThat(fingerprint.getConfidence()).isEqualTo(FingerprintConfidence.HIGH);
        assertThat(fingerprint.getUserAgent()).isEqualTo(CHROME_UA);
    }

    @Test
    void derivedDeviceIdIsStableAcrossIpChanges() {
        RequestMetadata first = RequestMetadata.builder()
                .remoteAddress("10.0.0.1")
                .header("User-Agent", CHROME_UA)
                .header("Accept-Language", "en-US")
                .build();
        RequestMetadata second = RequestMetadata.builder()
                .remoteAddress("10.9.9.9")
                .header("User-Agent", CHROME_UA)
                .header("Accept-Language", "en-US")
                .build();

        Fingerprint a = extractor.extract(first);
        Fingerprint b = extractor.extract(second);

        assertThat(a.getDeviceId()).isEqualTo(b.getDeviceId()).hasSize(32);
        assertThat(a.getConfidence()).isEqualTo(FingerprintConfidence.LOW);
        assertThat(a.getIp()).isNotEqualTo(b.getIp());
    }

    @Test
    void noHeadersDegradesConfidenceButStillProducesIdentity() {
        Fingerprint fingerprint = extractor.extract(RequestMetadata.builder().remoteAddress("10.0.0.1").build());

        assertThat(fingerprint.getConfidence()).isEqualTo(FingerprintConfidence.DEGRADED);
        assertThat(fingerprint.getDeviceId()).isNotBlank();
        assertThat(fingerprint.getUserAgent()).isNull();
    }

    @Test
    void oversizedDeviceHeaderIsTruncated() {
        RequestMetadata metadata = RequestMetadata.builder()
                .header(FingerprintExtractor.DEVICE_HEADER, "d".repeat(300))
                .build();

        assertThat(extractor.extract(metadata).getDeviceId()).hasSize(128);
    }
}

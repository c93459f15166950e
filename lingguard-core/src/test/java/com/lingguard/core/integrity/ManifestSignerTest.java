package com.lingguard.core.integrity;

import com.lingguard.api.manifest.PluginManifest;
import com.lingguard.core.TestManifests;
import com.lingguard.core.config.SecurityConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ManifestSigner 单元测试")
class ManifestSignerTest {

    private final ContentHasher hasher = new ContentHasher();
    private final ManifestSigner signer = new ManifestSigner(SecurityConfig.defaults(), hasher,
            Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("签名应写入哈希、签名与来源")
    void signShouldFillProvenance() {
        PluginManifest original = TestManifests.amazonOrders().build();

        PluginManifest signed = signer.sign(original);

        assertEquals(hasher.hash(original), signed.getContentHash());
        assertEquals("lingguard.official", signed.getSource());
        assertEquals(ManifestSigner.SIGNATURE_ALGORITHM, signed.getSignature().getAlgorithm());
        assertEquals("v1", signed.getSignature().getVersion());
        assertEquals("2024-05-01T10:00:00Z", signed.getSignature().getTimestamp());
        assertTrue(signed.getSignature().getValue().matches("sha256:[0-9a-f]{64}"));
    }

    @Test
    @DisplayName("原清单保持不变")
    void originalShouldStayUntouched() {
        PluginManifest original = TestManifests.amazonOrders().build();

        signer.sign(original);

        assertNull(original.getSignature());
        assertNull(original.getContentHash());
        assertNull(original.getSource());
    }

    @Test
    @DisplayName("同一时刻对同一清单的签名相同")
    void signatureShouldBeReproducible() {
        PluginManifest original = TestManifests.amazonOrders().build();

        assertEquals(signer.sign(original).getSignature(), signer.sign(original).getSignature());
    }
}

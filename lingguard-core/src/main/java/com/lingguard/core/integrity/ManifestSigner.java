package com.lingguard.core.integrity;

import com.lingguard.api.manifest.ManifestSignature;
import com.lingguard.api.manifest.PluginManifest;
import com.lingguard.core.config.SecurityConfig;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;

/**
 * 为宿主自己发布的清单生成来源信息
 * <p>
 * 写入内容哈希、结构签名（{@code sha256:<64位十六进制>}）与发布来源。
 * 签名只满足结构校验，不是密码学签名。
 * </p>
 */
@Slf4j
public class ManifestSigner {

    public static final String SIGNATURE_ALGORITHM = "RSA-SHA256";

    private final SecurityConfig config;
    private final ContentHasher hasher;
    private final Clock clock;

    public ManifestSigner(SecurityConfig config, ContentHasher hasher) {
        this(config, hasher, Clock.systemUTC());
    }

    public ManifestSigner(SecurityConfig config, ContentHasher hasher, Clock clock) {
        this.config = config;
        this.hasher = hasher;
        this.clock = clock;
    }

    /**
     * 返回带有来源信息的新清单，原清单不变
     */
    public PluginManifest sign(PluginManifest manifest) {
        String contentHash = hasher.hash(manifest);
        String timestamp = clock.instant().toString();
        String payload = manifest.getId() + ":" + manifest.getVersion() + ":" + contentHash + ":" + timestamp;

        ManifestSignature signature = ManifestSignature.builder()
                .value("sha256:" + sha256Hex(payload))
                .algorithm(SIGNATURE_ALGORITHM)
                .version(config.getSignatureVersion())
                .timestamp(timestamp)
                .build();

        log.info("[Signer] Signed manifest {} ({}) for source {}",
                manifest.getId(), manifest.getVersion(), config.getPublisherSource());
        return manifest.toBuilder()
                .contentHash(contentHash)
                .signature(signature)
                .source(config.getPublisherSource())
                .build();
    }

    private static String sha256Hex(String payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ContentHasher.HASH_ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Digest algorithm unavailable: " + ContentHasher.HASH_ALGORITHM, e);
        }
    }
}

package com.github.raff.webhook.normalize;

import com.github.raff.webhook.domain.model.Platform;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Looks up the normalizer registered for a platform. */
@Component
public class NormalizerRegistry {

    private final Map<Platform, PlatformWebhookNormalizer> byPlatform = new EnumMap<>(Platform.class);

    public NormalizerRegistry(List<PlatformWebhookNormalizer> normalizers) {
        for (PlatformWebhookNormalizer n : normalizers) {
            PlatformWebhookNormalizer previous = byPlatform.put(n.platform(), n);
            if (previous != null) {
                throw new IllegalStateException("Duplicate normalizer for " + n.platform());
            }
        }
    }

    public PlatformWebhookNormalizer forPlatform(Platform platform) {
        PlatformWebhookNormalizer n = byPlatform.get(platform);
        if (n == null) {
            throw new IllegalStateException("No normalizer registered for " + platform);
        }
        return n;
    }
}

package com.github.raff.webhook.attribution;

import com.github.raff.webhook.config.WebhookProperties;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ReferrerCodePolicyTest {

    private final ReferrerCodePolicy policy = new ReferrerCodePolicy(new WebhookProperties());

    @ParameterizedTest
    @ValueSource(strings = {"RAFF-AB12CD", "raff_abc", "raff:m1:c9", "click_9f8e7d", " RAFF-AB12CD "})
    void acceptsTrackingCodes(String code) {
        assertThat(policy.isValid(code)).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"newsletter", "RAFF-", "raff-has space", "google.com", "RAFF-<script>"})
    void rejectsEverythingElse(String code) {
        assertThat(policy.isValid(code)).isFalse();
    }
}

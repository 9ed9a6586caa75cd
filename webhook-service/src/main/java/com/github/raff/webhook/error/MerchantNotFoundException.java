package com.github.raff.webhook.error;

import com.github.raff.webhook.domain.model.Platform;
import java.util.Map;
import org.springframework.http.HttpStatus;

public class MerchantNotFoundException extends WebhookException {

    private final String storeId;

    public MerchantNotFoundException(Platform platform, String storeId) {
        super(HttpStatus.NOT_FOUND, "MERCHANT_NOT_FOUND",
                "Merchant not found for " + platform.path() + " store " + storeId);
        this.storeId = storeId;
    }

    @Override
    public Map<String, String> getDetails() {
        return storeId == null ? Map.of() : Map.of("storeId", storeId);
    }
}

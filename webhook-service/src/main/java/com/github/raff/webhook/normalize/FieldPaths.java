package com.github.raff.webhook.normalize;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Candidate dotted paths per field, tried in order. */
@Value
@Builder
public class FieldPaths {
    @Singular("eventType") List<String> eventTypes;
    @Singular("orderId") List<String> orderIds;
    @Singular("storeId") List<String> storeIds;
    @Singular("appStoreId") List<String> appStoreIds;
    @Singular("productId") List<String> productIds;
    @Singular("total") List<String> totals;
    @Singular("currency") List<String> currencies;
    @Singular("referrer") List<String> referrers;
    @Singular("paymentStatus") List<String> paymentStatuses;
    @Singular("orderStatus") List<String> orderStatuses;
    @Singular("createdAt") List<String> createdAts;
    @Singular("updatedAt") List<String> updatedAts;

    static String[] array(List<String> paths) {
        return paths.toArray(String[]::new);
    }
}
